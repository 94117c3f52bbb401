/**
 * Service Provider Interfaces implemented by cache backends.
 *
 * <ul>
 *   <li>{@link com.ryuqq.rowcache.core.spi.CacheClient} - capability contract</li>
 *   <li>{@link com.ryuqq.rowcache.core.spi.CacheContext} - transaction handle</li>
 *   <li>{@link com.ryuqq.rowcache.core.spi.ExpiredEntryPurger} - reaper hook</li>
 *   <li>{@link com.ryuqq.rowcache.core.spi.MessageCursorStore} - subscription storage</li>
 * </ul>
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
package com.ryuqq.rowcache.core.spi;
