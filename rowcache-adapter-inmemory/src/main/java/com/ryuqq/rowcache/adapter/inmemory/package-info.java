/**
 * In-memory cache backend.
 *
 * <p>{@link com.ryuqq.rowcache.adapter.inmemory.InMemoryCacheClient} implements the capability
 * contract, the reaper hook and the subscription cursor store in one process-local object.</p>
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
package com.ryuqq.rowcache.adapter.inmemory;
