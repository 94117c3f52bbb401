/**
 * 캐시 예외 계층.
 *
 * <p>모든 예외는 {@link com.ryuqq.rowcache.core.error.CacheException}을 루트로 하는 unchecked 예외입니다.</p>
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
package com.ryuqq.rowcache.core.error;
