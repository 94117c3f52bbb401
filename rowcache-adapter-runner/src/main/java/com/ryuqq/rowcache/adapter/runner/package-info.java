/**
 * 프로세스 구성과 백그라운드 데몬.
 *
 * <p>{@link com.ryuqq.rowcache.adapter.runner.CacheRuntime}이 백엔드, 레지스트리,
 * {@link com.ryuqq.rowcache.adapter.runner.ExpiryReaper}를 묶습니다.</p>
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
package com.ryuqq.rowcache.adapter.runner;
