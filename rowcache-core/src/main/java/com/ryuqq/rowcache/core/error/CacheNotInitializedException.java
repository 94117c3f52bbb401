package com.ryuqq.rowcache.core.error;

/**
 * 캐시 백엔드가 등록되기 전에 사용된 경우.
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
public class CacheNotInitializedException extends CacheException {

    public CacheNotInitializedException() {
        super("cache not init");
    }
}
