package com.ryuqq.rowcache.core.error;

/**
 * 캐시 계층의 모든 실패를 나타내는 최상위 예외.
 *
 * <p>호출자는 개별 하위 타입으로 실패 원인을 구분합니다:</p>
 * <ul>
 *   <li>{@link CacheNotInitializedException}: 등록된 백엔드 없음</li>
 *   <li>{@link CacheNotFoundException}: 키/필드 없음, 만료, 미지원 연산</li>
 *   <li>{@link CacheStoreException}: 하부 저장소 실패</li>
 *   <li>{@link CacheValidationException}: 잘못된 호출 인자 또는 저장된 값</li>
 * </ul>
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
public class CacheException extends RuntimeException {

    public CacheException(String message) {
        super(message);
    }

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
