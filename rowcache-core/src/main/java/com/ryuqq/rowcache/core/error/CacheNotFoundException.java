package com.ryuqq.rowcache.core.error;

/**
 * 캐시 항목이 없거나 만료되었거나, 백엔드가 지원하지 않는 연산.
 *
 * <p>없는 키, 없는 Map 필드, 필드가 하나도 없는 Map, 미지원 List 연산이
 * 모두 이 예외 하나로 표현됩니다. 호출자는 어떤 호출을 했는지로 원인을 구분해야 합니다.</p>
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
public class CacheNotFoundException extends CacheException {

    public CacheNotFoundException(String message) {
        super(message);
    }

    /**
     * 키가 없거나 만료된 경우의 예외 생성.
     *
     * @param key 조회한 키
     * @return CacheNotFoundException 인스턴스
     */
    public static CacheNotFoundException key(String key) {
        return new CacheNotFoundException("cache not found: " + key);
    }

    /**
     * Map 필드가 없는 경우의 예외 생성.
     *
     * @param key Map 키
     * @param field 필드명
     * @return CacheNotFoundException 인스턴스
     */
    public static CacheNotFoundException field(String key, String field) {
        return new CacheNotFoundException("cache not found: " + key + "#" + field);
    }

    /**
     * 백엔드가 지원하지 않는 연산인 경우의 예외 생성.
     *
     * @param operation 연산명 (예: LPUSH)
     * @return CacheNotFoundException 인스턴스
     */
    public static CacheNotFoundException unsupported(String operation) {
        return new CacheNotFoundException("cache not found: " + operation + " is not supported by this backend");
    }
}
