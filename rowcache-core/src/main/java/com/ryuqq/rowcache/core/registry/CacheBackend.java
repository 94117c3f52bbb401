package com.ryuqq.rowcache.core.registry;

import java.util.Locale;
import java.util.Map;

/**
 * 캐시 백엔드 종류.
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
public enum CacheBackend {

    /**
     * 관계형 저장소 백엔드 (기본값).
     */
    JDBC,

    /**
     * 프로세스 로컬 인메모리 백엔드.
     */
    MEMORY;

    /**
     * 백엔드 선택 환경 변수명.
     */
    public static final String ENV_VAR = "CACHE_BACKEND";

    /**
     * 이름으로 백엔드 선택 (대소문자 무시).
     *
     * <p>null 또는 빈 문자열이면 {@link #JDBC}를 반환합니다.
     * "oceanbase", "mysql", "jdbc"는 모두 {@link #JDBC}, "memory", "inmemory"는 {@link #MEMORY}입니다.</p>
     *
     * @param name 백엔드 이름
     * @return 백엔드
     * @throws IllegalArgumentException 알 수 없는 이름인 경우
     */
    public static CacheBackend fromName(String name) {
        if (name == null || name.isBlank()) {
            return JDBC;
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "jdbc":
            case "mysql":
            case "oceanbase":
                return JDBC;
            case "memory":
            case "inmemory":
                return MEMORY;
            default:
                throw new IllegalArgumentException("Unknown cache backend: " + name);
        }
    }

    /**
     * 환경 변수 {@value #ENV_VAR}로 백엔드 선택.
     *
     * @param environment 환경 변수 맵 (보통 {@code System.getenv()})
     * @return 백엔드
     */
    public static CacheBackend fromEnvironment(Map<String, String> environment) {
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }
        return fromName(environment.get(ENV_VAR));
    }
}
