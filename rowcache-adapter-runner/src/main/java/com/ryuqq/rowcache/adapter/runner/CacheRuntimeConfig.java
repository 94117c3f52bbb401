package com.ryuqq.rowcache.adapter.runner;

import com.ryuqq.rowcache.adapter.jdbc.JdbcCacheConfig;
import com.ryuqq.rowcache.adapter.jdbc.JdbcDataSourceConfig;
import com.ryuqq.rowcache.core.registry.CacheBackend;

/**
 * CacheRuntime 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>backend: 사용할 백엔드 (JDBC / MEMORY)</li>
 *   <li>dataSource: 커넥션 풀 설정 (JDBC 백엔드에서 필수)</li>
 *   <li>jdbc: JDBC 백엔드 설정 (구독 설정은 MEMORY 백엔드도 사용)</li>
 *   <li>reaper: 만료 정리 주기 설정</li>
 *   <li>createSchema: 시작 시 캐시 테이블 생성 여부 (기본 true)</li>
 * </ul>
 *
 * @author Rowcache Team
 * @since 1.0.0
 * @param backend 백엔드 (null이 아니어야 함)
 * @param dataSource 커넥션 풀 설정 (MEMORY이면 null 허용)
 * @param jdbc JDBC 백엔드 설정 (null이 아니어야 함)
 * @param reaper 만료 정리 설정 (null이 아니어야 함)
 * @param createSchema 테이블 생성 여부
 */
public record CacheRuntimeConfig(
    CacheBackend backend,
    JdbcDataSourceConfig dataSource,
    JdbcCacheConfig jdbc,
    ExpiryReaperConfig reaper,
    boolean createSchema
) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CacheRuntimeConfig {
        if (backend == null) {
            throw new IllegalArgumentException("backend cannot be null");
        }
        if (backend == CacheBackend.JDBC && dataSource == null) {
            throw new IllegalArgumentException("dataSource cannot be null for backend JDBC");
        }
        if (jdbc == null) {
            throw new IllegalArgumentException("jdbc cannot be null");
        }
        if (reaper == null) {
            throw new IllegalArgumentException("reaper cannot be null");
        }
    }

    /**
     * 관계형 저장소 백엔드 기본 설정.
     *
     * @param dataSource 커넥션 풀 설정
     * @return JDBC 설정
     */
    public static CacheRuntimeConfig jdbc(JdbcDataSourceConfig dataSource) {
        return new CacheRuntimeConfig(
            CacheBackend.JDBC, dataSource, new JdbcCacheConfig(), new ExpiryReaperConfig(), true);
    }

    /**
     * 프로세스 로컬 백엔드 기본 설정.
     *
     * @return MEMORY 설정
     */
    public static CacheRuntimeConfig memory() {
        return new CacheRuntimeConfig(
            CacheBackend.MEMORY, null, new JdbcCacheConfig(), new ExpiryReaperConfig(), false);
    }

    /**
     * backend만 변경한 새 인스턴스 생성.
     */
    public CacheRuntimeConfig withBackend(CacheBackend backend) {
        return new CacheRuntimeConfig(backend, dataSource, jdbc, reaper, createSchema);
    }

    /**
     * jdbc만 변경한 새 인스턴스 생성.
     */
    public CacheRuntimeConfig withJdbc(JdbcCacheConfig jdbc) {
        return new CacheRuntimeConfig(backend, dataSource, jdbc, reaper, createSchema);
    }

    /**
     * reaper만 변경한 새 인스턴스 생성.
     */
    public CacheRuntimeConfig withReaper(ExpiryReaperConfig reaper) {
        return new CacheRuntimeConfig(backend, dataSource, jdbc, reaper, createSchema);
    }

    /**
     * createSchema만 변경한 새 인스턴스 생성.
     */
    public CacheRuntimeConfig withCreateSchema(boolean createSchema) {
        return new CacheRuntimeConfig(backend, dataSource, jdbc, reaper, createSchema);
    }
}
