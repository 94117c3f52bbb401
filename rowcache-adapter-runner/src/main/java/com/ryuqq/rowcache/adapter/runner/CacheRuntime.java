package com.ryuqq.rowcache.adapter.runner;

import com.ryuqq.rowcache.adapter.inmemory.InMemoryCacheClient;
import com.ryuqq.rowcache.adapter.jdbc.JdbcCacheClient;
import com.ryuqq.rowcache.adapter.jdbc.JdbcCacheSchema;
import com.ryuqq.rowcache.adapter.jdbc.JdbcDataSources;
import com.ryuqq.rowcache.command.Cmdable;
import com.ryuqq.rowcache.command.CmdableAdapter;
import com.ryuqq.rowcache.core.registry.CacheRegistry;
import com.ryuqq.rowcache.core.spi.CacheClient;
import com.ryuqq.rowcache.core.spi.ExpiredEntryPurger;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * 프로세스 단위 캐시 구성.
 *
 * <p>설정된 백엔드를 만들고, 레지스트리에 등록하고, 만료 정리 데몬을 시작합니다.
 * 프로세스마다 한 번 생성합니다.</p>
 *
 * <p><strong>시작 순서:</strong></p>
 * <pre>
 * 1. 백엔드 생성 (JDBC: HikariCP 풀 → 테이블 생성 → JdbcCacheClient)
 * 2. registry.register(client)
 * 3. ExpiryReaper.start()
 * </pre>
 *
 * <p><strong>종료 순서:</strong> reaper 중지 → registry.close() (클라이언트와 풀 종료)</p>
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
public final class CacheRuntime implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CacheRuntime.class);
    private final CacheRegistry registry;
    private final ExpiryReaper reaper;
    private final Cmdable cmdable;

    CacheRuntime(CacheRegistry registry, ExpiryReaper reaper) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (reaper == null) {
            throw new IllegalArgumentException("reaper cannot be null");
        }
        this.registry = registry;
        this.reaper = reaper;
        this.cmdable = new CmdableAdapter(registry.client());
    }

    /**
     * 설정대로 캐시를 구성하고 시작.
     *
     * @param config 런타임 설정
     * @return 시작된 런타임
     * @throws IllegalArgumentException config가 null인 경우
     * @throws com.ryuqq.rowcache.core.error.CacheStoreException 테이블 생성 실패 시
     */
    public static CacheRuntime start(CacheRuntimeConfig config) {
        return start(config, Clock.systemUTC());
    }

    static CacheRuntime start(CacheRuntimeConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        CacheClient client = switch (config.backend()) {
            case JDBC -> createJdbcClient(config, clock);
            case MEMORY -> new InMemoryCacheClient(clock, config.jdbc().subscription());
        };

        CacheRegistry registry = new CacheRegistry();
        registry.register(client);

        ExpiryReaper reaper = new ExpiryReaper((ExpiredEntryPurger) client, config.reaper());
        reaper.start();

        log.info("Cache runtime started (backend={})", config.backend());
        return new CacheRuntime(registry, reaper);
    }

    private static JdbcCacheClient createJdbcClient(CacheRuntimeConfig config, Clock clock) {
        HikariDataSource dataSource = JdbcDataSources.hikari(config.dataSource());
        try {
            if (config.createSchema()) {
                JdbcCacheSchema.createIfAbsent(dataSource, config.jdbc().dialect());
            }
            return new JdbcCacheClient(dataSource, config.jdbc(), clock, true);
        } catch (RuntimeException e) {
            dataSource.close();
            throw e;
        }
    }

    /**
     * 레지스트리에 등록된 클라이언트.
     *
     * @return 캐시 클라이언트
     * @throws com.ryuqq.rowcache.core.error.CacheNotInitializedException 이미 종료된 경우
     */
    public CacheClient client() {
        return registry.client();
    }

    /**
     * 명령형 어댑터.
     *
     * @return Cmdable
     */
    public Cmdable cmdable() {
        return cmdable;
    }

    /**
     * 레지스트리.
     *
     * @return 클라이언트 레지스트리
     */
    public CacheRegistry registry() {
        return registry;
    }

    /**
     * 만료 정리 데몬.
     *
     * @return reaper
     */
    public ExpiryReaper reaper() {
        return reaper;
    }

    /**
     * 종료.
     *
     * <p>만료 정리 데몬을 멈추고 클라이언트를 닫습니다. 여러 번 호출해도 안전합니다.</p>
     */
    @Override
    public void close() {
        reaper.stop();
        if (registry.isInitialized()) {
            registry.close();
            log.info("Cache runtime closed");
        }
    }
}
