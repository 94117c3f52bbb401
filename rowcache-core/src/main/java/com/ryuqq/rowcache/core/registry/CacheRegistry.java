package com.ryuqq.rowcache.core.registry;

import com.ryuqq.rowcache.core.error.CacheNotInitializedException;
import com.ryuqq.rowcache.core.spi.CacheClient;

import java.util.concurrent.atomic.AtomicReference;

/**
 * 프로세스 단위 캐시 클라이언트 보관소.
 *
 * <p>런타임이 시작 시 {@link #register(CacheClient)}로 클라이언트를 등록하고,
 * 소비자는 {@link #client()}로 꺼내 씁니다. 등록 전 조회는
 * {@link CacheNotInitializedException}으로 실패합니다.</p>
 *
 * <p>정적 전역 상태 대신 인스턴스로 만들어 런타임이 소유하고 주입합니다.</p>
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
public final class CacheRegistry {

    private final AtomicReference<CacheClient> current = new AtomicReference<>();

    /**
     * 클라이언트 등록 (기존 등록은 교체).
     *
     * @param client 캐시 클라이언트
     * @return 이전에 등록되어 있던 클라이언트, 없으면 null
     * @throws IllegalArgumentException client가 null인 경우
     */
    public CacheClient register(CacheClient client) {
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        return current.getAndSet(client);
    }

    /**
     * 등록된 클라이언트 조회.
     *
     * @return 캐시 클라이언트
     * @throws CacheNotInitializedException 등록된 클라이언트가 없는 경우
     */
    public CacheClient client() {
        CacheClient client = current.get();
        if (client == null) {
            throw new CacheNotInitializedException();
        }
        return client;
    }

    /**
     * 등록 여부 확인.
     *
     * @return 등록되어 있으면 true
     */
    public boolean isInitialized() {
        return current.get() != null;
    }

    /**
     * 등록된 클라이언트를 닫고 등록 해제.
     *
     * @throws CacheNotInitializedException 등록된 클라이언트가 없는 경우
     */
    public void close() {
        CacheClient client = current.getAndSet(null);
        if (client == null) {
            throw new CacheNotInitializedException();
        }
        client.close();
    }
}
