package com.ryuqq.rowcache.command.counter;

import com.ryuqq.rowcache.core.error.CacheException;
import com.ryuqq.rowcache.core.error.CacheNotFoundException;
import com.ryuqq.rowcache.core.error.CacheStoreException;
import com.ryuqq.rowcache.core.error.CacheValidationException;
import com.ryuqq.rowcache.core.spi.CacheClient;
import com.ryuqq.rowcache.core.spi.CacheContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * 트랜잭션 기반 원자적 카운터.
 *
 * <p>저장소에 정수 증감 연산이 없으므로 read-modify-write를 한 트랜잭션 안에서 수행합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. transaction 시작
 * 2. lockKey(key) → 같은 키를 갱신하는 다른 트랜잭션 직렬화
 * 3. 현재 값 읽기 (없으면 0)
 * 4. 10진 정수로 파싱 (실패 시 CacheValidationException, 롤백)
 * 5. current + delta (overflow 시 CacheValidationException, 롤백)
 * 6. 기존 TTL을 유지한 채 10진 문자열로 저장 (새 키는 만료 없음)
 * 7. commit
 * </pre>
 *
 * <p>잠금 대기 시간 초과, 교착 상태처럼 일시적인 저장소 실패
 * ({@link CacheStoreException#isTransient()})는 {@link CounterRetryConfig}에 따라
 * 간격을 두고 트랜잭션 전체를 다시 시도합니다.</p>
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
public final class TransactionalCounter {

    private static final Logger log = LoggerFactory.getLogger(TransactionalCounter.class);

    private final CacheClient client;
    private final CounterRetryConfig retryConfig;

    /**
     * 기본 재시도 설정으로 생성.
     *
     * @param client 캐시 클라이언트
     */
    public TransactionalCounter(CacheClient client) {
        this(client, new CounterRetryConfig());
    }

    /**
     * 생성자.
     *
     * @param client 캐시 클라이언트
     * @param retryConfig 재시도 설정
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public TransactionalCounter(CacheClient client, CounterRetryConfig retryConfig) {
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        if (retryConfig == null) {
            throw new IllegalArgumentException("retryConfig cannot be null");
        }
        this.client = client;
        this.retryConfig = retryConfig;
    }

    /**
     * 키의 정수 값을 delta만큼 증가.
     *
     * @param key 카운터 키
     * @param delta 증가량 (음수면 감소)
     * @return 증가 후 값
     * @throws CacheValidationException 저장된 값이 정수가 아니거나 overflow가 발생하는 경우
     * @throws CacheStoreException 재시도 후에도 저장소 실패가 계속되는 경우
     */
    public long incrBy(String key, long delta) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return client.transaction(context -> apply(context, key, delta));
            } catch (CacheStoreException e) {
                if (!e.isTransient() || !retryConfig.hasAttemptsLeft(attempt)) {
                    throw e;
                }
                long delayMs = retryConfig.delayMs(attempt);
                log.debug("Counter {} attempt {} hit transient failure (sqlState={}), retrying in {}ms",
                    key, attempt, e.getSqlState(), delayMs);
                sleep(delayMs);
            }
        }
    }

    /**
     * incrBy(key, 1).
     *
     * @param key 카운터 키
     * @return 증가 후 값
     */
    public long incr(String key) {
        return incrBy(key, 1);
    }

    public CounterRetryConfig getRetryConfig() {
        return retryConfig;
    }

    private long apply(CacheContext context, String key, long delta) {
        context.lockKey(key);
        CacheClient tx = context.client();

        long current;
        Duration ttl;
        try {
            current = parse(key, tx.getString(key));
            ttl = tx.ttl(key);
        } catch (CacheNotFoundException e) {
            current = 0;
            ttl = Duration.ZERO;
        }

        long next;
        try {
            next = Math.addExact(current, delta);
        } catch (ArithmeticException e) {
            throw new CacheValidationException(
                "increment would overflow: " + key + " (current: " + current + ", delta: " + delta + ")", e);
        }
        tx.set(key, Long.toString(next), ttl);
        return next;
    }

    private static long parse(String key, String raw) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new CacheValidationException("value is not an integer: " + key + "=" + raw, e);
        }
    }

    private static void sleep(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CacheException("counter retry interrupted", e);
        }
    }
}
