package com.ryuqq.rowcache.command.counter;

import java.util.concurrent.ThreadLocalRandom;

/**
 * TransactionalCounter 재시도 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxAttempts: 트랜잭션 최대 시도 횟수 (기본 20)</li>
 *   <li>minDelayMs: 재시도 간격 하한 (기본 1ms)</li>
 *   <li>maxDelayMs: 재시도 간격 상한 (기본 100ms)</li>
 * </ul>
 *
 * <p>같은 키를 두고 경합하는 트랜잭션끼리 다시 부딪히지 않도록 간격은
 * [minDelayMs, min(maxDelayMs, minDelayMs × attempt)] 구간에서 균등하게 뽑습니다.
 * 상한이 시도 횟수에 비례해 늘어나므로 경합이 길어질수록 대기 구간이 넓어집니다.</p>
 *
 * @author Rowcache Team
 * @since 1.0.0
 * @param maxAttempts 최대 시도 횟수 (양수여야 함)
 * @param minDelayMs 재시도 간격 하한 (밀리초, 0 이상)
 * @param maxDelayMs 재시도 간격 상한 (밀리초, minDelayMs 이상)
 */
public record CounterRetryConfig(
    int maxAttempts,
    long minDelayMs,
    long maxDelayMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxAttempts=20, minDelayMs=1ms, maxDelayMs=100ms</p>
     */
    public CounterRetryConfig() {
        this(20, 1, 100);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CounterRetryConfig {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (minDelayMs < 0) {
            throw new IllegalArgumentException(
                "minDelayMs cannot be negative (current: " + minDelayMs + ")"
            );
        }
        if (maxDelayMs < minDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= minDelayMs (current: " + maxDelayMs + " < " + minDelayMs + ")"
            );
        }
    }

    /**
     * 재시도 없이 한 번만 시도하는 설정.
     */
    public static CounterRetryConfig noRetry() {
        return new CounterRetryConfig(1, 0, 0);
    }

    /**
     * maxAttempts만 변경한 새 인스턴스 생성.
     */
    public CounterRetryConfig withMaxAttempts(int maxAttempts) {
        return new CounterRetryConfig(maxAttempts, minDelayMs, maxDelayMs);
    }

    /**
     * 간격 범위만 변경한 새 인스턴스 생성.
     */
    public CounterRetryConfig withDelayRange(long minDelayMs, long maxDelayMs) {
        return new CounterRetryConfig(maxAttempts, minDelayMs, maxDelayMs);
    }

    /**
     * 실패한 시도 다음에 재시도할 수 있는지 판단.
     *
     * @param attempt 방금 실패한 시도 번호 (1부터)
     * @return 남은 시도가 있으면 true
     */
    public boolean hasAttemptsLeft(int attempt) {
        return attempt < maxAttempts;
    }

    /**
     * attempt번째 실패 후 대기할 간격 (밀리초).
     *
     * @param attempt 방금 실패한 시도 번호 (1부터)
     * @return 대기 간격
     */
    public long delayMs(int attempt) {
        return delayMs(attempt, ThreadLocalRandom.current().nextDouble());
    }

    long delayMs(int attempt, double random) {
        if (attempt <= 0) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }
        long ceiling = minDelayMs > maxDelayMs / attempt ? maxDelayMs : minDelayMs * attempt;
        return minDelayMs + (long) ((ceiling - minDelayMs) * random);
    }
}
