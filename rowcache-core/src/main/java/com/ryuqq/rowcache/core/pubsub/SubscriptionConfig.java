package com.ryuqq.rowcache.core.pubsub;

/**
 * 폴링 구독 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>pollIntervalMs: 폴링 주기 (기본 100ms)</li>
 *   <li>batchSize: 한 번의 폴링에서 가져올 최대 메시지 수 (기본 10)</li>
 *   <li>bufferCapacity: 소비자에게 넘기기 전 대기 버퍼 크기 (기본 100)</li>
 * </ul>
 *
 * @author Rowcache Team
 * @since 1.0.0
 * @param pollIntervalMs 폴링 주기 (밀리초, 양수여야 함)
 * @param batchSize 배치 크기 (1 이상이어야 함)
 * @param bufferCapacity 버퍼 크기 (1 이상이어야 함)
 */
public record SubscriptionConfig(
    long pollIntervalMs,
    int batchSize,
    int bufferCapacity
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: pollIntervalMs=100ms, batchSize=10, bufferCapacity=100</p>
     */
    public SubscriptionConfig() {
        this(100, 10, 100);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public SubscriptionConfig {
        if (pollIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "pollIntervalMs must be positive (current: " + pollIntervalMs + ")"
            );
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
        if (bufferCapacity <= 0) {
            throw new IllegalArgumentException(
                "bufferCapacity must be positive (current: " + bufferCapacity + ")"
            );
        }
    }

    public SubscriptionConfig withPollIntervalMs(long pollIntervalMs) {
        return new SubscriptionConfig(pollIntervalMs, batchSize, bufferCapacity);
    }

    public SubscriptionConfig withBatchSize(int batchSize) {
        return new SubscriptionConfig(pollIntervalMs, batchSize, bufferCapacity);
    }

    public SubscriptionConfig withBufferCapacity(int bufferCapacity) {
        return new SubscriptionConfig(pollIntervalMs, batchSize, bufferCapacity);
    }
}
