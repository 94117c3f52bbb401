package com.ryuqq.rowcache.adapter.runner;

/**
 * ExpiryReaper 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>initialDelayMs: 프로세스 시작 후 첫 정리까지 대기 (기본 300000ms = 5분)</li>
 *   <li>intervalMs: 정리 주기 (기본 60000ms = 1분)</li>
 * </ul>
 *
 * <p>만료된 행은 읽기 시점에 이미 필터링되므로 정리 주기는 저장 공간에만 영향을 줍니다.</p>
 *
 * @author Rowcache Team
 * @since 1.0.0
 * @param initialDelayMs 첫 정리 전 대기 (밀리초, 0 이상)
 * @param intervalMs 정리 주기 (밀리초, 양수여야 함)
 */
public record ExpiryReaperConfig(
    long initialDelayMs,
    long intervalMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: initialDelayMs=300000ms (5분), intervalMs=60000ms (1분)</p>
     */
    public ExpiryReaperConfig() {
        this(300000, 60000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ExpiryReaperConfig {
        if (initialDelayMs < 0) {
            throw new IllegalArgumentException(
                "initialDelayMs cannot be negative (current: " + initialDelayMs + ")"
            );
        }
        if (intervalMs <= 0) {
            throw new IllegalArgumentException(
                "intervalMs must be positive (current: " + intervalMs + ")"
            );
        }
    }

    /**
     * initialDelayMs만 변경한 새 인스턴스 생성.
     */
    public ExpiryReaperConfig withInitialDelayMs(long initialDelayMs) {
        return new ExpiryReaperConfig(initialDelayMs, intervalMs);
    }

    /**
     * intervalMs만 변경한 새 인스턴스 생성.
     */
    public ExpiryReaperConfig withIntervalMs(long intervalMs) {
        return new ExpiryReaperConfig(initialDelayMs, intervalMs);
    }
}
