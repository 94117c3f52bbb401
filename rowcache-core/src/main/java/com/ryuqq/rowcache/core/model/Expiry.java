package com.ryuqq.rowcache.core.model;

import com.ryuqq.rowcache.core.error.CacheValidationException;

import java.time.Duration;
import java.time.Instant;

/**
 * TTL과 만료 시각 사이의 변환 규칙.
 *
 * <p><strong>TTL 규약:</strong></p>
 * <ul>
 *   <li>ttl = 0: 만료되지 않음 ({@link #NEVER} 센티널 시각으로 저장)</li>
 *   <li>ttl &gt; 0: now + ttl 시각에 만료</li>
 *   <li>ttl &lt; 0: {@link CacheValidationException}</li>
 * </ul>
 *
 * <p>만료 시각이 now 이하인 항목은 물리적으로 남아 있더라도 논리적으로 존재하지 않습니다.</p>
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
public final class Expiry {

    /**
     * 만료되지 않는 항목의 센티널 만료 시각.
     *
     * <p>어느 타임존으로 변환해도 DATETIME 상한(9999-12-31)을 넘지 않도록 연초로 둡니다.</p>
     */
    public static final Instant NEVER = Instant.parse("9999-01-01T00:00:00Z");

    /**
     * 이미 만료된 센티널 시각 (행 잠금용 자리표시 행에 사용).
     */
    public static final Instant EXPIRED = Instant.parse("1970-01-02T00:00:00Z");

    private Expiry() {
    }

    /**
     * TTL을 절대 만료 시각으로 변환.
     *
     * @param ttl TTL (0이면 만료 없음)
     * @param now 기준 시각
     * @return 만료 시각
     * @throws CacheValidationException ttl이 null이거나 음수인 경우
     */
    public static Instant expireAt(Duration ttl, Instant now) {
        if (ttl == null) {
            throw new CacheValidationException("ttl cannot be null");
        }
        if (ttl.isNegative()) {
            throw new CacheValidationException("ttl cannot be negative, but was: " + ttl);
        }
        if (ttl.isZero()) {
            return NEVER;
        }
        return now.plus(ttl);
    }

    /**
     * 남은 TTL 계산.
     *
     * <p>만료되지 않는 항목은 {@link Duration#ZERO}를 반환하여
     * set(key, value, ttl) 호출에 그대로 다시 넘길 수 있습니다.</p>
     *
     * @param expireAt 만료 시각
     * @param now 기준 시각
     * @return 남은 TTL (최소 1ms), 만료 없음이면 0
     */
    public static Duration remaining(Instant expireAt, Instant now) {
        if (!expireAt.isBefore(NEVER)) {
            return Duration.ZERO;
        }
        Duration left = Duration.between(now, expireAt);
        return left.compareTo(Duration.ofMillis(1)) < 0 ? Duration.ofMillis(1) : left;
    }

    /**
     * 만료 시각 기준으로 항목이 살아 있는지 확인.
     *
     * @param expireAt 만료 시각
     * @param now 기준 시각
     * @return expireAt &gt; now 이면 true
     */
    public static boolean isLive(Instant expireAt, Instant now) {
        return expireAt.isAfter(now);
    }
}
