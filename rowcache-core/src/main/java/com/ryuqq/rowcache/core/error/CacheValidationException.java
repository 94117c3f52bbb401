package com.ryuqq.rowcache.core.error;

/**
 * 잘못된 호출 인자 또는 해석할 수 없는 저장 값.
 *
 * <p>예: 홀수 길이의 field/value 시퀀스, 정수가 아닌 카운터 값, 음수 TTL.</p>
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
public class CacheValidationException extends CacheException {

    public CacheValidationException(String message) {
        super(message);
    }

    public CacheValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
