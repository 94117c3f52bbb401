package com.ryuqq.rowcache.command.result;

import com.ryuqq.rowcache.core.error.CacheException;

/**
 * Integer reply (counts, counter values).
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
public final class IntCmd extends AbstractCmd<Long> {

    private IntCmd(String name, Long val, CacheException err) {
        super(name, val, err);
    }

    public static IntCmd ok(String name, Long val) {
        return new IntCmd(name, val, null);
    }

    public static IntCmd failed(String name, CacheException err) {
        if (err == null) {
            throw new IllegalArgumentException("err cannot be null");
        }
        return new IntCmd(name, 0L, err);
    }
}
