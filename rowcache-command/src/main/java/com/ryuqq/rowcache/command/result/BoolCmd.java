package com.ryuqq.rowcache.command.result;

import com.ryuqq.rowcache.core.error.CacheException;

/**
 * Boolean reply (conditional writes, expire).
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
public final class BoolCmd extends AbstractCmd<Boolean> {

    private BoolCmd(String name, Boolean val, CacheException err) {
        super(name, val, err);
    }

    public static BoolCmd ok(String name, Boolean val) {
        return new BoolCmd(name, val, null);
    }

    public static BoolCmd failed(String name, CacheException err) {
        if (err == null) {
            throw new IllegalArgumentException("err cannot be null");
        }
        return new BoolCmd(name, Boolean.FALSE, err);
    }
}
