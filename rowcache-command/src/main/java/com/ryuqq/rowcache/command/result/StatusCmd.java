package com.ryuqq.rowcache.command.result;

import com.ryuqq.rowcache.core.error.CacheException;

/**
 * Status reply; {@code "OK"} on success.
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
public final class StatusCmd extends AbstractCmd<String> {

    private StatusCmd(String name, String val, CacheException err) {
        super(name, val, err);
    }

    public static StatusCmd ok(String name, String val) {
        return new StatusCmd(name, val, null);
    }

    public static StatusCmd failed(String name, CacheException err) {
        if (err == null) {
            throw new IllegalArgumentException("err cannot be null");
        }
        return new StatusCmd(name, "", err);
    }

    public static StatusCmd ok(String name) {
        return ok(name, "OK");
    }
}
