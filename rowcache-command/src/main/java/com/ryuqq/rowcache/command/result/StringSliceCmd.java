package com.ryuqq.rowcache.command.result;

import com.ryuqq.rowcache.core.error.CacheException;

import java.util.List;

/**
 * String list reply. Only list commands produce it, and those always fail on this backend.
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
public final class StringSliceCmd extends AbstractCmd<List<String>> {

    private StringSliceCmd(String name, List<String> val, CacheException err) {
        super(name, val, err);
    }

    public static StringSliceCmd ok(String name, List<String> val) {
        return new StringSliceCmd(name, val, null);
    }

    public static StringSliceCmd failed(String name, CacheException err) {
        if (err == null) {
            throw new IllegalArgumentException("err cannot be null");
        }
        return new StringSliceCmd(name, List.of(), err);
    }
}
