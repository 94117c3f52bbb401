package com.ryuqq.rowcache.command.result;

import com.ryuqq.rowcache.core.error.CacheException;

import java.util.Map;

/**
 * Field/value reply of a map read.
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
public final class MapStringStringCmd extends AbstractCmd<Map<String, String>> {

    private MapStringStringCmd(String name, Map<String, String> val, CacheException err) {
        super(name, val, err);
    }

    public static MapStringStringCmd ok(String name, Map<String, String> val) {
        return new MapStringStringCmd(name, val, null);
    }

    public static MapStringStringCmd failed(String name, CacheException err) {
        if (err == null) {
            throw new IllegalArgumentException("err cannot be null");
        }
        return new MapStringStringCmd(name, Map.of(), err);
    }
}
