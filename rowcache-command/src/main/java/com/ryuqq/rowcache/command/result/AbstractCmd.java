package com.ryuqq.rowcache.command.result;

import com.ryuqq.rowcache.core.error.CacheException;

/**
 * Base of the result wrappers.
 *
 * @param <T> value type
 * @author Rowcache Team
 * @since 1.0.0
 */
public abstract class AbstractCmd<T> implements Cmd<T> {

    private final String name;
    private final T val;
    private final CacheException err;

    protected AbstractCmd(String name, T val, CacheException err) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (val == null) {
            throw new IllegalArgumentException("val cannot be null");
        }
        this.name = name;
        this.val = val;
        this.err = err;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public CacheException err() {
        return err;
    }

    @Override
    public T val() {
        return val;
    }

    @Override
    public T result() {
        if (err != null) {
            throw err;
        }
        return val;
    }

    @Override
    public String toString() {
        return err == null
            ? name + ": " + val
            : name + ": " + err.getMessage();
    }
}
