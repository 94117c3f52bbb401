package com.ryuqq.rowcache.command.result;

import com.ryuqq.rowcache.core.error.CacheException;

/**
 * Result of one command.
 *
 * <p>A command never throws for cache failures: the failure is captured and exposed
 * through {@link #err()}. {@link #result()} rethrows it for callers preferring exceptions.</p>
 *
 * @param <T> value type
 * @author Rowcache Team
 * @since 1.0.0
 */
public interface Cmd<T> {

    /**
     * Command name, e.g. {@code "hset"}.
     *
     * @return the name
     */
    String name();

    /**
     * Captured failure.
     *
     * @return the failure, or null on success
     */
    CacheException err();

    /**
     * Value of the command; the type's zero value when the command failed.
     *
     * @return the value
     */
    T val();

    /**
     * Value of the command, rethrowing the captured failure.
     *
     * @return the value
     * @throws CacheException the captured failure
     */
    T result();

    /**
     * @return true if no failure was captured
     */
    default boolean isOk() {
        return err() == null;
    }
}
