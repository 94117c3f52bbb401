package com.ryuqq.rowcache.core.spi;

/**
 * Unit of work executed by {@link CacheClient#transaction(CacheCallback)}.
 *
 * @param <T> result type
 * @author Rowcache Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CacheCallback<T> {

    /**
     * Executes the unit of work.
     *
     * @param context the transaction context
     * @return the result handed back to the caller
     */
    T execute(CacheContext context);
}
