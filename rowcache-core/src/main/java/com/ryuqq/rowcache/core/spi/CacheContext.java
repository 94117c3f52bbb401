package com.ryuqq.rowcache.core.spi;

/**
 * Handle passed to a {@link CacheCallback} for the duration of one transaction.
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
public interface CacheContext {

    /**
     * Returns the client bound to this transaction.
     *
     * @return the transactional client
     */
    CacheClient client();

    /**
     * Locks the scalar row of the given key until the transaction ends.
     *
     * <p>Concurrent transactions locking the same key are serialized. The key does not
     * need to exist.</p>
     *
     * @param key the entry key
     */
    void lockKey(String key);
}
