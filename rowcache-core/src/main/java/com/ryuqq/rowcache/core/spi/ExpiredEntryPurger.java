package com.ryuqq.rowcache.core.spi;

/**
 * Physical removal of expired scalar entries, driven by the expiry reaper.
 *
 * <p>Purging never changes what readers observe: expired entries are already
 * invisible to every read.</p>
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
public interface ExpiredEntryPurger {

    /**
     * Deletes every scalar entry whose expiry is at or before now.
     *
     * @return number of deleted entries
     */
    long purgeExpired();
}
