package com.ryuqq.rowcache.core.spi;

import com.ryuqq.rowcache.core.error.CacheNotFoundException;
import com.ryuqq.rowcache.core.model.ScanPage;
import com.ryuqq.rowcache.core.pubsub.Subscription;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * Cache capability contract.
 *
 * <p>Every backend (relational store, in-memory) implements this interface, and the
 * command adapter is built on it alone.</p>
 *
 * <p><strong>Semantics:</strong></p>
 * <ul>
 *   <li>Scalar entries carry an absolute expiry; an entry whose expiry is at or before
 *       "now" is treated as absent by every read, even before it is physically purged</li>
 *   <li>A TTL of {@link Duration#ZERO} means the entry never expires; a negative TTL is rejected</li>
 *   <li>Map fields never expire</li>
 *   <li>Store failures surface as {@link com.ryuqq.rowcache.core.error.CacheStoreException}</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * client.set("session:42", "alice", Duration.ofMinutes(30));
 * String user = client.getString("session:42");
 *
 * client.transaction(ctx -&gt; {
 *     ctx.lockKey("stock:7");
 *     ctx.client().set("stock:7", "9", Duration.ZERO);
 *     return null;
 * });
 * </pre>
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
public interface CacheClient extends AutoCloseable {

    /**
     * Upserts a scalar entry.
     *
     * @param key the entry key
     * @param value the raw value
     * @param ttl time to live ({@link Duration#ZERO} for never)
     * @throws com.ryuqq.rowcache.core.error.CacheValidationException if ttl is negative
     */
    void set(String key, byte[] value, Duration ttl);

    /**
     * Upserts a scalar entry encoded as UTF-8.
     *
     * @param key the entry key
     * @param value the string value
     * @param ttl time to live ({@link Duration#ZERO} for never)
     */
    default void set(String key, String value, Duration ttl) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        set(key, value.getBytes(StandardCharsets.UTF_8), ttl);
    }

    /**
     * Reads a live scalar entry.
     *
     * @param key the entry key
     * @return the stored bytes
     * @throws CacheNotFoundException if the key is absent or expired
     */
    byte[] getBytes(String key);

    /**
     * Reads a live scalar entry as a UTF-8 string.
     *
     * @param key the entry key
     * @return the stored value
     * @throws CacheNotFoundException if the key is absent or expired
     */
    default String getString(String key) {
        return new String(getBytes(key), StandardCharsets.UTF_8);
    }

    /**
     * Deletes a live scalar entry.
     *
     * @param key the entry key
     * @return 1 if a live entry was removed, 0 otherwise
     */
    long delete(String key);

    /**
     * Counts distinct live scalar entries among the given keys.
     *
     * @param keys keys to check; no keys counts every live entry
     * @return number of live entries
     */
    long count(String... keys);

    /**
     * Returns the remaining time to live of a live scalar entry.
     *
     * @param key the entry key
     * @return remaining TTL, {@link Duration#ZERO} when the entry never expires
     * @throws CacheNotFoundException if the key is absent or expired
     */
    Duration ttl(String key);

    /**
     * Upserts one map field.
     *
     * @param key the map key
     * @param field the field name
     * @param value the field value
     */
    void setMapField(String key, String field, String value);

    /**
     * Reads one map field.
     *
     * @param key the map key
     * @param field the field name
     * @return the field value
     * @throws CacheNotFoundException if the field does not exist
     */
    String getMapField(String key, String field);

    /**
     * Deletes one map field.
     *
     * @param key the map key
     * @param field the field name
     * @return 1 if the field existed, 0 otherwise
     */
    long deleteMapField(String key, String field);

    /**
     * Reads every field of a map, in insertion order.
     *
     * @param key the map key
     * @return field to value
     * @throws CacheNotFoundException if the map has no fields
     */
    Map<String, String> getMap(String key);

    /**
     * Pages through the fields of a map.
     *
     * <p>The cursor is an offset into the fields ordered by insertion. The returned
     * cursor is 0 once a page holds fewer than {@code count} fields.</p>
     *
     * @param key the map key
     * @param cursor 0 to start, otherwise the cursor of the previous page
     * @param match glob over field names ({@code *}, {@code ?}); null or empty for all
     * @param count page size, positive
     * @return the page
     */
    ScanPage scanMapStream(String key, long cursor, String match, long count);

    /**
     * Creates a scalar entry only if no live entry exists for the key.
     *
     * @param key the entry key
     * @param value the raw value
     * @param ttl time to live ({@link Duration#ZERO} for never)
     * @return true if this call created the entry
     */
    boolean setNX(String key, byte[] value, Duration ttl);

    /**
     * String variant of {@link #setNX(String, byte[], Duration)}.
     *
     * @param key the entry key
     * @param value the string value
     * @param ttl time to live
     * @return true if this call created the entry
     */
    default boolean setNX(String key, String value, Duration ttl) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        return setNX(key, value.getBytes(StandardCharsets.UTF_8), ttl);
    }

    /**
     * Resets the expiry of a live scalar entry.
     *
     * @param key the entry key
     * @param ttl new time to live ({@link Duration#ZERO} for never)
     * @return true if a live entry was updated
     */
    boolean expire(String key, Duration ttl);

    /**
     * Runs the callback in one store transaction.
     *
     * <p>The callback receives a context whose client is bound to the transaction.
     * A normal return commits; any exception rolls every change back and is rethrown.
     * Calling {@code transaction} on a transaction-bound client joins the outer transaction.</p>
     *
     * @param callback the unit of work
     * @param <T> result type
     * @return the callback result
     */
    <T> T transaction(CacheCallback<T> callback);

    /**
     * Appends a message to a channel log.
     *
     * @param channel the channel name
     * @param message the payload
     */
    void publish(String channel, String message);

    /**
     * Attaches a new subscriber to a channel.
     *
     * <p>Delivery starts from the beginning of the channel log, in message id order.
     * Delivery is at-least-once.</p>
     *
     * @param channel the channel name
     * @return an active subscription; close it to detach
     * @throws IllegalStateException if called on a transaction-bound client
     */
    Subscription subscribe(String channel);

    /**
     * Releases backend resources and detaches open subscriptions.
     */
    @Override
    void close();
}
