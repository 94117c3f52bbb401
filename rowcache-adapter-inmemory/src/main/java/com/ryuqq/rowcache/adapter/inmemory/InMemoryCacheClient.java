package com.ryuqq.rowcache.adapter.inmemory;

import com.ryuqq.rowcache.core.error.CacheNotFoundException;
import com.ryuqq.rowcache.core.error.CacheValidationException;
import com.ryuqq.rowcache.core.model.ChannelMessage;
import com.ryuqq.rowcache.core.model.Expiry;
import com.ryuqq.rowcache.core.model.MatchPattern;
import com.ryuqq.rowcache.core.model.ScanPage;
import com.ryuqq.rowcache.core.pubsub.PollingSubscription;
import com.ryuqq.rowcache.core.pubsub.Subscription;
import com.ryuqq.rowcache.core.pubsub.SubscriptionConfig;
import com.ryuqq.rowcache.core.spi.CacheCallback;
import com.ryuqq.rowcache.core.spi.CacheClient;
import com.ryuqq.rowcache.core.spi.CacheContext;
import com.ryuqq.rowcache.core.spi.ExpiredEntryPurger;
import com.ryuqq.rowcache.core.spi.MessageCursorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-memory implementation of {@link CacheClient} for tests and single-process use.
 *
 * <p>All state lives behind one {@link ReentrantLock}. A transaction holds that lock for its
 * whole duration, so transactions are serialized and {@link CacheContext#lockKey(String)}
 * has nothing left to do.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>scalars:</strong> key → (value, expireAt)</li>
 *   <li><strong>maps:</strong> key → insertion-ordered field map</li>
 *   <li><strong>messages:</strong> append-only message log with a monotonic id</li>
 *   <li><strong>cursors:</strong> (channel, subscriber) → last delivered id</li>
 * </ul>
 *
 * <p><strong>Transactions:</strong> the state is copied when the outermost transaction
 * starts and restored if the callback throws. A transaction started by the thread that
 * already holds the lock joins the outer one.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not shared across processes</li>
 * </ul>
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
public class InMemoryCacheClient implements CacheClient, ExpiredEntryPurger, MessageCursorStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCacheClient.class);

    private final Clock clock;
    private final SubscriptionConfig subscriptionConfig;
    private final ReentrantLock lock = new ReentrantLock();
    private final Set<Subscription> subscriptions = ConcurrentHashMap.newKeySet();
    private final CacheContext context = new InMemoryContext();
    private State state = new State();
    private volatile boolean closed;

    /**
     * Creates a client on the system UTC clock with default subscription settings.
     */
    public InMemoryCacheClient() {
        this(Clock.systemUTC());
    }

    public InMemoryCacheClient(Clock clock) {
        this(clock, new SubscriptionConfig());
    }

    /**
     * Creates a client.
     *
     * @param clock source of "now" for expiry
     * @param subscriptionConfig polling settings for {@link #subscribe(String)}
     * @throws IllegalArgumentException if any argument is null
     */
    public InMemoryCacheClient(Clock clock, SubscriptionConfig subscriptionConfig) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (subscriptionConfig == null) {
            throw new IllegalArgumentException("subscriptionConfig cannot be null");
        }
        this.clock = clock;
        this.subscriptionConfig = subscriptionConfig;
    }

    // ============================================================
    // Scalar entries
    // ============================================================

    @Override
    public void set(String key, byte[] value, Duration ttl) {
        requireKey(key);
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        withLock(() -> {
            Instant expireAt = Expiry.expireAt(ttl, now());
            state.scalars.put(key, new ScalarEntry(value.clone(), expireAt));
            return null;
        });
    }

    @Override
    public byte[] getBytes(String key) {
        requireKey(key);
        return withLock(() -> liveEntry(key).value.clone());
    }

    @Override
    public long delete(String key) {
        requireKey(key);
        return withLock(() -> {
            ScalarEntry entry = state.scalars.get(key);
            if (entry == null) {
                return 0L;
            }
            state.scalars.remove(key);
            return Expiry.isLive(entry.expireAt, now()) ? 1L : 0L;
        });
    }

    @Override
    public long count(String... keys) {
        return withLock(() -> {
            Instant now = now();
            if (keys == null || keys.length == 0) {
                return state.scalars.values().stream()
                    .filter(entry -> Expiry.isLive(entry.expireAt, now))
                    .count();
            }
            return new LinkedHashSet<>(Arrays.asList(keys)).stream()
                .map(state.scalars::get)
                .filter(entry -> entry != null && Expiry.isLive(entry.expireAt, now))
                .count();
        });
    }

    @Override
    public Duration ttl(String key) {
        requireKey(key);
        return withLock(() -> Expiry.remaining(liveEntry(key).expireAt, now()));
    }

    @Override
    public boolean setNX(String key, byte[] value, Duration ttl) {
        requireKey(key);
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        return withLock(() -> {
            Instant now = now();
            Instant expireAt = Expiry.expireAt(ttl, now);
            ScalarEntry existing = state.scalars.get(key);
            if (existing != null && Expiry.isLive(existing.expireAt, now)) {
                return false;
            }
            state.scalars.put(key, new ScalarEntry(value.clone(), expireAt));
            return true;
        });
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        requireKey(key);
        return withLock(() -> {
            Instant now = now();
            Instant expireAt = Expiry.expireAt(ttl, now);
            ScalarEntry existing = state.scalars.get(key);
            if (existing == null || !Expiry.isLive(existing.expireAt, now)) {
                return false;
            }
            state.scalars.put(key, new ScalarEntry(existing.value, expireAt));
            return true;
        });
    }

    // ============================================================
    // Map entries
    // ============================================================

    @Override
    public void setMapField(String key, String field, String value) {
        requireKey(key);
        requireField(field);
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        withLock(() -> state.maps.computeIfAbsent(key, k -> new LinkedHashMap<>()).put(field, value));
    }

    @Override
    public String getMapField(String key, String field) {
        requireKey(key);
        requireField(field);
        return withLock(() -> {
            Map<String, String> fields = state.maps.get(key);
            String value = fields == null ? null : fields.get(field);
            if (value == null) {
                throw CacheNotFoundException.field(key, field);
            }
            return value;
        });
    }

    @Override
    public long deleteMapField(String key, String field) {
        requireKey(key);
        requireField(field);
        return withLock(() -> {
            Map<String, String> fields = state.maps.get(key);
            if (fields == null || fields.remove(field) == null) {
                return 0L;
            }
            if (fields.isEmpty()) {
                state.maps.remove(key);
            }
            return 1L;
        });
    }

    @Override
    public Map<String, String> getMap(String key) {
        requireKey(key);
        return withLock(() -> {
            Map<String, String> fields = state.maps.get(key);
            if (fields == null || fields.isEmpty()) {
                throw CacheNotFoundException.key(key);
            }
            return new LinkedHashMap<>(fields);
        });
    }

    @Override
    public ScanPage scanMapStream(String key, long cursor, String match, long count) {
        requireKey(key);
        if (cursor < 0) {
            throw new CacheValidationException("cursor cannot be negative, but was: " + cursor);
        }
        if (count <= 0) {
            throw new CacheValidationException("count must be positive, but was: " + count);
        }
        MatchPattern pattern = MatchPattern.isPresent(match) ? MatchPattern.of(match) : null;
        return withLock(() -> {
            Map<String, String> fields = state.maps.getOrDefault(key, new LinkedHashMap<>());
            List<String> entries = new ArrayList<>();
            long skipped = 0;
            long rows = 0;
            for (Map.Entry<String, String> field : fields.entrySet()) {
                if (pattern != null && !pattern.matches(field.getKey())) {
                    continue;
                }
                if (skipped < cursor) {
                    skipped++;
                    continue;
                }
                if (rows == count) {
                    break;
                }
                entries.add(field.getKey());
                entries.add(field.getValue());
                rows++;
            }
            long next = rows < count ? 0 : cursor + rows;
            return new ScanPage(entries, next);
        });
    }

    // ============================================================
    // Transactions
    // ============================================================

    @Override
    public <T> T transaction(CacheCallback<T> callback) {
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }
        lock.lock();
        try {
            if (lock.getHoldCount() > 1) {
                return callback.execute(context);
            }
            State snapshot = state.copy();
            try {
                return callback.execute(context);
            } catch (RuntimeException | Error e) {
                state = snapshot;
                throw e;
            }
        } finally {
            lock.unlock();
        }
    }

    // ============================================================
    // Messages
    // ============================================================

    @Override
    public void publish(String channel, String message) {
        requireChannel(channel);
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        withLock(() -> state.messages.add(new ChannelMessage(++state.lastMessageId, channel, message, now())));
    }

    @Override
    public Subscription subscribe(String channel) {
        requireChannel(channel);
        if (lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("subscribe is not allowed inside a transaction");
        }
        if (closed) {
            throw new IllegalStateException("client is closed");
        }
        subscriptions.removeIf(subscription -> !subscription.isActive());
        Subscription subscription = PollingSubscription.start(this, channel, subscriptionConfig);
        subscriptions.add(subscription);
        return subscription;
    }

    @Override
    public long attach(String channel, String subscriberId) {
        withLock(() -> state.cursors.put(cursorKey(channel, subscriberId), -1L));
        return -1L;
    }

    @Override
    public List<ChannelMessage> fetchAfter(String channel, long afterId, int limit) {
        return withLock(() -> {
            List<ChannelMessage> batch = new ArrayList<>();
            for (ChannelMessage message : state.messages) {
                if (batch.size() == limit) {
                    break;
                }
                if (message.id() > afterId && message.channel().equals(channel)) {
                    batch.add(message);
                }
            }
            return batch;
        });
    }

    @Override
    public void advance(String channel, String subscriberId, long lastDeliveredId) {
        withLock(() -> state.cursors.replace(cursorKey(channel, subscriberId), lastDeliveredId));
    }

    @Override
    public void detach(String channel, String subscriberId) {
        withLock(() -> state.cursors.remove(cursorKey(channel, subscriberId)));
    }

    /**
     * Returns the stored cursor of a subscriber.
     *
     * @param channel the channel name
     * @param subscriberId the subscriber id
     * @return last delivered id, or null if the subscriber is not attached
     */
    public Long cursorOf(String channel, String subscriberId) {
        return withLock(() -> state.cursors.get(cursorKey(channel, subscriberId)));
    }

    // ============================================================
    // Lifecycle
    // ============================================================

    @Override
    public long purgeExpired() {
        long purged = withLock(() -> {
            Instant now = now();
            long removed = 0;
            Iterator<ScalarEntry> it = state.scalars.values().iterator();
            while (it.hasNext()) {
                if (!Expiry.isLive(it.next().expireAt, now)) {
                    it.remove();
                    removed++;
                }
            }
            return removed;
        });
        log.debug("Purged {} expired in-memory entries", purged);
        return purged;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (Subscription subscription : subscriptions) {
            subscription.close();
        }
        subscriptions.clear();
        log.debug("In-memory cache client closed");
    }

    private <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private ScalarEntry liveEntry(String key) {
        ScalarEntry entry = state.scalars.get(key);
        if (entry == null || !Expiry.isLive(entry.expireAt, now())) {
            throw CacheNotFoundException.key(key);
        }
        return entry;
    }

    private Instant now() {
        return clock.instant();
    }

    private static String cursorKey(String channel, String subscriberId) {
        return channel + '\u0000' + subscriberId;
    }

    private static void requireKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
    }

    private static void requireField(String field) {
        if (field == null) {
            throw new IllegalArgumentException("field cannot be null");
        }
    }

    private static void requireChannel(String channel) {
        if (channel == null || channel.isBlank()) {
            throw new IllegalArgumentException("channel cannot be null or blank");
        }
    }

    private static final class ScalarEntry {
        private final byte[] value;
        private final Instant expireAt;

        private ScalarEntry(byte[] value, Instant expireAt) {
            this.value = value;
            this.expireAt = expireAt;
        }
    }

    private static final class State {
        private final Map<String, ScalarEntry> scalars = new LinkedHashMap<>();
        private final Map<String, Map<String, String>> maps = new LinkedHashMap<>();
        private final List<ChannelMessage> messages = new ArrayList<>();
        private final Map<String, Long> cursors = new LinkedHashMap<>();
        private long lastMessageId;

        private State copy() {
            State copy = new State();
            copy.scalars.putAll(scalars);
            maps.forEach((key, fields) -> copy.maps.put(key, new LinkedHashMap<>(fields)));
            copy.messages.addAll(messages);
            copy.cursors.putAll(cursors);
            copy.lastMessageId = lastMessageId;
            return copy;
        }
    }

    private final class InMemoryContext implements CacheContext {

        @Override
        public CacheClient client() {
            return InMemoryCacheClient.this;
        }

        @Override
        public void lockKey(String key) {
            requireKey(key);
        }
    }
}
