package com.ryuqq.rowcache.adapter.jdbc;

import com.ryuqq.rowcache.core.error.CacheNotFoundException;
import com.ryuqq.rowcache.core.error.CacheStoreException;
import com.ryuqq.rowcache.core.error.CacheValidationException;
import com.ryuqq.rowcache.core.model.ChannelMessage;
import com.ryuqq.rowcache.core.model.Expiry;
import com.ryuqq.rowcache.core.model.MatchPattern;
import com.ryuqq.rowcache.core.model.ScanPage;
import com.ryuqq.rowcache.core.pubsub.PollingSubscription;
import com.ryuqq.rowcache.core.pubsub.Subscription;
import com.ryuqq.rowcache.core.spi.CacheCallback;
import com.ryuqq.rowcache.core.spi.CacheClient;
import com.ryuqq.rowcache.core.spi.CacheContext;
import com.ryuqq.rowcache.core.spi.ExpiredEntryPurger;
import com.ryuqq.rowcache.core.spi.MessageCursorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTransactionRollbackException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Relational-store implementation of {@link CacheClient}.
 *
 * <p>Every entry is a row of one of four tables ({@code cache_kvs}, {@code cache_maps},
 * {@code cache_messages}, {@code cache_message_subscribes}); see the bundled DDL.
 * The client holds no in-process lock: concurrency is delegated to the store's unique
 * keys, row locks and transactions, so any number of processes may share the same tables.</p>
 *
 * <p><strong>Expiry:</strong> every read filters on {@code expire_time > now}, with "now"
 * taken from the injected {@link Clock} and bound as a parameter. Timestamps are stored
 * as UTC {@link LocalDateTime} with millisecond precision.</p>
 *
 * <p><strong>Transactions:</strong> {@link #transaction(CacheCallback)} borrows one connection,
 * turns auto-commit off and hands the callback a client bound to that connection. A normal
 * return commits; any exception rolls back. The bound client joins nested transactions and
 * rejects {@code subscribe} and {@code close}.</p>
 *
 * <p><strong>Row locks:</strong> {@link CacheContext#lockKey(String)} runs
 * {@code SELECT ... FOR UPDATE} on the key's row, inserting an already-expired placeholder
 * row first when the key has none, so absent keys can be locked too.</p>
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
public class JdbcCacheClient implements CacheClient, ExpiredEntryPurger, MessageCursorStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcCacheClient.class);
    private static final byte[] EMPTY = new byte[0];

    private final DataSource dataSource;
    private final JdbcCacheConfig config;
    private final Clock clock;
    private final boolean ownsDataSource;
    private final Set<Subscription> subscriptions;
    private final Connection boundConnection;
    private final CacheContext context;
    private volatile boolean closed;

    /**
     * Creates a client on a caller-managed data source.
     *
     * @param dataSource pooled data source returning auto-commit connections
     * @param config backend settings
     */
    public JdbcCacheClient(DataSource dataSource, JdbcCacheConfig config) {
        this(dataSource, config, Clock.systemUTC(), false);
    }

    /**
     * Creates a client.
     *
     * @param dataSource pooled data source returning auto-commit connections
     * @param config backend settings
     * @param clock source of "now" for expiry
     * @param ownsDataSource whether {@link #close()} also closes the data source
     * @throws IllegalArgumentException if any argument is null
     */
    public JdbcCacheClient(DataSource dataSource, JdbcCacheConfig config, Clock clock, boolean ownsDataSource) {
        if (dataSource == null) {
            throw new IllegalArgumentException("dataSource cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.dataSource = dataSource;
        this.config = config;
        this.clock = clock;
        this.ownsDataSource = ownsDataSource;
        this.subscriptions = ConcurrentHashMap.newKeySet();
        this.boundConnection = null;
        this.context = null;
    }

    private JdbcCacheClient(JdbcCacheClient root, Connection connection) {
        this.dataSource = root.dataSource;
        this.config = root.config;
        this.clock = root.clock;
        this.ownsDataSource = false;
        this.subscriptions = root.subscriptions;
        this.boundConnection = connection;
        this.context = new BoundContext();
    }

    // ============================================================
    // Scalar entries
    // ============================================================

    @Override
    public void set(String key, byte[] value, Duration ttl) {
        requireKey(key);
        requireValue(value);
        Instant now = now();
        LocalDateTime expireAt = toDb(Expiry.expireAt(ttl, now));
        SqlStatement upsert = config.dialect().upsertScalar(key, value, expireAt, toDb(now));
        execute("set " + key, connection -> update(connection, upsert));
    }

    @Override
    public byte[] getBytes(String key) {
        requireKey(key);
        LocalDateTime now = toDb(now());
        byte[] value = execute("get " + key, connection -> {
            try (PreparedStatement ps = prepare(connection, SqlStatement.of(
                "SELECT cache_value FROM cache_kvs WHERE cache_key = ? AND expire_time > ?", key, now));
                 ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getBytes(1) : null;
            }
        });
        if (value == null) {
            throw CacheNotFoundException.key(key);
        }
        return value;
    }

    @Override
    public long delete(String key) {
        requireKey(key);
        LocalDateTime now = toDb(now());
        return execute("delete " + key, connection -> (long) update(connection, SqlStatement.of(
            "DELETE FROM cache_kvs WHERE cache_key = ? AND expire_time > ?", key, now)));
    }

    @Override
    public long count(String... keys) {
        LocalDateTime now = toDb(now());
        SqlStatement query;
        if (keys == null || keys.length == 0) {
            query = SqlStatement.of("SELECT COUNT(*) FROM cache_kvs WHERE expire_time > ?", now);
        } else {
            Set<String> distinct = new LinkedHashSet<>();
            for (String key : keys) {
                requireKey(key);
                distinct.add(key);
            }
            List<Object> params = new ArrayList<>();
            params.add(now);
            params.addAll(distinct);
            String placeholders = String.join(", ", Collections.nCopies(distinct.size(), "?"));
            query = new SqlStatement(
                "SELECT COUNT(*) FROM cache_kvs WHERE expire_time > ? AND cache_key IN (" + placeholders + ")",
                params);
        }
        return execute("count", connection -> {
            try (PreparedStatement ps = prepare(connection, query);
                 ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getLong(1);
            }
        });
    }

    @Override
    public Duration ttl(String key) {
        requireKey(key);
        Instant now = now();
        LocalDateTime nowDb = toDb(now);
        LocalDateTime expireAt = execute("ttl " + key, connection -> {
            try (PreparedStatement ps = prepare(connection, SqlStatement.of(
                "SELECT expire_time FROM cache_kvs WHERE cache_key = ? AND expire_time > ?", key, nowDb));
                 ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getObject(1, LocalDateTime.class) : null;
            }
        });
        if (expireAt == null) {
            throw CacheNotFoundException.key(key);
        }
        return Expiry.remaining(fromDb(expireAt), now.truncatedTo(ChronoUnit.MILLIS));
    }

    @Override
    public boolean setNX(String key, byte[] value, Duration ttl) {
        requireKey(key);
        requireValue(value);
        Instant now = now();
        LocalDateTime expireAt = toDb(Expiry.expireAt(ttl, now));
        LocalDateTime nowDb = toDb(now);
        SqlStatement clearExpired = SqlStatement.of(
            "DELETE FROM cache_kvs WHERE cache_key = ? AND expire_time <= ?", key, nowDb);
        SqlStatement insert = config.dialect().insertScalarIfAbsent(key, value, expireAt, nowDb);

        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return execute("setnx " + key, connection -> {
                    update(connection, clearExpired);
                    return update(connection, insert) == 1;
                });
            } catch (CacheStoreException e) {
                // a racing insert of the same key may surface as a lock conflict
                if (boundConnection != null || !e.isTransient() || attempt >= config.conditionalInsertAttempts()) {
                    throw e;
                }
                log.debug("setNX {} attempt {} hit transient failure (sqlState={}), retrying",
                    key, attempt, e.getSqlState());
            }
        }
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        requireKey(key);
        Instant now = now();
        LocalDateTime expireAt = toDb(Expiry.expireAt(ttl, now));
        LocalDateTime nowDb = toDb(now);
        return execute("expire " + key, connection -> update(connection, SqlStatement.of(
            "UPDATE cache_kvs SET expire_time = ?, updated_at = ? WHERE cache_key = ? AND expire_time > ?",
            expireAt, nowDb, key, nowDb)) > 0);
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
        SqlStatement upsert = config.dialect().upsertMapField(key, field, value, toDb(now()));
        execute("hset " + key, connection -> update(connection, upsert));
    }

    @Override
    public String getMapField(String key, String field) {
        requireKey(key);
        requireField(field);
        String value = execute("hget " + key, connection -> {
            try (PreparedStatement ps = prepare(connection, SqlStatement.of(
                "SELECT cache_value FROM cache_maps WHERE cache_key = ? AND cache_field = ?", key, field));
                 ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        });
        if (value == null) {
            throw CacheNotFoundException.field(key, field);
        }
        return value;
    }

    @Override
    public long deleteMapField(String key, String field) {
        requireKey(key);
        requireField(field);
        return execute("hdel " + key, connection -> (long) update(connection, SqlStatement.of(
            "DELETE FROM cache_maps WHERE cache_key = ? AND cache_field = ?", key, field)));
    }

    @Override
    public Map<String, String> getMap(String key) {
        requireKey(key);
        Map<String, String> fields = execute("hgetall " + key, connection -> {
            try (PreparedStatement ps = prepare(connection, SqlStatement.of(
                "SELECT cache_field, cache_value FROM cache_maps WHERE cache_key = ? ORDER BY id", key));
                 ResultSet rs = ps.executeQuery()) {
                Map<String, String> result = new LinkedHashMap<>();
                while (rs.next()) {
                    result.put(rs.getString(1), rs.getString(2));
                }
                return result;
            }
        });
        if (fields.isEmpty()) {
            throw CacheNotFoundException.key(key);
        }
        return fields;
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
        SqlStatement query = MatchPattern.isPresent(match)
            ? SqlStatement.of(
                "SELECT cache_field, cache_value FROM cache_maps WHERE cache_key = ? AND cache_field LIKE ? "
                    + "ORDER BY id LIMIT ? OFFSET ?",
                key, MatchPattern.of(match).toSqlLike(), count, cursor)
            : SqlStatement.of(
                "SELECT cache_field, cache_value FROM cache_maps WHERE cache_key = ? "
                    + "ORDER BY id LIMIT ? OFFSET ?",
                key, count, cursor);

        List<String> entries = execute("hscan " + key, connection -> {
            try (PreparedStatement ps = prepare(connection, query);
                 ResultSet rs = ps.executeQuery()) {
                List<String> result = new ArrayList<>();
                while (rs.next()) {
                    result.add(rs.getString(1));
                    result.add(rs.getString(2));
                }
                return result;
            }
        });
        long rows = entries.size() / 2;
        return new ScanPage(entries, rows < count ? 0 : cursor + rows);
    }

    // ============================================================
    // Transactions
    // ============================================================

    @Override
    public <T> T transaction(CacheCallback<T> callback) {
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }
        if (boundConnection != null) {
            return callback.execute(context);
        }
        try (Connection connection = dataSource.getConnection()) {
            int previousIsolation = connection.getTransactionIsolation();
            connection.setTransactionIsolation(config.transactionIsolation());
            connection.setAutoCommit(false);
            try {
                T result = callback.execute(new JdbcCacheClient(this, connection).context);
                connection.commit();
                return result;
            } catch (SQLException e) {
                rollback(connection, e);
                throw new CacheStoreException("transaction commit failed", e);
            } catch (RuntimeException | Error e) {
                rollback(connection, e);
                throw e;
            } finally {
                restore(connection, previousIsolation);
            }
        } catch (SQLException e) {
            throw new CacheStoreException("transaction failed", e);
        }
    }

    private static void rollback(Connection connection, Throwable cause) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    private static void restore(Connection connection, int previousIsolation) {
        try {
            connection.setAutoCommit(true);
            connection.setTransactionIsolation(previousIsolation);
        } catch (SQLException e) {
            log.warn("Failed to restore connection state after transaction", e);
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
        LocalDateTime now = toDb(now());
        execute("publish " + channel, connection -> update(connection, SqlStatement.of(
            "INSERT INTO cache_messages (channel, message, created_at, updated_at) VALUES (?, ?, ?, ?)",
            channel, message, now, now)));
    }

    @Override
    public Subscription subscribe(String channel) {
        requireChannel(channel);
        if (boundConnection != null) {
            throw new IllegalStateException("subscribe is not allowed inside a transaction");
        }
        if (closed) {
            throw new IllegalStateException("client is closed");
        }
        subscriptions.removeIf(subscription -> !subscription.isActive());
        Subscription subscription = PollingSubscription.start(this, channel, config.subscription());
        subscriptions.add(subscription);
        return subscription;
    }

    @Override
    public long attach(String channel, String subscriberId) {
        SqlStatement reset = config.dialect().resetSubscription(channel, subscriberId, toDb(now()));
        execute("attach " + channel, connection -> update(connection, reset));
        return -1L;
    }

    @Override
    public List<ChannelMessage> fetchAfter(String channel, long afterId, int limit) {
        return execute("poll " + channel, connection -> {
            try (PreparedStatement ps = prepare(connection, SqlStatement.of(
                "SELECT id, message, created_at FROM cache_messages WHERE channel = ? AND id > ? "
                    + "ORDER BY id LIMIT ?", channel, afterId, limit));
                 ResultSet rs = ps.executeQuery()) {
                List<ChannelMessage> messages = new ArrayList<>();
                while (rs.next()) {
                    messages.add(new ChannelMessage(
                        rs.getLong(1), channel, rs.getString(2), fromDb(rs.getObject(3, LocalDateTime.class))));
                }
                return messages;
            }
        });
    }

    @Override
    public void advance(String channel, String subscriberId, long lastDeliveredId) {
        LocalDateTime now = toDb(now());
        execute("advance " + channel, connection -> update(connection, SqlStatement.of(
            "UPDATE cache_message_subscribes SET last_message_id = ?, updated_at = ? "
                + "WHERE channel = ? AND subscriber = ?", lastDeliveredId, now, channel, subscriberId)));
    }

    @Override
    public void detach(String channel, String subscriberId) {
        execute("detach " + channel, connection -> update(connection, SqlStatement.of(
            "DELETE FROM cache_message_subscribes WHERE channel = ? AND subscriber = ?", channel, subscriberId)));
    }

    /**
     * Reads the stored cursor of a subscriber.
     *
     * @param channel the channel name
     * @param subscriberId the subscriber id
     * @return last delivered id, or null if the subscriber has no cursor row
     */
    public Long cursorOf(String channel, String subscriberId) {
        return execute("cursor " + channel, connection -> {
            try (PreparedStatement ps = prepare(connection, SqlStatement.of(
                "SELECT last_message_id FROM cache_message_subscribes WHERE channel = ? AND subscriber = ?",
                channel, subscriberId));
                 ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : null;
            }
        });
    }

    // ============================================================
    // Lifecycle
    // ============================================================

    @Override
    public long purgeExpired() {
        LocalDateTime now = toDb(now());
        return execute("purge expired", connection -> (long) update(connection, SqlStatement.of(
            "DELETE FROM cache_kvs WHERE expire_time <= ?", now)));
    }

    @Override
    public void close() {
        if (boundConnection != null) {
            throw new IllegalStateException("close is not allowed inside a transaction");
        }
        if (closed) {
            return;
        }
        closed = true;
        for (Subscription subscription : subscriptions) {
            subscription.close();
        }
        subscriptions.clear();
        if (ownsDataSource && dataSource instanceof AutoCloseable) {
            try {
                ((AutoCloseable) dataSource).close();
            } catch (Exception e) {
                log.warn("Failed to close cache data source", e);
            }
        }
        log.debug("JDBC cache client closed");
    }

    // ============================================================
    // Plumbing
    // ============================================================

    @FunctionalInterface
    private interface SqlWork<T> {
        T run(Connection connection) throws SQLException;
    }

    private <T> T execute(String operation, SqlWork<T> work) {
        if (boundConnection != null) {
            try {
                return work.run(boundConnection);
            } catch (SQLException e) {
                throw new CacheStoreException(operation + " failed", e);
            }
        }
        try (Connection connection = dataSource.getConnection()) {
            return work.run(connection);
        } catch (SQLException e) {
            throw new CacheStoreException(operation + " failed", e);
        }
    }

    private static PreparedStatement prepare(Connection connection, SqlStatement statement) throws SQLException {
        PreparedStatement ps = connection.prepareStatement(statement.sql());
        try {
            List<Object> params = statement.params();
            for (int i = 0; i < params.size(); i++) {
                Object param = params.get(i);
                if (param instanceof byte[]) {
                    ps.setBytes(i + 1, (byte[]) param);
                } else {
                    ps.setObject(i + 1, param);
                }
            }
            return ps;
        } catch (SQLException e) {
            ps.close();
            throw e;
        }
    }

    private static int update(Connection connection, SqlStatement statement) throws SQLException {
        try (PreparedStatement ps = prepare(connection, statement)) {
            return ps.executeUpdate();
        }
    }

    private Instant now() {
        return clock.instant();
    }

    static LocalDateTime toDb(Instant instant) {
        return LocalDateTime.ofInstant(instant.truncatedTo(ChronoUnit.MILLIS), ZoneOffset.UTC);
    }

    static Instant fromDb(LocalDateTime value) {
        return value.toInstant(ZoneOffset.UTC);
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

    private static void requireValue(byte[] value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
    }

    private static void requireChannel(String channel) {
        if (channel == null || channel.isBlank()) {
            throw new IllegalArgumentException("channel cannot be null or blank");
        }
    }

    private final class BoundContext implements CacheContext {

        @Override
        public CacheClient client() {
            return JdbcCacheClient.this;
        }

        @Override
        public void lockKey(String key) {
            requireKey(key);
            SqlStatement select = SqlStatement.of("SELECT id FROM cache_kvs WHERE cache_key = ? FOR UPDATE", key);
            execute("lock " + key, connection -> {
                if (selectsRow(connection, select)) {
                    return null;
                }
                LocalDateTime now = toDb(now());
                update(connection, config.dialect().insertScalarIfAbsent(key, EMPTY, toDb(Expiry.EXPIRED), now));
                if (!selectsRow(connection, select)) {
                    // placeholder of a concurrent transaction is not visible yet
                    throw new SQLTransactionRollbackException("row lock not acquired for key " + key, "40001");
                }
                return null;
            });
        }

        private boolean selectsRow(Connection connection, SqlStatement select) throws SQLException {
            try (PreparedStatement ps = prepare(connection, select);
                 ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }
}
