package com.ryuqq.rowcache.adapter.jdbc;

import java.time.LocalDateTime;

/**
 * Store-specific SQL for the statements standard SQL cannot express portably.
 *
 * <p>Only upserts and conditional inserts differ between stores; every other statement of
 * {@link JdbcCacheClient} is plain SQL.</p>
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
public enum SqlDialect {

    /**
     * MySQL and MySQL-compatible stores (OceanBase MySQL mode, H2 MODE=MySQL).
     */
    MYSQL("rowcache/schema-mysql.sql") {
        @Override
        public SqlStatement upsertScalar(String key, byte[] value, LocalDateTime expireAt, LocalDateTime now) {
            return SqlStatement.of(
                "INSERT INTO cache_kvs (cache_key, cache_value, expire_time, created_at, updated_at) "
                    + "VALUES (?, ?, ?, ?, ?) "
                    + "ON DUPLICATE KEY UPDATE cache_value = ?, expire_time = ?, updated_at = ?",
                key, value, expireAt, now, now, value, expireAt, now);
        }

        @Override
        public SqlStatement insertScalarIfAbsent(String key, byte[] value, LocalDateTime expireAt, LocalDateTime now) {
            return SqlStatement.of(
                "INSERT IGNORE INTO cache_kvs (cache_key, cache_value, expire_time, created_at, updated_at) "
                    + "VALUES (?, ?, ?, ?, ?)",
                key, value, expireAt, now, now);
        }

        @Override
        public SqlStatement upsertMapField(String key, String field, String value, LocalDateTime now) {
            return SqlStatement.of(
                "INSERT INTO cache_maps (cache_key, cache_field, cache_value, created_at, updated_at) "
                    + "VALUES (?, ?, ?, ?, ?) "
                    + "ON DUPLICATE KEY UPDATE cache_value = ?, updated_at = ?",
                key, field, value, now, now, value, now);
        }

        @Override
        public SqlStatement resetSubscription(String channel, String subscriber, LocalDateTime now) {
            return SqlStatement.of(
                "INSERT INTO cache_message_subscribes (channel, subscriber, last_message_id, created_at, updated_at) "
                    + "VALUES (?, ?, -1, ?, ?) "
                    + "ON DUPLICATE KEY UPDATE last_message_id = -1, updated_at = ?",
                channel, subscriber, now, now, now);
        }
    },

    /**
     * PostgreSQL.
     */
    POSTGRESQL("rowcache/schema-postgresql.sql") {
        @Override
        public SqlStatement upsertScalar(String key, byte[] value, LocalDateTime expireAt, LocalDateTime now) {
            return SqlStatement.of(
                "INSERT INTO cache_kvs (cache_key, cache_value, expire_time, created_at, updated_at) "
                    + "VALUES (?, ?, ?, ?, ?) "
                    + "ON CONFLICT (cache_key) DO UPDATE SET cache_value = EXCLUDED.cache_value, "
                    + "expire_time = EXCLUDED.expire_time, updated_at = EXCLUDED.updated_at",
                key, value, expireAt, now, now);
        }

        @Override
        public SqlStatement insertScalarIfAbsent(String key, byte[] value, LocalDateTime expireAt, LocalDateTime now) {
            return SqlStatement.of(
                "INSERT INTO cache_kvs (cache_key, cache_value, expire_time, created_at, updated_at) "
                    + "VALUES (?, ?, ?, ?, ?) ON CONFLICT (cache_key) DO NOTHING",
                key, value, expireAt, now, now);
        }

        @Override
        public SqlStatement upsertMapField(String key, String field, String value, LocalDateTime now) {
            return SqlStatement.of(
                "INSERT INTO cache_maps (cache_key, cache_field, cache_value, created_at, updated_at) "
                    + "VALUES (?, ?, ?, ?, ?) "
                    + "ON CONFLICT (cache_key, cache_field) DO UPDATE SET cache_value = EXCLUDED.cache_value, "
                    + "updated_at = EXCLUDED.updated_at",
                key, field, value, now, now);
        }

        @Override
        public SqlStatement resetSubscription(String channel, String subscriber, LocalDateTime now) {
            return SqlStatement.of(
                "INSERT INTO cache_message_subscribes (channel, subscriber, last_message_id, created_at, updated_at) "
                    + "VALUES (?, ?, -1, ?, ?) "
                    + "ON CONFLICT (channel, subscriber) DO UPDATE SET last_message_id = -1, "
                    + "updated_at = EXCLUDED.updated_at",
                channel, subscriber, now, now);
        }
    };

    private final String schemaResource;

    SqlDialect(String schemaResource) {
        this.schemaResource = schemaResource;
    }

    /**
     * Classpath location of the DDL creating the four cache tables.
     *
     * @return resource path
     */
    public String schemaResource() {
        return schemaResource;
    }

    /**
     * Insert-or-update of a scalar entry keyed by {@code cache_key}.
     */
    public abstract SqlStatement upsertScalar(String key, byte[] value, LocalDateTime expireAt, LocalDateTime now);

    /**
     * Insert of a scalar entry that affects no row when the key already has a row.
     */
    public abstract SqlStatement insertScalarIfAbsent(String key, byte[] value, LocalDateTime expireAt, LocalDateTime now);

    /**
     * Insert-or-update of one map field keyed by {@code (cache_key, cache_field)}.
     */
    public abstract SqlStatement upsertMapField(String key, String field, String value, LocalDateTime now);

    /**
     * Creates the cursor row of a subscriber, or resets an existing one to {@code -1}.
     */
    public abstract SqlStatement resetSubscription(String channel, String subscriber, LocalDateTime now);
}
