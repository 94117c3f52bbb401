/**
 * Relational-store cache backend.
 *
 * <p>{@link com.ryuqq.rowcache.adapter.jdbc.JdbcCacheClient} maps scalar entries, map entries,
 * the message log and subscription cursors onto four tables. {@link com.ryuqq.rowcache.adapter.jdbc.SqlDialect}
 * holds the few statements that differ between stores and
 * {@link com.ryuqq.rowcache.adapter.jdbc.JdbcCacheSchema} creates the tables.</p>
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
package com.ryuqq.rowcache.adapter.jdbc;
