package com.ryuqq.rowcache.adapter.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * HikariCP 커넥션 풀 생성.
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
public final class JdbcDataSources {

    private JdbcDataSources() {
    }

    /**
     * 설정으로 HikariCP 풀 생성.
     *
     * <p>풀 커넥션은 auto-commit 상태로 반환됩니다. {@link JdbcCacheClient}는
     * transaction() 안에서만 auto-commit을 끕니다.</p>
     *
     * @param config 커넥션 풀 설정
     * @return 새 풀 (호출자가 close 책임)
     */
    public static HikariDataSource hikari(JdbcDataSourceConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setPoolName("rowcache");
        hikariConfig.setJdbcUrl(config.jdbcUrl());
        if (config.username() != null) {
            hikariConfig.setUsername(config.username());
        }
        if (config.password() != null) {
            hikariConfig.setPassword(config.password());
        }
        hikariConfig.setMaximumPoolSize(config.maximumPoolSize());
        hikariConfig.setConnectionTimeout(config.connectionTimeoutMs());
        hikariConfig.setAutoCommit(true);
        return new HikariDataSource(hikariConfig);
    }
}
