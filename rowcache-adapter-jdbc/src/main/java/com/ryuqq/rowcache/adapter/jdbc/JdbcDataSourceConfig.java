package com.ryuqq.rowcache.adapter.jdbc;

/**
 * 커넥션 풀 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>jdbcUrl: 접속 URL (필수)</li>
 *   <li>username / password: 인증 정보 (선택)</li>
 *   <li>maximumPoolSize: 최대 커넥션 수 (기본 10)</li>
 *   <li>connectionTimeoutMs: 커넥션 획득 대기 시간 (기본 30000ms)</li>
 * </ul>
 *
 * @author Rowcache Team
 * @since 1.0.0
 * @param jdbcUrl JDBC URL
 * @param username 사용자명 (null 허용)
 * @param password 비밀번호 (null 허용)
 * @param maximumPoolSize 최대 풀 크기 (1 이상)
 * @param connectionTimeoutMs 커넥션 획득 대기 시간 (250ms 이상, HikariCP 하한)
 */
public record JdbcDataSourceConfig(
    String jdbcUrl,
    String username,
    String password,
    int maximumPoolSize,
    long connectionTimeoutMs
) {

    public JdbcDataSourceConfig(String jdbcUrl, String username, String password) {
        this(jdbcUrl, username, password, 10, 30000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public JdbcDataSourceConfig {
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            throw new IllegalArgumentException("jdbcUrl cannot be null or blank");
        }
        if (maximumPoolSize <= 0) {
            throw new IllegalArgumentException(
                "maximumPoolSize must be positive (current: " + maximumPoolSize + ")"
            );
        }
        if (connectionTimeoutMs < 250) {
            throw new IllegalArgumentException(
                "connectionTimeoutMs must be >= 250 (current: " + connectionTimeoutMs + ")"
            );
        }
    }

    public JdbcDataSourceConfig withMaximumPoolSize(int maximumPoolSize) {
        return new JdbcDataSourceConfig(jdbcUrl, username, password, maximumPoolSize, connectionTimeoutMs);
    }

    public JdbcDataSourceConfig withConnectionTimeoutMs(long connectionTimeoutMs) {
        return new JdbcDataSourceConfig(jdbcUrl, username, password, maximumPoolSize, connectionTimeoutMs);
    }

    @Override
    public String toString() {
        return "JdbcDataSourceConfig[jdbcUrl=" + jdbcUrl
            + ", username=" + username
            + ", password=" + (password == null ? "null" : "****")
            + ", maximumPoolSize=" + maximumPoolSize
            + ", connectionTimeoutMs=" + connectionTimeoutMs + "]";
    }
}
