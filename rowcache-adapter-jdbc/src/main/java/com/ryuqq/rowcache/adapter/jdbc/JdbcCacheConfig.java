package com.ryuqq.rowcache.adapter.jdbc;

import com.ryuqq.rowcache.core.pubsub.SubscriptionConfig;

import java.sql.Connection;
import java.util.Set;

/**
 * JDBC 백엔드 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>dialect: SQL 방언 (기본 MYSQL)</li>
 *   <li>subscription: 구독 폴링 설정 (기본 100ms / 10건 / 버퍼 100)</li>
 *   <li>transactionIsolation: transaction() 격리 수준 (기본 READ_COMMITTED)</li>
 *   <li>conditionalInsertAttempts: setNX가 일시적 실패를 재시도하는 최대 횟수 (기본 3)</li>
 * </ul>
 *
 * @author Rowcache Team
 * @since 1.0.0
 * @param dialect SQL 방언 (null이 아니어야 함)
 * @param subscription 구독 설정 (null이 아니어야 함)
 * @param transactionIsolation {@link Connection}의 TRANSACTION_* 상수 (NONE 제외)
 * @param conditionalInsertAttempts setNX 최대 시도 횟수 (1 이상)
 */
public record JdbcCacheConfig(
    SqlDialect dialect,
    SubscriptionConfig subscription,
    int transactionIsolation,
    int conditionalInsertAttempts
) {

    private static final Set<Integer> ISOLATION_LEVELS = Set.of(
        Connection.TRANSACTION_READ_UNCOMMITTED,
        Connection.TRANSACTION_READ_COMMITTED,
        Connection.TRANSACTION_REPEATABLE_READ,
        Connection.TRANSACTION_SERIALIZABLE
    );

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: dialect=MYSQL, subscription=기본값, transactionIsolation=READ_COMMITTED,
     * conditionalInsertAttempts=3</p>
     */
    public JdbcCacheConfig() {
        this(SqlDialect.MYSQL, new SubscriptionConfig(), Connection.TRANSACTION_READ_COMMITTED, 3);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public JdbcCacheConfig {
        if (dialect == null) {
            throw new IllegalArgumentException("dialect cannot be null");
        }
        if (subscription == null) {
            throw new IllegalArgumentException("subscription cannot be null");
        }
        if (!ISOLATION_LEVELS.contains(transactionIsolation)) {
            throw new IllegalArgumentException(
                "transactionIsolation must be a JDBC isolation level (current: " + transactionIsolation + ")"
            );
        }
        if (conditionalInsertAttempts <= 0) {
            throw new IllegalArgumentException(
                "conditionalInsertAttempts must be positive (current: " + conditionalInsertAttempts + ")"
            );
        }
    }

    public JdbcCacheConfig withDialect(SqlDialect dialect) {
        return new JdbcCacheConfig(dialect, subscription, transactionIsolation, conditionalInsertAttempts);
    }

    public JdbcCacheConfig withSubscription(SubscriptionConfig subscription) {
        return new JdbcCacheConfig(dialect, subscription, transactionIsolation, conditionalInsertAttempts);
    }

    public JdbcCacheConfig withTransactionIsolation(int transactionIsolation) {
        return new JdbcCacheConfig(dialect, subscription, transactionIsolation, conditionalInsertAttempts);
    }

    public JdbcCacheConfig withConditionalInsertAttempts(int conditionalInsertAttempts) {
        return new JdbcCacheConfig(dialect, subscription, transactionIsolation, conditionalInsertAttempts);
    }
}
