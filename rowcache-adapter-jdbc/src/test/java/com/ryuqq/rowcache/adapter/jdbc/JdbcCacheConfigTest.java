package com.ryuqq.rowcache.adapter.jdbc;

import com.ryuqq.rowcache.core.pubsub.SubscriptionConfig;
import org.junit.jupiter.api.Test;

import java.sql.Connection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdbcCacheConfigTest {

    @Test
    void defaults() {
        JdbcCacheConfig config = new JdbcCacheConfig();

        assertThat(config.dialect()).isEqualTo(SqlDialect.MYSQL);
        assertThat(config.subscription()).isEqualTo(new SubscriptionConfig());
        assertThat(config.transactionIsolation()).isEqualTo(Connection.TRANSACTION_READ_COMMITTED);
        assertThat(config.conditionalInsertAttempts()).isEqualTo(3);
    }

    @Test
    void invalidValues_AreRejected() {
        assertThatThrownBy(() -> new JdbcCacheConfig().withDialect(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("dialect");
        assertThatThrownBy(() -> new JdbcCacheConfig().withTransactionIsolation(Connection.TRANSACTION_NONE))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("transactionIsolation");
        assertThatThrownBy(() -> new JdbcCacheConfig().withConditionalInsertAttempts(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("(current: 0)");
    }

    @Test
    void dataSourceConfig_ToString_MasksPassword() {
        JdbcDataSourceConfig config = new JdbcDataSourceConfig("jdbc:h2:mem:x", "sa", "secret");

        assertThat(config.toString()).doesNotContain("secret");
        assertThat(config.maximumPoolSize()).isEqualTo(10);
    }
}
