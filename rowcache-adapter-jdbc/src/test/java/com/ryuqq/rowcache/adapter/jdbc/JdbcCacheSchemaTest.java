package com.ryuqq.rowcache.adapter.jdbc;

import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class JdbcCacheSchemaTest {

    @ParameterizedTest
    @EnumSource(SqlDialect.class)
    void statements_EveryDialect_CreatesFourTablesIdempotently(SqlDialect dialect) {
        List<String> statements = JdbcCacheSchema.statements(dialect);

        assertThat(statements)
            .allSatisfy(ddl -> assertThat(ddl).matches("(?s)CREATE (TABLE|INDEX) IF NOT EXISTS .*"));
        assertThat(statements)
            .filteredOn(ddl -> ddl.startsWith("CREATE TABLE"))
            .extracting(ddl -> ddl.split("\\s+")[5])
            .containsExactly("cache_kvs", "cache_maps", "cache_messages", "cache_message_subscribes");
    }

    @Test
    void statements_Postgresql_IndexesExpiryAndChannelCursor() {
        assertThat(JdbcCacheSchema.statements(SqlDialect.POSTGRESQL))
            .filteredOn(ddl -> ddl.startsWith("CREATE INDEX"))
            .hasSize(2)
            .anySatisfy(ddl -> assertThat(ddl).contains("cache_kvs (expire_time)"))
            .anySatisfy(ddl -> assertThat(ddl).contains("cache_messages (channel, id)"));
    }

    @Test
    void createIfAbsent_RunTwice_KeepsExistingTables() throws SQLException {
        try (HikariDataSource dataSource = H2Stores.newDataSource()) {
            assertThatCode(() -> JdbcCacheSchema.createIfAbsent(dataSource, SqlDialect.MYSQL))
                .doesNotThrowAnyException();

            try (Connection connection = dataSource.getConnection();
                 ResultSet tables = connection.getMetaData().getTables(null, null, "cache_%", null)) {
                int count = 0;
                while (tables.next()) {
                    count++;
                }
                assertThat(count).isEqualTo(4);
            }
        }
    }
}
