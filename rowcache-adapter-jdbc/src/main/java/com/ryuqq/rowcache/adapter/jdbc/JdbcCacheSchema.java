package com.ryuqq.rowcache.adapter.jdbc;

import com.ryuqq.rowcache.core.error.CacheStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * 캐시 테이블 생성.
 *
 * <p>방언별 DDL 리소스를 읽어 {@code CREATE TABLE IF NOT EXISTS}로 네 테이블을 만듭니다.
 * 이미 있는 테이블은 건드리지 않으므로 프로세스 시작마다 호출해도 됩니다.</p>
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
public final class JdbcCacheSchema {

    private static final Logger log = LoggerFactory.getLogger(JdbcCacheSchema.class);

    private JdbcCacheSchema() {
    }

    /**
     * 캐시 테이블이 없으면 생성.
     *
     * @param dataSource 대상 저장소
     * @param dialect SQL 방언
     * @throws CacheStoreException DDL 실행 실패 시
     */
    public static void createIfAbsent(DataSource dataSource, SqlDialect dialect) {
        if (dataSource == null) {
            throw new IllegalArgumentException("dataSource cannot be null");
        }
        if (dialect == null) {
            throw new IllegalArgumentException("dialect cannot be null");
        }
        List<String> statements = statements(dialect);
        try (Connection connection = dataSource.getConnection();
             Statement statement = connection.createStatement()) {
            for (String ddl : statements) {
                statement.execute(ddl);
            }
        } catch (SQLException e) {
            throw new CacheStoreException("failed to create cache schema", e);
        }
        log.info("Cache schema ready ({} statements, dialect={})", statements.size(), dialect);
    }

    static List<String> statements(SqlDialect dialect) {
        String script = load(dialect.schemaResource());
        List<String> statements = new ArrayList<>();
        for (String part : script.split(";")) {
            String ddl = part.trim();
            if (!ddl.isEmpty()) {
                statements.add(ddl);
            }
        }
        return statements;
    }

    private static String load(String resource) {
        try (InputStream in = JdbcCacheSchema.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("schema resource not found: " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read schema resource: " + resource, e);
        }
    }
}
