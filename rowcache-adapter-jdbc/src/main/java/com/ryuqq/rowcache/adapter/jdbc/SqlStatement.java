package com.ryuqq.rowcache.adapter.jdbc;

import java.util.Arrays;
import java.util.List;

/**
 * SQL text with its positional parameters.
 *
 * @param sql SQL with {@code ?} placeholders
 * @param params parameters in placeholder order
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
public record SqlStatement(String sql, List<Object> params) {

    public SqlStatement {
        if (sql == null || sql.isBlank()) {
            throw new IllegalArgumentException("sql cannot be null or blank");
        }
        if (params == null) {
            throw new IllegalArgumentException("params cannot be null");
        }
        params = List.copyOf(params);
    }

    public static SqlStatement of(String sql, Object... params) {
        return new SqlStatement(sql, Arrays.asList(params));
    }
}
