package com.ryuqq.rowcache.core.error;

import org.junit.jupiter.api.Test;

import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * CacheStoreException 테스트.
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
class CacheStoreExceptionTest {

    @Test
    void constructor_SqlException_CarriesSqlState() {
        // Given
        SQLException cause = new SQLException("Deadlock found", "40001", 1213);

        // When
        CacheStoreException exception = new CacheStoreException("set failed", cause);

        // Then
        assertThat(exception.getSqlState()).isEqualTo("40001");
        assertThat(exception.getErrorCode()).isEqualTo(1213);
        assertThat(exception.getMessage()).contains("set failed").contains("Deadlock found");
        assertThat(exception.getCause()).isSameAs(cause);
        assertThat(exception.isTransient()).isTrue();
    }

    @Test
    void isTransient_LockWaitTimeout_ReturnsTrue() {
        assertThat(new CacheStoreException("x", new SQLException("lock", "HY000", 1205)).isTransient()).isTrue();
        assertThat(new CacheStoreException("x", new SQLException("lock", "HYT00", 50200)).isTransient()).isTrue();
    }

    @Test
    void isTransient_ConstraintViolation_ReturnsFalse() {
        assertThat(new CacheStoreException("x", new SQLException("dup", "23000", 1062)).isTransient()).isFalse();
    }

    @Test
    void hierarchy_AllRootedAtCacheException() {
        assertThat(new CacheNotFoundException("x")).isInstanceOf(CacheException.class);
        assertThat(new CacheNotInitializedException()).isInstanceOf(CacheException.class)
            .hasMessage("cache not init");
        assertThat(new CacheValidationException("x")).isInstanceOf(CacheException.class);
        assertThat(CacheNotFoundException.key("k")).hasMessage("cache not found: k");
    }
}
