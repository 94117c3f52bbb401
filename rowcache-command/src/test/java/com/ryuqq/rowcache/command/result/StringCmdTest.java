package com.ryuqq.rowcache.command.result;

import com.ryuqq.rowcache.core.error.CacheNotFoundException;
import com.ryuqq.rowcache.core.error.CacheValidationException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 결과 래퍼 테스트.
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
class StringCmdTest {

    @Test
    void int64_NegativeNumber_Parses() {
        assertThat(StringCmd.ok("get", "-15").int64()).isEqualTo(-15L);
    }

    @Test
    void int64_NotANumber_ThrowsValidation() {
        assertThatThrownBy(() -> StringCmd.ok("get", "12a").int64())
            .isInstanceOf(CacheValidationException.class)
            .hasMessageContaining("12a");
    }

    @Test
    void int64_FailedCmd_RethrowsCapturedError() {
        CacheNotFoundException notFound = CacheNotFoundException.key("k");

        assertThatThrownBy(() -> StringCmd.failed("get", notFound).int64()).isSameAs(notFound);
    }

    @Test
    void bytes_ReturnsUtf8() {
        assertThat(StringCmd.ok("get", "한글").bytes()).isEqualTo("한글".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void failed_ExposesZeroValues() {
        CacheNotFoundException notFound = CacheNotFoundException.key("k");

        assertThat(IntCmd.failed("del", notFound).val()).isZero();
        assertThat(BoolCmd.failed("expire", notFound).val()).isFalse();
        assertThat(StatusCmd.failed("set", notFound).val()).isEmpty();
        assertThat(MapStringStringCmd.failed("hgetall", notFound).val()).isEmpty();
        assertThat(StringSliceCmd.failed("lrange", notFound).val()).isEmpty();
    }

    @Test
    void failed_NullError_ThrowsException() {
        assertThatThrownBy(() -> IntCmd.failed("del", null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("err cannot be null");
    }

    @Test
    void toString_ShowsNameAndOutcome() {
        assertThat(StatusCmd.ok("set")).hasToString("set: OK");
        assertThat(IntCmd.failed("del", CacheNotFoundException.key("k"))).hasToString("del: cache not found: k");
    }
}
