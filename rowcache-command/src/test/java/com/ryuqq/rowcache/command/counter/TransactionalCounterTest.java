package com.ryuqq.rowcache.command.counter;

import com.ryuqq.rowcache.core.error.CacheNotFoundException;
import com.ryuqq.rowcache.core.error.CacheStoreException;
import com.ryuqq.rowcache.core.error.CacheValidationException;
import com.ryuqq.rowcache.core.spi.CacheCallback;
import com.ryuqq.rowcache.core.spi.CacheClient;
import com.ryuqq.rowcache.core.spi.CacheContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.SQLException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * TransactionalCounter 유닛 테스트.
 *
 * <p>잠금 → 읽기 → 파싱 → 쓰기 순서, TTL 유지, 검증 실패, 일시적 실패 재시도를 검증합니다.</p>
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class TransactionalCounterTest {

    @Mock
    private CacheClient client;

    @Mock
    private CacheClient txClient;

    @Mock
    private CacheContext context;

    private TransactionalCounter counter;

    @BeforeEach
    void setUp() {
        counter = new TransactionalCounter(client, new CounterRetryConfig(3, 0, 0));
    }

    private void runTransactionsInline() {
        when(context.client()).thenReturn(txClient);
        when(client.transaction(any())).thenAnswer(invocation -> {
            CacheCallback<?> callback = invocation.getArgument(0);
            return callback.execute(context);
        });
    }

    private static CacheStoreException deadlock() {
        return new CacheStoreException("deadlock", new SQLException("Deadlock found", "40001", 1213));
    }

    // ============================================================
    // 1. 정상 흐름
    // ============================================================

    @Test
    void incrBy_없는_키는_0에서_시작하고_만료없이_저장한다() {
        // given
        runTransactionsInline();
        when(txClient.getString("hits")).thenThrow(CacheNotFoundException.key("hits"));

        // when
        long result = counter.incrBy("hits", 5);

        // then
        assertThat(result).isEqualTo(5L);
        InOrder order = inOrder(context, txClient);
        order.verify(context).lockKey("hits");
        order.verify(txClient).getString("hits");
        order.verify(txClient).set("hits", "5", Duration.ZERO);
    }

    @Test
    void incrBy_기존_TTL을_유지한다() {
        // given
        runTransactionsInline();
        when(txClient.getString("hits")).thenReturn("10");
        when(txClient.ttl("hits")).thenReturn(Duration.ofSeconds(30));

        // when
        long result = counter.incrBy("hits", -3);

        // then
        assertThat(result).isEqualTo(7L);
        verify(txClient).set("hits", "7", Duration.ofSeconds(30));
    }

    @Test
    void incr_1씩_증가한다() {
        runTransactionsInline();
        when(txClient.getString("hits")).thenReturn("41");
        when(txClient.ttl("hits")).thenReturn(Duration.ZERO);

        assertThat(counter.incr("hits")).isEqualTo(42L);
    }

    // ============================================================
    // 2. 검증 실패
    // ============================================================

    @Test
    void incrBy_정수가_아닌_값은_Validation이고_쓰지_않는다() {
        // given
        runTransactionsInline();
        when(txClient.getString("name")).thenReturn("alice");

        // when & then
        assertThatThrownBy(() -> counter.incrBy("name", 1))
            .isInstanceOf(CacheValidationException.class)
            .hasMessageContaining("not an integer");
        verify(txClient, never()).set(anyString(), anyString(), any(Duration.class));
        verify(client, times(1)).transaction(any());
    }

    @Test
    void incrBy_overflow는_Validation() {
        // given
        runTransactionsInline();
        when(txClient.getString("big")).thenReturn(Long.toString(Long.MAX_VALUE));
        when(txClient.ttl("big")).thenReturn(Duration.ZERO);

        // when & then
        assertThatThrownBy(() -> counter.incrBy("big", 1))
            .isInstanceOf(CacheValidationException.class)
            .hasMessageContaining("overflow");
        verify(txClient, never()).set(anyString(), anyString(), any(Duration.class));
    }

    // ============================================================
    // 3. 재시도
    // ============================================================

    @Test
    void incrBy_일시적_실패는_재시도한다() {
        // given
        when(client.transaction(any()))
            .thenThrow(deadlock())
            .thenReturn(11L);

        // when
        long result = counter.incrBy("hits", 1);

        // then
        assertThat(result).isEqualTo(11L);
        verify(client, times(2)).transaction(any());
    }

    @Test
    void incrBy_최대_시도_후에는_실패를_전파한다() {
        // given
        when(client.transaction(any())).thenThrow(deadlock());

        // when & then
        assertThatThrownBy(() -> counter.incrBy("hits", 1))
            .isInstanceOf(CacheStoreException.class);
        verify(client, times(3)).transaction(any());
    }

    @Test
    void incrBy_일시적이지_않은_실패는_재시도하지_않는다() {
        // given
        when(client.transaction(any()))
            .thenThrow(new CacheStoreException("bad sql", new SQLException("syntax", "42000", 1064)));

        // when & then
        assertThatThrownBy(() -> counter.incrBy("hits", 1)).isInstanceOf(CacheStoreException.class);
        verify(client, times(1)).transaction(any());
    }

    @Test
    void constructor_retryConfig가_null이면_예외() {
        assertThatThrownBy(() -> new TransactionalCounter(client, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("retryConfig");
    }
}
