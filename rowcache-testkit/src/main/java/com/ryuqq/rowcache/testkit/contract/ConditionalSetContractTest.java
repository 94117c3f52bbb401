package com.ryuqq.rowcache.testkit.contract;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract Test: conditional create (setNX).
 *
 * <p>The first writer wins, a live entry is never overwritten, and an expired entry
 * can be claimed again.</p>
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
public abstract class ConditionalSetContractTest extends AbstractCacheContractTest {

    @Test
    void testSetNX_FirstWins() {
        assertThat(client.setNX("lock", "owner-1", Duration.ofSeconds(30))).isTrue();
        assertThat(client.setNX("lock", "owner-2", Duration.ofSeconds(30))).isFalse();

        assertThat(client.getString("lock")).isEqualTo("owner-1");
    }

    @Test
    void testSetNX_AfterExpiry_SucceedsAgain() {
        client.setNX("lock", "owner-1", Duration.ofSeconds(5));
        clock.advance(Duration.ofSeconds(5));

        assertThat(client.setNX("lock", "owner-2", Duration.ofSeconds(5))).isTrue();
        assertThat(client.getString("lock")).isEqualTo("owner-2");
    }

    @Test
    void testSetNX_AfterDelete_SucceedsAgain() {
        client.setNX("lock", "owner-1", Duration.ZERO);
        client.delete("lock");

        assertThat(client.setNX("lock", "owner-2", Duration.ZERO)).isTrue();
    }

    @Test
    void testSetNX_ExistingPlainSet_ReturnsFalse() {
        client.set("lock", "taken", Duration.ZERO);

        assertThat(client.setNX("lock", "owner", Duration.ZERO)).isFalse();
        assertThat(client.getString("lock")).isEqualTo("taken");
    }

    @Test
    void testSetNX_ConcurrentCallers_ExactlyOneWins() throws Exception {
        // Given
        int callers = 10;
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();

        try {
            for (int i = 0; i < callers; i++) {
                String owner = "owner-" + i;
                Callable<Boolean> attempt = () -> {
                    start.await();
                    return client.setNX("lock", owner, Duration.ofMinutes(1));
                };
                results.add(executor.submit(attempt));
            }

            // When
            start.countDown();
            int winners = 0;
            for (Future<Boolean> result : results) {
                if (result.get(30, TimeUnit.SECONDS)) {
                    winners++;
                }
            }

            // Then
            assertThat(winners).isEqualTo(1);
            assertThat(client.count("lock")).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }
}
