package com.ryuqq.rowcache.testkit.contract;

import com.ryuqq.rowcache.command.Cmdable;
import com.ryuqq.rowcache.command.CmdableAdapter;
import com.ryuqq.rowcache.command.result.IntCmd;
import com.ryuqq.rowcache.core.error.CacheNotFoundException;
import com.ryuqq.rowcache.core.error.CacheValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

/**
 * Contract Test: transactional counter and command adapter over a real backend.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>N concurrent increments of an absent key converge to N</li>
 *   <li>A non-integer value fails validation and is left untouched</li>
 *   <li>The counter keeps the TTL of an existing entry</li>
 *   <li>hSet/del/exists/list commands through the adapter</li>
 * </ul>
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
public abstract class CounterContractTest extends AbstractCacheContractTest {

    protected Cmdable cmdable;

    @BeforeEach
    protected void setUpCmdable() {
        cmdable = new CmdableAdapter(client);
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 10, 100})
    void testIncr_ConcurrentCallers_ConvergeToCallerCount(int callers) throws Exception {
        // Given
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(callers, 32));
        CountDownLatch start = new CountDownLatch(1);
        List<Future<IntCmd>> results = new ArrayList<>();

        try {
            for (int i = 0; i < callers; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return cmdable.incr("hits");
                }));
            }

            // When
            start.countDown();
            List<Long> observed = new ArrayList<>();
            for (Future<IntCmd> result : results) {
                observed.add(result.get(60, TimeUnit.SECONDS).result());
            }

            // Then
            assertThat(cmdable.get("hits").int64()).isEqualTo(callers);
            assertThat(observed).doesNotHaveDuplicates();
            assertThat(observed).allSatisfy(value -> assertThat(value).isBetween(1L, (long) callers));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testIncrBy_AbsentKey_StartsFromZero() {
        assertThat(cmdable.incrBy("n", 5).result()).isEqualTo(5L);
        assertThat(cmdable.incrBy("n", -8).result()).isEqualTo(-3L);
        assertThat(client.getString("n")).isEqualTo("-3");
        assertThat(client.ttl("n")).isEqualTo(Duration.ZERO);
    }

    @Test
    void testIncr_NonIntegerValue_FailsAndKeepsValue() {
        client.set("name", "alice", Duration.ZERO);

        IntCmd cmd = cmdable.incr("name");

        assertThat(cmd.err()).isInstanceOf(CacheValidationException.class);
        assertThat(client.getString("name")).isEqualTo("alice");
    }

    @Test
    void testIncr_KeepsExistingTtl() {
        // Given
        client.set("rate", "1", Duration.ofSeconds(60));
        clock.advance(Duration.ofSeconds(20));

        // When
        cmdable.incr("rate");

        // Then
        assertThat(client.getString("rate")).isEqualTo("2");
        assertThat(client.ttl("rate")).isEqualTo(Duration.ofSeconds(40));
        clock.advance(Duration.ofSeconds(40));
        assertThat(client.count("rate")).isZero();
    }

    @Test
    void testIncr_ExpiredValue_RestartsFromZero() {
        client.set("rate", "10", Duration.ofSeconds(1));
        clock.advance(Duration.ofSeconds(1));

        assertThat(cmdable.incr("rate").result()).isEqualTo(1L);
    }

    @Test
    void testHSet_WritesAllPairs() {
        IntCmd cmd = cmdable.hSet("user:1", "name", "alice", "age", "30");

        assertThat(cmd.result()).isEqualTo(2L);
        assertThat(cmdable.hGetAll("user:1").result()).containsExactly(entry("name", "alice"), entry("age", "30"));
    }

    @Test
    void testHSet_OddArguments_WritesNothing() {
        IntCmd cmd = cmdable.hSet("user:1", "name", "alice", "age");

        assertThat(cmd.err()).isInstanceOf(CacheValidationException.class);
        assertThat(cmdable.hGetAll("user:1").err()).isInstanceOf(CacheNotFoundException.class);
    }

    @Test
    void testDelAndExists_CountLiveKeys() {
        // Given
        cmdable.set("a", "1", Duration.ZERO);
        cmdable.set("b", "2", Duration.ZERO);

        // When & Then
        assertThat(cmdable.exists("a", "b", "a", "missing").result()).isEqualTo(3L);
        assertThat(cmdable.del("a", "missing", "b").result()).isEqualTo(2L);
        assertThat(cmdable.exists("a", "b").result()).isZero();
        assertThat(cmdable.del().result()).isZero();
    }

    @Test
    void testSetNXAndExpire_ThroughAdapter() {
        assertThat(cmdable.setNX("lock", "me", Duration.ofSeconds(5)).result()).isTrue();
        assertThat(cmdable.setNX("lock", "you", Duration.ofSeconds(5)).result()).isFalse();
        assertThat(cmdable.expire("lock", Duration.ofSeconds(60)).result()).isTrue();
        clock.advance(Duration.ofSeconds(30));
        assertThat(cmdable.get("lock").result()).isEqualTo("me");
    }

    @Test
    void testListCommands_AlwaysNotFound() {
        assertThat(cmdable.lPush("list", "a").err()).isInstanceOf(CacheNotFoundException.class);
        assertThat(cmdable.lRange("list", 0, -1).err()).isInstanceOf(CacheNotFoundException.class);
        assertThat(cmdable.lPop("list").err()).isInstanceOf(CacheNotFoundException.class);
    }
}
