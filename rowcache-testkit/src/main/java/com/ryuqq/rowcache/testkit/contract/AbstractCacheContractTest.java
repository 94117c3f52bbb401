package com.ryuqq.rowcache.testkit.contract;

import com.ryuqq.rowcache.core.spi.CacheClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Abstract base class for backend contract tests.
 *
 * <p>A backend module runs the contract by subclassing each {@code *ContractTest} of this
 * package and implementing {@link #createClient(Clock)}. Every test gets a fresh client
 * driven by a {@link MutableClock}, so expiry is observed by advancing the clock.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class InMemoryScalarEntryContractTest extends ScalarEntryContractTest {
 *     {@literal @}Override
 *     protected CacheClient createClient(Clock clock) {
 *         return new InMemoryCacheClient(clock);
 *     }
 * }
 * </pre>
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
public abstract class AbstractCacheContractTest {

    protected MutableClock clock;
    protected CacheClient client;

    /**
     * Creates the backend under test.
     *
     * <p>The backend must read "now" from the given clock. Its state must be empty.</p>
     *
     * @param clock the test clock
     * @return a fresh client
     */
    protected abstract CacheClient createClient(Clock clock);

    @BeforeEach
    protected void setUpClient() {
        clock = new MutableClock(Instant.now().truncatedTo(ChronoUnit.SECONDS));
        client = createClient(clock);
    }

    @AfterEach
    protected void tearDownClient() {
        if (client != null) {
            client.close();
        }
    }
}
