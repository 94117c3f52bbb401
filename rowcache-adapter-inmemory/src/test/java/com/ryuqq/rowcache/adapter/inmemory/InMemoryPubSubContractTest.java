package com.ryuqq.rowcache.adapter.inmemory;

import com.ryuqq.rowcache.core.pubsub.SubscriptionConfig;
import com.ryuqq.rowcache.core.spi.CacheClient;
import com.ryuqq.rowcache.testkit.contract.PubSubContractTest;

import java.time.Clock;

class InMemoryPubSubContractTest extends PubSubContractTest {

    @Override
    protected CacheClient createClient(Clock clock) {
        return new InMemoryCacheClient(clock, new SubscriptionConfig().withPollIntervalMs(20));
    }
}
