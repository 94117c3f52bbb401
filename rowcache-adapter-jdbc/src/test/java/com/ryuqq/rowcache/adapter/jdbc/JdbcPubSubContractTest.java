package com.ryuqq.rowcache.adapter.jdbc;

import com.ryuqq.rowcache.core.spi.CacheClient;
import com.ryuqq.rowcache.testkit.contract.PubSubContractTest;

import java.time.Clock;

class JdbcPubSubContractTest extends PubSubContractTest {

    @Override
    protected CacheClient createClient(Clock clock) {
        return H2Stores.newClient(clock);
    }
}
