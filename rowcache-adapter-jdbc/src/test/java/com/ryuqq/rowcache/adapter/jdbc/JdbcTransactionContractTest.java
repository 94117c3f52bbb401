package com.ryuqq.rowcache.adapter.jdbc;

import com.ryuqq.rowcache.core.spi.CacheClient;
import com.ryuqq.rowcache.testkit.contract.TransactionContractTest;

import java.time.Clock;

class JdbcTransactionContractTest extends TransactionContractTest {

    @Override
    protected CacheClient createClient(Clock clock) {
        return H2Stores.newClient(clock);
    }
}
