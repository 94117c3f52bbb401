/**
 * Backend-agnostic contract tests.
 *
 * <p>Each abstract {@code *ContractTest} is run by a backend module through a concrete
 * subclass providing {@link com.ryuqq.rowcache.testkit.contract.AbstractCacheContractTest#createClient(java.time.Clock)}.</p>
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
package com.ryuqq.rowcache.testkit.contract;
