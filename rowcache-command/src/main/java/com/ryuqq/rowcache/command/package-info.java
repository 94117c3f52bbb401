/**
 * Command-style adapter over the cache capability contract.
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
package com.ryuqq.rowcache.command;
