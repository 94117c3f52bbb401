package com.ryuqq.rowcache.command;

import com.ryuqq.rowcache.command.result.BoolCmd;
import com.ryuqq.rowcache.command.result.Cmd;
import com.ryuqq.rowcache.command.result.IntCmd;
import com.ryuqq.rowcache.command.result.MapStringStringCmd;
import com.ryuqq.rowcache.command.result.StatusCmd;
import com.ryuqq.rowcache.command.result.StringCmd;
import com.ryuqq.rowcache.command.result.StringSliceCmd;
import com.ryuqq.rowcache.core.error.CacheNotFoundException;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Pipeline of a backend without batching.
 *
 * <p>Every command fails with {@link CacheNotFoundException}, and so does {@link #exec()}.</p>
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
public final class UnsupportedPipeliner implements Pipeliner {

    static final UnsupportedPipeliner INSTANCE = new UnsupportedPipeliner();

    private UnsupportedPipeliner() {
    }

    private static CacheNotFoundException unsupported(String command) {
        return CacheNotFoundException.unsupported("pipeline " + command);
    }

    @Override
    public List<Cmd<?>> exec() {
        throw unsupported("exec");
    }

    @Override
    public Pipeliner pipeline() {
        return this;
    }

    @Override
    public StatusCmd set(String key, String value, Duration expiration) {
        return StatusCmd.failed("set", unsupported("set"));
    }

    @Override
    public StringCmd get(String key) {
        return StringCmd.failed("get", unsupported("get"));
    }

    @Override
    public BoolCmd setNX(String key, String value, Duration expiration) {
        return BoolCmd.failed("setnx", unsupported("setnx"));
    }

    @Override
    public IntCmd incr(String key) {
        return IntCmd.failed("incr", unsupported("incr"));
    }

    @Override
    public IntCmd incrBy(String key, long delta) {
        return IntCmd.failed("incrby", unsupported("incrby"));
    }

    @Override
    public IntCmd hSet(String key, String... fieldsAndValues) {
        return IntCmd.failed("hset", unsupported("hset"));
    }

    @Override
    public IntCmd hSet(String key, Map<String, String> fields) {
        return IntCmd.failed("hset", unsupported("hset"));
    }

    @Override
    public MapStringStringCmd hGetAll(String key) {
        return MapStringStringCmd.failed("hgetall", unsupported("hgetall"));
    }

    @Override
    public IntCmd del(String... keys) {
        return IntCmd.failed("del", unsupported("del"));
    }

    @Override
    public IntCmd exists(String... keys) {
        return IntCmd.failed("exists", unsupported("exists"));
    }

    @Override
    public BoolCmd expire(String key, Duration expiration) {
        return BoolCmd.failed("expire", unsupported("expire"));
    }

    @Override
    public StringCmd lIndex(String key, long index) {
        return StringCmd.failed("lindex", unsupported("lindex"));
    }

    @Override
    public IntCmd lPush(String key, String... values) {
        return IntCmd.failed("lpush", unsupported("lpush"));
    }

    @Override
    public IntCmd rPush(String key, String... values) {
        return IntCmd.failed("rpush", unsupported("rpush"));
    }

    @Override
    public StatusCmd lSet(String key, long index, String value) {
        return StatusCmd.failed("lset", unsupported("lset"));
    }

    @Override
    public StringCmd lPop(String key) {
        return StringCmd.failed("lpop", unsupported("lpop"));
    }

    @Override
    public StringSliceCmd lRange(String key, long start, long stop) {
        return StringSliceCmd.failed("lrange", unsupported("lrange"));
    }
}
