package com.ryuqq.rowcache.command;

import com.ryuqq.rowcache.command.result.BoolCmd;
import com.ryuqq.rowcache.command.result.IntCmd;
import com.ryuqq.rowcache.command.result.MapStringStringCmd;
import com.ryuqq.rowcache.command.result.StatusCmd;
import com.ryuqq.rowcache.command.result.StringCmd;
import com.ryuqq.rowcache.command.result.StringSliceCmd;

import java.time.Duration;
import java.util.Map;

/**
 * Command-style cache interface.
 *
 * <p>Every command returns a result wrapper instead of throwing; see
 * {@link com.ryuqq.rowcache.command.result.Cmd}.</p>
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
public interface Cmdable {

    /**
     * @return a pipeline accumulating commands for {@link Pipeliner#exec()}
     */
    Pipeliner pipeline();

    StatusCmd set(String key, String value, Duration expiration);

    StringCmd get(String key);

    BoolCmd setNX(String key, String value, Duration expiration);

    IntCmd incr(String key);

    IntCmd incrBy(String key, long delta);

    /**
     * Writes field/value pairs of a map.
     *
     * @param key the map key
     * @param fieldsAndValues {@code field1, value1, field2, value2, ...}
     * @return number of fields written
     */
    IntCmd hSet(String key, String... fieldsAndValues);

    IntCmd hSet(String key, Map<String, String> fields);

    MapStringStringCmd hGetAll(String key);

    /**
     * @param keys keys to delete
     * @return number of live entries removed
     */
    IntCmd del(String... keys);

    /**
     * @param keys keys to check; a key given twice counts twice
     * @return number of live keys
     */
    IntCmd exists(String... keys);

    BoolCmd expire(String key, Duration expiration);

    StringCmd lIndex(String key, long index);

    IntCmd lPush(String key, String... values);

    IntCmd rPush(String key, String... values);

    StatusCmd lSet(String key, long index, String value);

    StringCmd lPop(String key);

    StringSliceCmd lRange(String key, long start, long stop);
}
