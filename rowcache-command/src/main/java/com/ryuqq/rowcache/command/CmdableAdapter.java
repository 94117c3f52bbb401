package com.ryuqq.rowcache.command;

import com.ryuqq.rowcache.command.counter.TransactionalCounter;
import com.ryuqq.rowcache.command.result.BoolCmd;
import com.ryuqq.rowcache.command.result.IntCmd;
import com.ryuqq.rowcache.command.result.MapStringStringCmd;
import com.ryuqq.rowcache.command.result.StatusCmd;
import com.ryuqq.rowcache.command.result.StringCmd;
import com.ryuqq.rowcache.command.result.StringSliceCmd;
import com.ryuqq.rowcache.core.error.CacheException;
import com.ryuqq.rowcache.core.error.CacheNotFoundException;
import com.ryuqq.rowcache.core.error.CacheValidationException;
import com.ryuqq.rowcache.core.spi.CacheClient;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link CacheClient}를 {@link Cmdable}로 변환하는 어댑터.
 *
 * <p>캐시 실패({@link CacheException})는 던지지 않고 결과 객체에 담아 반환합니다.
 * null 인자 같은 호출 오류는 {@link IllegalArgumentException}으로 그대로 전파됩니다.</p>
 *
 * <p><strong>명령별 규칙:</strong></p>
 * <ul>
 *   <li>incr/incrBy: {@link TransactionalCounter}에 위임</li>
 *   <li>hSet: 짝이 맞지 않거나 2개 미만이면 CacheValidationException, 모든 쌍을 한 트랜잭션으로 기록</li>
 *   <li>del: 모든 키를 한 트랜잭션으로 삭제 (부분 삭제 없음)</li>
 *   <li>exists: 키마다 count(key)를 호출해 합산 (중복 키는 중복 집계)</li>
 *   <li>list 명령, pipeline: 항상 CacheNotFoundException</li>
 * </ul>
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
public final class CmdableAdapter implements Cmdable {

    private final CacheClient client;
    private final TransactionalCounter counter;

    public CmdableAdapter(CacheClient client) {
        this(client, new TransactionalCounter(client));
    }

    /**
     * 생성자.
     *
     * @param client 캐시 클라이언트
     * @param counter incr/incrBy에 사용할 카운터
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public CmdableAdapter(CacheClient client, TransactionalCounter counter) {
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        if (counter == null) {
            throw new IllegalArgumentException("counter cannot be null");
        }
        this.client = client;
        this.counter = counter;
    }

    @Override
    public Pipeliner pipeline() {
        return UnsupportedPipeliner.INSTANCE;
    }

    @Override
    public StatusCmd set(String key, String value, Duration expiration) {
        try {
            client.set(key, value, expiration);
            return StatusCmd.ok("set");
        } catch (CacheException e) {
            return StatusCmd.failed("set", e);
        }
    }

    @Override
    public StringCmd get(String key) {
        try {
            return StringCmd.ok("get", client.getString(key));
        } catch (CacheException e) {
            return StringCmd.failed("get", e);
        }
    }

    @Override
    public BoolCmd setNX(String key, String value, Duration expiration) {
        try {
            return BoolCmd.ok("setnx", client.setNX(key, value, expiration));
        } catch (CacheException e) {
            return BoolCmd.failed("setnx", e);
        }
    }

    @Override
    public IntCmd incr(String key) {
        return incrBy(key, 1);
    }

    @Override
    public IntCmd incrBy(String key, long delta) {
        try {
            return IntCmd.ok("incrby", counter.incrBy(key, delta));
        } catch (CacheException e) {
            return IntCmd.failed("incrby", e);
        }
    }

    @Override
    public IntCmd hSet(String key, String... fieldsAndValues) {
        if (fieldsAndValues == null || fieldsAndValues.length < 2 || fieldsAndValues.length % 2 != 0) {
            int length = fieldsAndValues == null ? 0 : fieldsAndValues.length;
            return IntCmd.failed("hset", new CacheValidationException(
                "hset requires field/value pairs, but got " + length + " arguments"));
        }
        Map<String, String> fields = new LinkedHashMap<>();
        for (int i = 0; i < fieldsAndValues.length; i += 2) {
            fields.put(fieldsAndValues[i], fieldsAndValues[i + 1]);
        }
        return hSet(key, fields);
    }

    @Override
    public IntCmd hSet(String key, Map<String, String> fields) {
        if (fields == null || fields.isEmpty()) {
            return IntCmd.failed("hset", new CacheValidationException("hset requires at least one field"));
        }
        try {
            client.transaction(context -> {
                CacheClient tx = context.client();
                fields.forEach((field, value) -> tx.setMapField(key, field, value));
                return null;
            });
            return IntCmd.ok("hset", (long) fields.size());
        } catch (CacheException e) {
            return IntCmd.failed("hset", e);
        }
    }

    @Override
    public MapStringStringCmd hGetAll(String key) {
        try {
            return MapStringStringCmd.ok("hgetall", client.getMap(key));
        } catch (CacheException e) {
            return MapStringStringCmd.failed("hgetall", e);
        }
    }

    @Override
    public IntCmd del(String... keys) {
        if (keys == null || keys.length == 0) {
            return IntCmd.ok("del", 0L);
        }
        try {
            long deleted = client.transaction(context -> {
                CacheClient tx = context.client();
                long total = 0;
                for (String key : keys) {
                    total += tx.delete(key);
                }
                return total;
            });
            return IntCmd.ok("del", deleted);
        } catch (CacheException e) {
            return IntCmd.failed("del", e);
        }
    }

    @Override
    public IntCmd exists(String... keys) {
        if (keys == null || keys.length == 0) {
            return IntCmd.ok("exists", 0L);
        }
        try {
            long total = 0;
            for (String key : keys) {
                total += client.count(key);
            }
            return IntCmd.ok("exists", total);
        } catch (CacheException e) {
            return IntCmd.failed("exists", e);
        }
    }

    @Override
    public BoolCmd expire(String key, Duration expiration) {
        try {
            return BoolCmd.ok("expire", client.expire(key, expiration));
        } catch (CacheException e) {
            return BoolCmd.failed("expire", e);
        }
    }

    // list commands have no backing table

    @Override
    public StringCmd lIndex(String key, long index) {
        return StringCmd.failed("lindex", CacheNotFoundException.unsupported("lindex"));
    }

    @Override
    public IntCmd lPush(String key, String... values) {
        return IntCmd.failed("lpush", CacheNotFoundException.unsupported("lpush"));
    }

    @Override
    public IntCmd rPush(String key, String... values) {
        return IntCmd.failed("rpush", CacheNotFoundException.unsupported("rpush"));
    }

    @Override
    public StatusCmd lSet(String key, long index, String value) {
        return StatusCmd.failed("lset", CacheNotFoundException.unsupported("lset"));
    }

    @Override
    public StringCmd lPop(String key) {
        return StringCmd.failed("lpop", CacheNotFoundException.unsupported("lpop"));
    }

    @Override
    public StringSliceCmd lRange(String key, long start, long stop) {
        return StringSliceCmd.failed("lrange", CacheNotFoundException.unsupported("lrange"));
    }
}
