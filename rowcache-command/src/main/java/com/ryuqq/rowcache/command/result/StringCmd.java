package com.ryuqq.rowcache.command.result;

import com.ryuqq.rowcache.core.error.CacheException;
import com.ryuqq.rowcache.core.error.CacheValidationException;

import java.nio.charset.StandardCharsets;

/**
 * String reply, with numeric and raw views of the value.
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
public final class StringCmd extends AbstractCmd<String> {

    private StringCmd(String name, String val, CacheException err) {
        super(name, val, err);
    }

    public static StringCmd ok(String name, String val) {
        return new StringCmd(name, val, null);
    }

    public static StringCmd failed(String name, CacheException err) {
        if (err == null) {
            throw new IllegalArgumentException("err cannot be null");
        }
        return new StringCmd(name, "", err);
    }

    /**
     * Parses the value as a signed 64-bit decimal.
     *
     * @return the parsed value
     * @throws CacheException the captured failure
     * @throws CacheValidationException if the value is not an integer
     */
    public long int64() {
        String value = result();
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new CacheValidationException("value is not an integer: " + value, e);
        }
    }

    /**
     * @return the value as UTF-8 bytes
     * @throws CacheException the captured failure
     */
    public byte[] bytes() {
        return result().getBytes(StandardCharsets.UTF_8);
    }
}
