package org.muma.simple.redis.store;

import org.muma.simple.redis.common.RedisDataType;

/**
 * Signals an operation against a key holding the wrong kind of value.
 */
public class WrongTypeException extends RuntimeException {

    public static final String MESSAGE = "WRONGTYPE Operation against a key holding the wrong kind of value";

    private final RedisDataType expected;
    private final RedisDataType actual;

    public WrongTypeException(RedisDataType expected, RedisDataType actual) {
        super(MESSAGE);
        this.expected = expected;
        this.actual = actual;
    }

    public RedisDataType getExpected() {
        return expected;
    }

    public RedisDataType getActual() {
        return actual;
    }
}
