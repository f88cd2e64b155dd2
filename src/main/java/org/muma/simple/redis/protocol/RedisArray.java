package org.muma.simple.redis.protocol;

import java.util.Arrays;

/**
 * 数组 (*)。
 * elements 为 null 表示 Null Array (*-1)，长度为 0 表示空数组 (*0)，两者不相等。
 */
public record RedisArray(RedisMessage[] elements) implements RedisMessage {

    public static final RedisArray NULL = new RedisArray(null);

    public static RedisArray empty() {
        return new RedisArray(new RedisMessage[0]);
    }

    public boolean isNull() {
        return elements == null;
    }

    public int size() {
        return elements == null ? 0 : elements.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RedisArray other)) return false;
        return Arrays.equals(elements, other.elements);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(elements);
    }

    @Override
    public String toString() {
        return elements == null ? "RedisArray[nil]" : "RedisArray" + Arrays.toString(elements);
    }
}
