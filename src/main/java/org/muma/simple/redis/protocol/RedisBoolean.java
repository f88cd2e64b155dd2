package org.muma.simple.redis.protocol;

// RESP3 布尔 (#t / #f)
public record RedisBoolean(boolean value) implements RedisMessage {
}
