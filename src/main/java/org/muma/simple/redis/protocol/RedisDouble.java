package org.muma.simple.redis.protocol;

// RESP3 浮点 (,)，支持 inf / -inf / nan
public record RedisDouble(double value) implements RedisMessage {
}
