package org.muma.simple.redis.protocol;

// 密封接口，限制实现类
public sealed interface RedisMessage permits
        SimpleString, ErrorMessage, RedisInteger, BulkString, RedisArray, RedisBoolean, RedisDouble {
}
