package org.muma.simple.redis.command;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 支持的命令全集。
 * arity 沿用 Redis 的约定：包含命令名本身，正数表示参数个数必须相等，负数表示至少 |arity| 个。
 */
public enum CommandType {

    ECHO(2, false),

    GET(2, false),
    SET(3, true),

    HSET(4, true),
    HGET(3, false),
    HMGET(-3, false),
    HGETALL(2, false),

    SADD(-3, true),
    SISMEMBER(3, false),
    SMEMBERS(2, false);

    private static final Map<String, CommandType> BY_NAME = new HashMap<>();

    static {
        for (CommandType type : values()) {
            BY_NAME.put(type.name(), type);
        }
    }

    private final int arity;
    private final boolean write;

    CommandType(int arity, boolean write) {
        this.arity = arity;
        this.write = write;
    }

    /**
     * 大小写不敏感，未知命令返回 null
     */
    public static CommandType lookup(String name) {
        if (name == null) return null;
        return BY_NAME.get(name.toUpperCase(Locale.ROOT));
    }

    public boolean acceptsArgc(int argc) {
        return arity >= 0 ? argc == arity : argc >= -arity;
    }

    public boolean isWrite() {
        return write;
    }

    // 错误信息里使用的小写命令名
    public String displayName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
