package org.muma.simple.redis.common;

public enum RedisDataType {
    STRING("string"),
    HASH("hash"),
    SET("set");

    private final String code;

    RedisDataType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
