package org.muma.simple.redis.protocol;

// 1. 简单字符串 (+)，单行，CR/LF 被替换成空格
public record SimpleString(String content) implements RedisMessage {

    public static final SimpleString OK = new SimpleString("OK");

    public SimpleString {
        content = RespCodec.singleLine(content);
    }
}
