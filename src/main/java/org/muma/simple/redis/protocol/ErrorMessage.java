package org.muma.simple.redis.protocol;

// 2. 错误 (-)，内容里经常带着客户端传来的文本，CR/LF 同样替换成空格
public record ErrorMessage(String content) implements RedisMessage {

    public ErrorMessage {
        content = RespCodec.singleLine(content);
    }
}
