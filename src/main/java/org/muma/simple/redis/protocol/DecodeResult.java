package org.muma.simple.redis.protocol;

/**
 * 一次解码尝试的结果：要么得到一个完整的消息，要么数据还不够。
 * 协议错误不在这里表示，而是抛出 {@link RespProtocolException}。
 */
public sealed interface DecodeResult permits DecodeResult.Complete, DecodeResult.Incomplete {

    DecodeResult INCOMPLETE = new Incomplete();

    /**
     * @param message  解出的消息
     * @param consumed 该消息在缓冲区中占用的字节数
     */
    record Complete(RedisMessage message, int consumed) implements DecodeResult {
    }

    // 缓冲区中还没有完整的一帧，读指针不动
    record Incomplete() implements DecodeResult {
    }

    default boolean isComplete() {
        return this instanceof Complete;
    }
}
