package org.muma.simple.redis.protocol;

import io.netty.handler.codec.DecoderException;

/**
 * 字节流无法按 RESP 语法解析。
 * position 是出错字节相对于当前帧起点的偏移量。
 */
public class RespProtocolException extends DecoderException {

    private final int position;

    public RespProtocolException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
