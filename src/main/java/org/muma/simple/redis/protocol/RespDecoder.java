package org.muma.simple.redis.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;

import java.util.List;

/**
 * RESP 协议解码器
 * 累积缓冲由 ByteToMessageDecoder 负责，帧的解析交给 {@link RespCodec}，
 * 半包时直接返回等待下一次 channelRead。
 */
public class RespDecoder extends ByteToMessageDecoder {

    private final RespCodec codec;

    public RespDecoder() {
        this(new RespCodec());
    }

    public RespDecoder(RespCodec codec) {
        this.codec = codec;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        // 一次 read 里可能带了多条命令 (pipeline)，逐条解出
        while (in.isReadable()) {
            DecodeResult result;
            try {
                result = codec.decode(in);
            } catch (RespProtocolException e) {
                // 字节流已经错位，丢弃剩余数据，由上层决定是否关闭连接
                in.skipBytes(in.readableBytes());
                throw e;
            }
            if (!(result instanceof DecodeResult.Complete complete)) {
                return;
            }
            out.add(complete.message());
        }
    }
}
