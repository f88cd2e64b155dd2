package org.muma.simple.redis.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class RespDecoderTest {

    private EmbeddedChannel channel;

    @BeforeEach
    void setUp() {
        channel = new EmbeddedChannel(new RespDecoder(), new RespEncoder());
    }

    @AfterEach
    void tearDown() {
        channel.finishAndReleaseAll();
    }

    private static ByteBuf buf(String s) {
        return Unpooled.copiedBuffer(s, StandardCharsets.UTF_8);
    }

    @Test
    void testFrameSplitAcrossReads() {
        // 半包：第一次读不产生任何消息
        assertFalse(channel.writeInbound(buf("*2\r\n$4\r\nECHO\r\n$5\r\nhel")));
        assertNull(channel.readInbound());

        assertTrue(channel.writeInbound(buf("lo\r\n")));
        RedisArray msg = channel.readInbound();
        assertEquals(new RedisArray(new RedisMessage[]{new BulkString("ECHO"), new BulkString("hello")}), msg);
        assertNull(channel.readInbound());
    }

    @Test
    void testPipelinedRequestsInOneRead() {
        channel.writeInbound(buf("*1\r\n$3\r\nGET\r\n*1\r\n$3\r\nSET\r\n*1\r\n$4"));

        RedisArray first = channel.readInbound();
        RedisArray second = channel.readInbound();
        assertEquals("GET", ((BulkString) first.elements()[0]).asString());
        assertEquals("SET", ((BulkString) second.elements()[0]).asString());
        assertNull(channel.readInbound());

        // 剩下的半帧在下一次读时补齐
        channel.writeInbound(buf("\r\nECHO\r\n"));
        RedisArray third = channel.readInbound();
        assertEquals("ECHO", ((BulkString) third.elements()[0]).asString());
    }

    @Test
    void testMalformedInputRaisesProtocolException() {
        assertThrows(RespProtocolException.class, () -> channel.writeInbound(buf("!oops\r\n")));
    }

    @Test
    void testEncoderWritesWireBytes() {
        channel.writeOutbound(new RedisArray(new RedisMessage[]{new BulkString("v1"), BulkString.NULL}));
        ByteBuf out = channel.readOutbound();
        assertEquals("*2\r\n$2\r\nv1\r\n$-1\r\n", out.toString(StandardCharsets.UTF_8));
        out.release();
    }
}
