package org.muma.simple.redis.server;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.simple.redis.command.CommandDispatcher;
import org.muma.simple.redis.protocol.DecodeResult;
import org.muma.simple.redis.protocol.RespCodec;
import org.muma.simple.redis.protocol.RespDecoder;
import org.muma.simple.redis.protocol.RespEncoder;
import org.muma.simple.redis.store.impl.MemoryStorageEngine;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 完整 pipeline (Decoder -> Encoder -> Handler) 的字节级测试
 */
class RedisCommandHandlerTest {

    private RedisCommandHandler handler;
    private EmbeddedChannel channel;

    @BeforeEach
    void setUp() {
        handler = new RedisCommandHandler(new CommandDispatcher(new MemoryStorageEngine()));
        channel = new EmbeddedChannel(new RespDecoder(), new RespEncoder(), handler);
    }

    @AfterEach
    void tearDown() {
        channel.finishAndReleaseAll();
    }

    private void send(String wire) {
        channel.writeInbound(Unpooled.copiedBuffer(wire, StandardCharsets.UTF_8));
    }

    // 把当前所有待发出的字节拼起来
    private String drain() {
        StringBuilder sb = new StringBuilder();
        ByteBuf out;
        while ((out = channel.readOutbound()) != null) {
            sb.append(out.toString(StandardCharsets.UTF_8));
            out.release();
        }
        return sb.toString();
    }

    @Test
    void testEcho() {
        send("*2\r\n$4\r\nECHO\r\n$5\r\nhello\r\n");
        assertEquals("$5\r\nhello\r\n", drain());
    }

    @Test
    void testPipelinedRepliesKeepRequestOrder() {
        send("*3\r\n$3\r\nSET\r\n$1\r\nk\r\n$1\r\nv\r\n"
                + "*2\r\n$3\r\nGET\r\n$1\r\nk\r\n"
                + "*2\r\n$3\r\nGET\r\n$4\r\nnope\r\n"
                + "*3\r\n$4\r\nSADD\r\n$1\r\nk\r\n$1\r\nm\r\n");

        assertEquals("+OK\r\n"
                + "$1\r\nv\r\n"
                + "$-1\r\n"
                + "-WRONGTYPE Operation against a key holding the wrong kind of value\r\n", drain());
        assertTrue(channel.isOpen());
    }

    @Test
    void testHashRoundTripOverWire() {
        send("*4\r\n$4\r\nHSET\r\n$1\r\nh\r\n$2\r\nk1\r\n$2\r\nv1\r\n");
        send("*4\r\n$5\r\nHMGET\r\n$1\r\nh\r\n$2\r\nk1\r\n$2\r\nk2\r\n");
        assertEquals("+OK\r\n*2\r\n$2\r\nv1\r\n$-1\r\n", drain());
    }

    @Test
    void testSAddTwiceOverWire() {
        String sadd = "*5\r\n$4\r\nSADD\r\n$1\r\nk\r\n$1\r\n1\r\n$1\r\n2\r\n$1\r\n3\r\n";
        send(sadd);
        send(sadd);
        assertEquals(":3\r\n:0\r\n", drain());
    }

    @Test
    void testBadCommandKeepsConnectionOpen() {
        send("*1\r\n$7\r\nUNKNOWN\r\n");
        send("*0\r\n");
        send("*1\r\n$3\r\nGET\r\n");
        assertEquals("-ERR unknown command 'UNKNOWN'\r\n"
                + "-ERR invalid request\r\n"
                + "-ERR wrong number of arguments for 'get' command\r\n", drain());
        assertTrue(channel.isOpen());
    }

    @Test
    void testCommandNameWithCrlfYieldsSingleReply() {
        send("*1\r\n$5\r\nX\r\n:1\r\n");
        String reply = drain();
        assertEquals("-ERR unknown command 'X  :1'\r\n", reply);

        // 客户端按 RESP 解析回复，只能得到一帧且不剩字节
        byte[] bytes = reply.getBytes(StandardCharsets.UTF_8);
        DecodeResult.Complete complete = assertInstanceOf(DecodeResult.Complete.class, new RespCodec().decode(bytes));
        assertEquals(bytes.length, complete.consumed());
        assertTrue(channel.isOpen());
    }

    @Test
    void testProtocolErrorReplyStaysOnOneLine() {
        // 行内的裸 \n 会出现在错误信息里
        send(":1\n2\r\n");
        String reply = drain();
        assertTrue(reply.startsWith("-ERR Protocol error: Invalid integer '1 2'"), reply);
        assertEquals(reply.length() - 2, reply.indexOf("\r\n"));
        assertEquals(reply.length() - 1, reply.indexOf('\n'));
        assertFalse(channel.isOpen());
    }

    @Test
    void testProtocolErrorRepliesAndCloses() {
        send("!garbage\r\n");
        String reply = drain();
        assertTrue(reply.startsWith("-ERR Protocol error: Unknown RESP type byte '!'"), reply);
        assertFalse(channel.isOpen());
    }

    @Test
    void testConnectionCounting() {
        assertEquals(1, handler.getConnectedClients());
        channel.close();
        assertEquals(0, handler.getConnectedClients());
    }
}
