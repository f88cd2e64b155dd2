package org.muma.simple.redis.command.impl.string;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.simple.redis.command.impl.connection.EchoCommand;
import org.muma.simple.redis.common.RedisBytes;
import org.muma.simple.redis.protocol.*;
import org.muma.simple.redis.store.StorageEngine;
import org.muma.simple.redis.store.WrongTypeException;
import org.muma.simple.redis.store.impl.MemoryStorageEngine;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StringCommandTest {

    private StorageEngine storage;
    private GetCommand get;
    private SetCommand set;
    private EchoCommand echo;

    @BeforeEach
    void setUp() {
        storage = new MemoryStorageEngine();
        get = new GetCommand();
        set = new SetCommand();
        echo = new EchoCommand();
    }

    private RedisArray args(String... args) {
        RedisMessage[] msgs = new RedisMessage[args.length];
        for (int i = 0; i < args.length; i++) {
            msgs[i] = new BulkString(args[i]);
        }
        return new RedisArray(msgs);
    }

    @Test
    void testEchoReturnsArgumentUnchanged() {
        assertEquals(new BulkString("hello world"), echo.execute(storage, args("ECHO", "hello world")));
        assertEquals(new BulkString(""), echo.execute(storage, args("ECHO", "")));
        assertEquals(0, storage.size());
    }

    @Test
    void testSetAndGet() {
        assertEquals(SimpleString.OK, set.execute(storage, args("SET", "k", "v1")));
        assertEquals(new BulkString("v1"), get.execute(storage, args("GET", "k")));

        // 覆盖
        set.execute(storage, args("SET", "k", "v2"));
        assertEquals(new BulkString("v2"), get.execute(storage, args("GET", "k")));
    }

    @Test
    void testGetMissingKeyReturnsNil() {
        BulkString res = (BulkString) get.execute(storage, args("GET", "nope"));
        assertTrue(res.isNull());
    }

    @Test
    void testEmptyValueIsNotNil() {
        set.execute(storage, args("SET", "k", ""));
        BulkString res = (BulkString) get.execute(storage, args("GET", "k"));
        assertFalse(res.isNull());
        assertEquals(0, res.content().length);
    }

    @Test
    void testBinaryValue() {
        byte[] value = {0, 1, (byte) 0xfe, '\r', '\n'};
        set.execute(storage, new RedisArray(new RedisMessage[]{new BulkString("SET"), new BulkString("bin"), new BulkString(value)}));
        assertArrayEquals(value, ((BulkString) get.execute(storage, args("GET", "bin"))).content());
    }

    @Test
    void testGetOnSetKeyIsWrongType() {
        storage.sadd(RedisBytes.of("s"), List.of(RedisBytes.of("a")));
        assertThrows(WrongTypeException.class, () -> get.execute(storage, args("GET", "s")));
    }

    @Test
    void testSetOverwritesOtherTypes() {
        storage.hset(RedisBytes.of("h"), RedisBytes.of("f"), "v".getBytes());
        assertEquals(SimpleString.OK, set.execute(storage, args("SET", "h", "plain")));
        assertEquals(new BulkString("plain"), get.execute(storage, args("GET", "h")));
    }
}
