package org.muma.simple.redis.command.impl.connection;

import org.muma.simple.redis.command.RedisCommand;
import org.muma.simple.redis.protocol.BulkString;
import org.muma.simple.redis.protocol.RedisArray;
import org.muma.simple.redis.protocol.RedisMessage;
import org.muma.simple.redis.store.StorageEngine;

/**
 * ECHO message
 * 不访问存储，原样返回参数
 */
public class EchoCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        return new BulkString(arg(args, 1));
    }
}
