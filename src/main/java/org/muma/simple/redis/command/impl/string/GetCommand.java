package org.muma.simple.redis.command.impl.string;

import org.muma.simple.redis.command.RedisCommand;
import org.muma.simple.redis.protocol.BulkString;
import org.muma.simple.redis.protocol.RedisArray;
import org.muma.simple.redis.protocol.RedisMessage;
import org.muma.simple.redis.store.StorageEngine;

public class GetCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        byte[] value = storage.get(bytesArg(args, 1));
        return value == null ? BulkString.NULL : new BulkString(value);
    }
}
