package org.muma.simple.redis.command.impl.hash;

import org.muma.simple.redis.command.RedisCommand;
import org.muma.simple.redis.protocol.BulkString;
import org.muma.simple.redis.protocol.RedisArray;
import org.muma.simple.redis.protocol.RedisMessage;
import org.muma.simple.redis.store.StorageEngine;

public class HGetCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        // key 或 field 不存在都返回 nil
        byte[] value = storage.hget(bytesArg(args, 1), bytesArg(args, 2));
        return value == null ? BulkString.NULL : new BulkString(value);
    }
}
