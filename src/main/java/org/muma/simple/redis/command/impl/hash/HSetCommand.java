package org.muma.simple.redis.command.impl.hash;

import org.muma.simple.redis.command.RedisCommand;
import org.muma.simple.redis.protocol.RedisArray;
import org.muma.simple.redis.protocol.RedisMessage;
import org.muma.simple.redis.protocol.SimpleString;
import org.muma.simple.redis.store.StorageEngine;

/**
 * HSET key field value
 * 只接受单个 field，成功返回 +OK
 */
public class HSetCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        storage.hset(bytesArg(args, 1), bytesArg(args, 2), arg(args, 3));
        return SimpleString.OK;
    }
}
