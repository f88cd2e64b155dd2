package org.muma.simple.redis.command.impl.string;

import org.muma.simple.redis.command.RedisCommand;
import org.muma.simple.redis.protocol.RedisArray;
import org.muma.simple.redis.protocol.RedisMessage;
import org.muma.simple.redis.protocol.SimpleString;
import org.muma.simple.redis.store.StorageEngine;

/**
 * SET key value
 * 与 Redis 一致，SET 直接覆盖 key，不关心原来的类型
 */
public class SetCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        storage.set(bytesArg(args, 1), arg(args, 2));
        return SimpleString.OK;
    }
}
