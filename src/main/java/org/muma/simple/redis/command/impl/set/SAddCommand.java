package org.muma.simple.redis.command.impl.set;

import org.muma.simple.redis.command.RedisCommand;
import org.muma.simple.redis.protocol.RedisArray;
import org.muma.simple.redis.protocol.RedisInteger;
import org.muma.simple.redis.protocol.RedisMessage;
import org.muma.simple.redis.store.StorageEngine;

/**
 * SADD key member [member ...]
 * 返回真正新加入的成员数
 */
public class SAddCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        int addedCount = storage.sadd(bytesArg(args, 1), bytesArgs(args, 2));
        return new RedisInteger(addedCount);
    }
}
