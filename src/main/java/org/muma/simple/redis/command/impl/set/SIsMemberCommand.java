package org.muma.simple.redis.command.impl.set;

import org.muma.simple.redis.command.RedisCommand;
import org.muma.simple.redis.protocol.RedisArray;
import org.muma.simple.redis.protocol.RedisInteger;
import org.muma.simple.redis.protocol.RedisMessage;
import org.muma.simple.redis.store.StorageEngine;

/**
 * SISMEMBER key member
 * Time Complexity: O(1)
 */
public class SIsMemberCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        boolean member = storage.sismember(bytesArg(args, 1), bytesArg(args, 2));
        return new RedisInteger(member ? 1 : 0);
    }
}
