package org.muma.simple.redis.command.impl.set;

import org.muma.simple.redis.command.RedisCommand;
import org.muma.simple.redis.protocol.BulkString;
import org.muma.simple.redis.protocol.RedisArray;
import org.muma.simple.redis.protocol.RedisMessage;
import org.muma.simple.redis.store.StorageEngine;

import java.util.List;

/**
 * SMEMBERS key
 * Time Complexity: O(N)
 */
public class SMembersCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        List<byte[]> members = storage.smembers(bytesArg(args, 1));
        RedisMessage[] result = new RedisMessage[members.size()];
        for (int i = 0; i < members.size(); i++) {
            result[i] = new BulkString(members.get(i));
        }
        return new RedisArray(result);
    }
}
