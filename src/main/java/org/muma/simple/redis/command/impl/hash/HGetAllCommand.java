package org.muma.simple.redis.command.impl.hash;

import org.muma.simple.redis.command.RedisCommand;
import org.muma.simple.redis.common.RedisBytes;
import org.muma.simple.redis.protocol.BulkString;
import org.muma.simple.redis.protocol.RedisArray;
import org.muma.simple.redis.protocol.RedisMessage;
import org.muma.simple.redis.store.StorageEngine;

import java.util.Map;

public class HGetAllCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        Map<RedisBytes, byte[]> all = storage.hgetall(bytesArg(args, 1));

        // 构造 RESP 数组: [key1, val1, key2, val2, ...]，key 不存在时是空数组
        RedisMessage[] result = new RedisMessage[all.size() * 2];
        int i = 0;
        for (Map.Entry<RedisBytes, byte[]> entry : all.entrySet()) {
            result[i++] = new BulkString(entry.getKey().getBytes());
            result[i++] = new BulkString(entry.getValue());
        }
        return new RedisArray(result);
    }
}
