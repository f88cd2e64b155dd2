package org.muma.simple.redis.command.impl.hash;

import org.muma.simple.redis.command.RedisCommand;
import org.muma.simple.redis.protocol.BulkString;
import org.muma.simple.redis.protocol.RedisArray;
import org.muma.simple.redis.protocol.RedisMessage;
import org.muma.simple.redis.store.StorageEngine;

import java.util.List;

public class HMGetCommand implements RedisCommand {
    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        // HMGET key field [field ...]
        List<byte[]> values = storage.hmget(bytesArg(args, 1), bytesArgs(args, 2));

        // 字段不存在返回 nil，key 不存在时每个字段都是 nil
        RedisMessage[] results = new RedisMessage[values.size()];
        for (int i = 0; i < results.length; i++) {
            byte[] value = values.get(i);
            results[i] = value == null ? BulkString.NULL : new BulkString(value);
        }
        return new RedisArray(results);
    }
}
