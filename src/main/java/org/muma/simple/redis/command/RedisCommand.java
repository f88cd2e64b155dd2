package org.muma.simple.redis.command;

import org.muma.simple.redis.common.RedisBytes;
import org.muma.simple.redis.protocol.BulkString;
import org.muma.simple.redis.protocol.RedisArray;
import org.muma.simple.redis.protocol.RedisMessage;
import org.muma.simple.redis.store.StorageEngine;

import java.util.ArrayList;
import java.util.List;

/**
 * 单条命令的执行逻辑。
 * 进入 execute 之前，{@link CommandDispatcher} 已经保证 args 是由非空 BulkString 组成的数组，
 * 第 0 个元素是命令名，且参数个数符合 {@link CommandType} 的声明。
 */
public interface RedisCommand {

    // 执行命令，传入存储引擎和完整参数 (含命令名)
    RedisMessage execute(StorageEngine storage, RedisArray args);

    default byte[] arg(RedisArray args, int index) {
        return ((BulkString) args.elements()[index]).content();
    }

    default RedisBytes bytesArg(RedisArray args, int index) {
        return new RedisBytes(arg(args, index));
    }

    /**
     * 从 from 开始的所有参数，用于 HMGET / SADD 这类变长命令
     */
    default List<RedisBytes> bytesArgs(RedisArray args, int from) {
        RedisMessage[] elements = args.elements();
        List<RedisBytes> result = new ArrayList<>(elements.length - from);
        for (int i = from; i < elements.length; i++) {
            result.add(bytesArg(args, i));
        }
        return result;
    }
}
