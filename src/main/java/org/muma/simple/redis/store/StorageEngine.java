package org.muma.simple.redis.store;

import org.muma.simple.redis.common.RedisBytes;

import java.util.List;
import java.util.Map;

/**
 * 存储引擎：持有唯一的 Database，对外只暴露按类型区分的操作。
 * <p>
 * 每个操作在 key 已存在且类型不符时抛出 {@link WrongTypeException}，且不修改任何数据。
 * 每个操作都是原子的，实现需要保证并发连接下的读-改-写不会交错。
 * 返回的集合都是快照。
 */
public interface StorageEngine {

    // --- String ---

    /**
     * @return key 不存在时返回 null
     */
    byte[] get(RedisBytes key);

    // 无条件覆盖，不论原来是什么类型
    void set(RedisBytes key, byte[] value);

    // --- Hash ---

    void hset(RedisBytes key, RedisBytes field, byte[] value);

    /**
     * @return key 或 field 不存在时返回 null
     */
    byte[] hget(RedisBytes key, RedisBytes field);

    /**
     * @return 与 fields 一一对应，缺失的字段对应 null
     */
    List<byte[]> hmget(RedisBytes key, List<RedisBytes> fields);

    /**
     * @return key 不存在时返回空 Map
     */
    Map<RedisBytes, byte[]> hgetall(RedisBytes key);

    // --- Set ---

    /**
     * @return 实际新增的成员个数，重复成员不计
     */
    int sadd(RedisBytes key, List<RedisBytes> members);

    boolean sismember(RedisBytes key, RedisBytes member);

    /**
     * @return key 不存在时返回空 List
     */
    List<byte[]> smembers(RedisBytes key);

    // key 总数
    int size();
}
