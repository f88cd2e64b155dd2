package org.muma.simple.redis.store.impl;

import org.muma.simple.redis.common.RedisBytes;
import org.muma.simple.redis.common.RedisData;
import org.muma.simple.redis.common.RedisDataType;
import org.muma.simple.redis.common.RedisHash;
import org.muma.simple.redis.common.RedisSet;
import org.muma.simple.redis.store.StorageEngine;
import org.muma.simple.redis.store.WrongTypeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 内存存储引擎。
 * 整个 Database 用一把锁（memoryDb 本身）保护，所有操作都在锁内完成读-改-写，
 * 操作都是 O(1) 或 O(参数个数)，不会在持锁期间做 IO。
 */
public class MemoryStorageEngine implements StorageEngine {

    private static final Logger log = LoggerFactory.getLogger(MemoryStorageEngine.class);

    // 超过这个大小的集合整体读取时打 WARN
    private static final int LARGE_COLLECTION_WARN_SIZE = 10000;

    // Key -> Data
    private final Map<RedisBytes, RedisData<?>> memoryDb = new HashMap<>();

    @Override
    public byte[] get(RedisBytes key) {
        synchronized (memoryDb) {
            RedisData<?> data = lookup(key, RedisDataType.STRING);
            return data == null ? null : copyOf(data.getValue(byte[].class));
        }
    }

    @Override
    public void set(RedisBytes key, byte[] value) {
        synchronized (memoryDb) {
            memoryDb.put(key, RedisData.ofString(copyOf(value)));
        }
    }

    @Override
    public void hset(RedisBytes key, RedisBytes field, byte[] value) {
        synchronized (memoryDb) {
            RedisData<?> data = lookup(key, RedisDataType.HASH);
            RedisHash hash;
            if (data == null) {
                hash = new RedisHash();
                memoryDb.put(key, RedisData.ofHash(hash));
            } else {
                hash = data.getValue(RedisHash.class);
            }
            hash.put(field, value);
        }
    }

    @Override
    public byte[] hget(RedisBytes key, RedisBytes field) {
        synchronized (memoryDb) {
            RedisData<?> data = lookup(key, RedisDataType.HASH);
            return data == null ? null : data.getValue(RedisHash.class).get(field);
        }
    }

    @Override
    public List<byte[]> hmget(RedisBytes key, List<RedisBytes> fields) {
        synchronized (memoryDb) {
            RedisData<?> data = lookup(key, RedisDataType.HASH);
            RedisHash hash = data == null ? null : data.getValue(RedisHash.class);

            List<byte[]> values = new ArrayList<>(fields.size());
            for (RedisBytes field : fields) {
                values.add(hash == null ? null : hash.get(field));
            }
            return values;
        }
    }

    @Override
    public Map<RedisBytes, byte[]> hgetall(RedisBytes key) {
        synchronized (memoryDb) {
            RedisData<?> data = lookup(key, RedisDataType.HASH);
            if (data == null) return Collections.emptyMap();

            RedisHash hash = data.getValue(RedisHash.class);
            if (hash.size() > LARGE_COLLECTION_WARN_SIZE) {
                log.warn("HGETALL called on large hash '{}' with {} fields.", key, hash.size());
            }
            return hash.toMap();
        }
    }

    @Override
    public int sadd(RedisBytes key, List<RedisBytes> members) {
        synchronized (memoryDb) {
            RedisData<?> data = lookup(key, RedisDataType.SET);
            RedisSet set;
            if (data == null) {
                set = new RedisSet();
                memoryDb.put(key, RedisData.ofSet(set));
            } else {
                set = data.getValue(RedisSet.class);
            }

            int addedCount = 0;
            for (RedisBytes member : members) {
                addedCount += set.add(member);
            }
            return addedCount;
        }
    }

    @Override
    public boolean sismember(RedisBytes key, RedisBytes member) {
        synchronized (memoryDb) {
            RedisData<?> data = lookup(key, RedisDataType.SET);
            return data != null && data.getValue(RedisSet.class).contains(member);
        }
    }

    @Override
    public List<byte[]> smembers(RedisBytes key) {
        synchronized (memoryDb) {
            RedisData<?> data = lookup(key, RedisDataType.SET);
            if (data == null) return Collections.emptyList();

            RedisSet set = data.getValue(RedisSet.class);
            if (set.size() > LARGE_COLLECTION_WARN_SIZE) {
                log.warn("SMEMBERS called on large set '{}' with {} items.", key, set.size());
            }
            return set.getAll();
        }
    }

    @Override
    public int size() {
        synchronized (memoryDb) {
            return memoryDb.size();
        }
    }

    // 存进去和取出来的 byte[] 都是独立的一份
    private static byte[] copyOf(byte[] value) {
        return value == null ? null : Arrays.copyOf(value, value.length);
    }

    // 必须在锁内调用。key 不存在返回 null，类型不符直接抛出，调用方不会走到修改逻辑
    private RedisData<?> lookup(RedisBytes key, RedisDataType expected) {
        RedisData<?> data = memoryDb.get(key);
        if (data != null && data.getType() != expected) {
            log.debug("Type mismatch on key '{}': expected {}, found {}", key, expected.getCode(), data.getType().getCode());
            throw new WrongTypeException(expected, data.getType());
        }
        return data;
    }
}
