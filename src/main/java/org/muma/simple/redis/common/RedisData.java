package org.muma.simple.redis.common;

import lombok.Getter;
import lombok.ToString;

/**
 * Database 中一个 key 对应的值：类型标签 + 具体数据。
 * String 是 byte[]，Hash 是 {@link RedisHash}，Set 是 {@link RedisSet}。
 */
@Getter
@ToString
public class RedisData<T> {

    private final RedisDataType type;

    private final T data;

    public RedisData(RedisDataType type, T data) {
        this.type = type;
        this.data = data;
    }

    public static RedisData<byte[]> ofString(byte[] value) {
        return new RedisData<>(RedisDataType.STRING, value);
    }

    public static RedisData<RedisHash> ofHash(RedisHash hash) {
        return new RedisData<>(RedisDataType.HASH, hash);
    }

    public static RedisData<RedisSet> ofSet(RedisSet set) {
        return new RedisData<>(RedisDataType.SET, set);
    }

    // 避免外部强制转换时报 Unchecked warning，同时也方便做类型检查
    public <V> V getValue(Class<V> clazz) {
        if (clazz.isInstance(data)) {
            return clazz.cast(data);
        }
        throw new IllegalStateException("Data type mismatch. Expected " + clazz.getSimpleName() + " but found " + data.getClass().getSimpleName());
    }
}
