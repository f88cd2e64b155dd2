package org.muma.simple.redis.common;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Hash 值。本身不做同步，由存储引擎的锁保护。
 */
public class RedisHash {

    private final Map<RedisBytes, byte[]> fields = new HashMap<>();

    // value 拷贝后保存
    public void put(RedisBytes field, byte[] value) {
        fields.put(field, Arrays.copyOf(value, value.length));
    }

    public byte[] get(RedisBytes field) {
        byte[] value = fields.get(field);
        return value == null ? null : Arrays.copyOf(value, value.length);
    }

    public int size() {
        return fields.size();
    }

    // 拷贝一份，调用方拿到的不是内部视图，value 也是拷贝
    public Map<RedisBytes, byte[]> toMap() {
        Map<RedisBytes, byte[]> copy = new LinkedHashMap<>();
        for (Map.Entry<RedisBytes, byte[]> entry : fields.entrySet()) {
            copy.put(entry.getKey(), Arrays.copyOf(entry.getValue(), entry.getValue().length));
        }
        return copy;
    }
}
