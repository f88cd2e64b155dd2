package org.muma.simple.redis.protocol;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 批量字符串 ($)。
 * content 为 null 表示 Null Bulk String ($-1)，长度为 0 的数组表示空串 ($0)，两者不相等。
 */
public record BulkString(byte[] content) implements RedisMessage {

    public static final BulkString NULL = new BulkString((byte[]) null);

    public BulkString(String s) {
        this(s == null ? null : s.getBytes(StandardCharsets.UTF_8));
    }

    public boolean isNull() {
        return content == null;
    }

    public String asString() {
        return content == null ? null : new String(content, StandardCharsets.UTF_8);
    }

    // record 默认按引用比较数组，这里改为按内容比较
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BulkString other)) return false;
        return Arrays.equals(content, other.content);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return content == null ? "BulkString[nil]" : "BulkString[" + asString() + "]";
    }
}
