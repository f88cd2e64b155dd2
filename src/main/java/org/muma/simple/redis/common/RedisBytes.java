package org.muma.simple.redis.common;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 二进制安全的字节串，按内容比较，用作 key / hash field / set member。
 * 构造时拷贝一份，之后不可变。
 */
public final class RedisBytes {

    public static final Charset CHARSET = StandardCharsets.UTF_8;

    private final byte[] bytes;

    public RedisBytes(byte[] bytes) {
        this.bytes = Arrays.copyOf(bytes, bytes.length);
    }

    public static RedisBytes of(String s) {
        return new RedisBytes(s.getBytes(CHARSET));
    }

    public byte[] getBytes() {
        return Arrays.copyOf(bytes, bytes.length);
    }

    public String toUtf8String() {
        return new String(bytes, CHARSET);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || obj.getClass() != getClass()) {
            return false;
        }
        RedisBytes other = (RedisBytes) obj;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toUtf8String();
    }
}
