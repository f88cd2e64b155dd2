package org.muma.simple.redis.common;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Set 值。遍历顺序由 HashSet 决定，不保证稳定。
 */
public class RedisSet {

    private final Set<RedisBytes> members = new HashSet<>();

    /**
     * @return 1 表示新加入，0 表示已存在
     */
    public int add(RedisBytes member) {
        return members.add(member) ? 1 : 0;
    }

    public boolean contains(RedisBytes member) {
        return members.contains(member);
    }

    public int size() {
        return members.size();
    }

    public List<byte[]> getAll() {
        List<byte[]> result = new ArrayList<>(members.size());
        for (RedisBytes member : members) {
            result.add(member.getBytes());
        }
        return result;
    }
}
