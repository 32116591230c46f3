package site.respkv.datastructure;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Redis哈希数据结构实现
 *
 * @since 1.0.0
 */
public class RedisHash extends AbstractRedisData {

    private final Map<RedisBytes, RedisBytes> hash = new HashMap<>();

    @Override
    public RedisType type() {
        return RedisType.HASH;
    }

    @Override
    public boolean isEmpty() {
        return hash.isEmpty();
    }

    /**
     * @return 新增字段返回true，覆盖已有字段返回false
     */
    public boolean put(final RedisBytes field, final RedisBytes value) {
        return hash.put(field, value) == null;
    }

    public RedisBytes get(final RedisBytes field) {
        return hash.get(field);
    }

    public boolean delete(final RedisBytes field) {
        return hash.remove(field) != null;
    }

    public boolean containsField(final RedisBytes field) {
        return hash.containsKey(field);
    }

    public int size() {
        return hash.size();
    }

    /**
     * @return 只读视图，调用方需持有键锁
     */
    public Map<RedisBytes, RedisBytes> getHash() {
        return Collections.unmodifiableMap(hash);
    }
}
