package site.respkv.database;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import site.respkv.datastructure.RedisBytes;
import site.respkv.datastructure.RedisData;
import site.respkv.datastructure.RedisType;
import site.respkv.internal.GlobMatcher;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Redis数据库实现类
 *
 * <p>一个数据库索引对应一个键空间。底层使用ConcurrentHashMap，
 * 但单个值的读写一致性由外部的键锁保证：修改某个键时调用方持有该键的独占锁，
 * 读取时持有共享锁。
 *
 * <p>主要功能包括：
 * <ul>
 *     <li>惰性过期：任何访问在观察到值之前先检查过期时间</li>
 *     <li>版本号：每次修改从本库的单调时钟取一个新值写入</li>
 *     <li>过期键采样，供后台定期清理使用</li>
 * </ul>
 *
 * <p>从节点模式下过期键只被视为不存在，不会被删除，
 * 真正的删除等待主节点传播过来的 DEL。
 *
 * @since 1.0.0
 */
@Slf4j
@Getter
public class RedisDB {

    /** 数据库标识ID */
    private final int id;

    /** 键空间 */
    private final Map<RedisBytes, RedisData> data = new ConcurrentHashMap<>();

    /** 设置了过期时间的键 */
    private final Set<RedisBytes> expires = ConcurrentHashMap.newKeySet();

    /** 版本时钟 */
    private final AtomicLong versionClock = new AtomicLong();

    private final WatchRegistry watchRegistry = new WatchRegistry();

    /** 从节点模式 */
    @Setter
    private volatile boolean replicaMode;

    @Setter
    private volatile ExpireListener expireListener = ExpireListener.NONE;

    /** 过期采样游标，跨周期延续 */
    @Getter(AccessLevel.NONE)
    private Iterator<RedisBytes> expireCursor;

    public RedisDB(final int id) {
        this.id = id;
    }

    /**
     * 获取指定键的值，已过期的键视为不存在
     *
     * @param key 键
     * @return 值，不存在或已过期返回null
     */
    public RedisData get(final RedisBytes key) {
        final RedisData value = data.get(key);
        if (value == null) {
            return null;
        }
        if (value.isExpired(System.currentTimeMillis())) {
            expireEntry(key, value);
            return null;
        }
        return value;
    }

    /**
     * 获取指定类型的值
     *
     * @param key 键
     * @param type 期望类型
     * @return 值，不存在返回null
     * @throws WrongTypeException 类型不匹配
     */
    @SuppressWarnings("unchecked")
    public <T extends RedisData> T get(final RedisBytes key, final RedisType type) {
        final RedisData value = get(key);
        if (value == null) {
            return null;
        }
        if (value.type() != type) {
            throw new WrongTypeException(type, value.type());
        }
        return (T) value;
    }

    public boolean exists(final RedisBytes key) {
        return get(key) != null;
    }

    /**
     * 存储键值对，覆盖旧值并写入新版本号
     *
     * @param key 键
     * @param value 值，过期时间取自值本身
     */
    public void put(final RedisBytes key, final RedisData value) {
        data.put(key, value);
        if (value.expireAt() >= 0) {
            expires.add(key);
        } else {
            expires.remove(key);
        }
        touch(key);
    }

    /**
     * 删除指定键
     *
     * @param key 键
     * @return 被删除的值，键不存在或已过期返回null
     */
    public RedisData delete(final RedisBytes key) {
        final RedisData value = data.remove(key);
        if (value == null) {
            return null;
        }
        expires.remove(key);
        bumpVersion(key, null);
        if (value.isExpired(System.currentTimeMillis())) {
            if (!replicaMode) {
                expireListener.onExpired(id, key);
            }
            return null;
        }
        return value;
    }

    /**
     * 原地修改后调用，为键写入新版本号；键已被删除时只通知监视表
     *
     * @param key 键
     */
    public void touch(final RedisBytes key) {
        bumpVersion(key, data.get(key));
    }

    private void bumpVersion(final RedisBytes key, final RedisData value) {
        final long version = versionClock.incrementAndGet();
        if (value != null) {
            value.setVersion(version);
        }
        watchRegistry.onTouch(key, version);
    }

    /**
     * 聚合类型变空后删除键
     *
     * @param key 键
     * @param value 刚被修改的值
     * @return 键被删除返回true
     */
    public boolean removeIfEmpty(final RedisBytes key, final RedisData value) {
        if (value.isEmpty() && data.remove(key, value)) {
            expires.remove(key);
            bumpVersion(key, null);
            return true;
        }
        return false;
    }

    /**
     * 设置绝对过期时间，时间已过去时直接删除键
     *
     * @param key 键
     * @param expireAt 绝对时间戳（毫秒）
     * @return 键存在返回true
     */
    public boolean expire(final RedisBytes key, final long expireAt) {
        final RedisData value = get(key);
        if (value == null) {
            return false;
        }
        if (expireAt <= System.currentTimeMillis()) {
            // 过去的时间等价于删除
            data.remove(key, value);
            expires.remove(key);
            bumpVersion(key, null);
            return true;
        }
        value.setExpireAt(expireAt);
        expires.add(key);
        touch(key);
        return true;
    }

    /**
     * 移除过期时间
     *
     * @return 移除成功返回true，键不存在或本就没有过期时间返回false
     */
    public boolean persist(final RedisBytes key) {
        final RedisData value = get(key);
        if (value == null || value.expireAt() < 0) {
            return false;
        }
        value.setExpireAt(-1);
        expires.remove(key);
        touch(key);
        return true;
    }

    /**
     * 剩余生存时间
     *
     * @param key 键
     * @return 毫秒数；-2表示键不存在，-1表示没有过期时间
     */
    public long pttl(final RedisBytes key) {
        final RedisData value = get(key);
        if (value == null) {
            return -2;
        }
        if (value.expireAt() < 0) {
            return -1;
        }
        return Math.max(0, value.expireAt() - System.currentTimeMillis());
    }

    /**
     * WATCH 使用的键版本：存活的键返回值上的版本，
     * 不存在或已过期的键返回监视表记录的删除版本。
     *
     * @param key 键
     * @return 当前版本
     */
    public long keyVersion(final RedisBytes key) {
        final RedisData value = get(key);
        return value != null ? value.version() : watchRegistry.lastVersion(key);
    }

    /**
     * 匹配模式的未过期键
     *
     * @param pattern glob模式
     * @return 匹配的键
     */
    public List<RedisBytes> keys(final RedisBytes pattern) {
        final long now = System.currentTimeMillis();
        final boolean all = pattern.length() == 1 && pattern.getBytesUnsafe()[0] == '*';
        final List<RedisBytes> result = new ArrayList<>();
        for (final Map.Entry<RedisBytes, RedisData> entry : data.entrySet()) {
            if (entry.getValue().isExpired(now)) {
                continue;
            }
            if (all || GlobMatcher.matches(pattern.getBytesUnsafe(), entry.getKey().getBytesUnsafe())) {
                result.add(entry.getKey());
            }
        }
        return result;
    }

    /**
     * 键数量，包含尚未被清理的过期键
     */
    public int size() {
        return data.size();
    }

    /**
     * 清空数据库，被监视的键全部视为已修改
     */
    public synchronized void clear() {
        data.clear();
        expires.clear();
        expireCursor = null;
        watchRegistry.touchAll(versionClock.incrementAndGet());
    }

    /**
     * 从设置了过期时间的键中按游标顺序取样
     *
     * @param count 最大数量
     * @return 采样到的键
     */
    public synchronized List<RedisBytes> sampleExpiring(final int count) {
        if (expires.isEmpty()) {
            return Collections.emptyList();
        }
        final List<RedisBytes> sample = new ArrayList<>(count);
        boolean restarted = false;
        while (sample.size() < count) {
            if (expireCursor == null || !expireCursor.hasNext()) {
                if (restarted) {
                    break;
                }
                expireCursor = expires.iterator();
                restarted = true;
                continue;
            }
            sample.add(expireCursor.next());
        }
        return sample;
    }

    /**
     * 键已过期时删除，调用方持有该键的独占锁
     *
     * @param key 键
     * @param now 当前时间戳
     * @return 删除返回true
     */
    public boolean expireIfNeeded(final RedisBytes key, final long now) {
        final RedisData value = data.get(key);
        if (value == null) {
            expires.remove(key);
            return false;
        }
        if (!value.isExpired(now)) {
            return false;
        }
        return expireEntry(key, value);
    }

    private boolean expireEntry(final RedisBytes key, final RedisData value) {
        if (replicaMode) {
            return false;
        }
        // 并发读者之间只有一个能删除成功并传播
        if (!data.remove(key, value)) {
            return false;
        }
        expires.remove(key);
        bumpVersion(key, null);
        log.debug("键 {} 在数据库 {} 中过期被删除", key, id);
        expireListener.onExpired(id, key);
        return true;
    }
}
