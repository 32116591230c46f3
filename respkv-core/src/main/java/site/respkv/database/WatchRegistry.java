package site.respkv.database;

import site.respkv.datastructure.RedisBytes;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 被 WATCH 的键的登记表
 *
 * <p>值对象上的版本号会随键的删除一起消失，无法区分
 * "从未存在" 与 "删除后又重建"。登记表为仍被监视的键保存最近一次
 * 修改（包括删除）时的版本号，使这两种情况在 EXEC 时都能被发现。
 *
 * <p>同一个键被多个连接监视时按引用计数管理，计数归零即移除。
 *
 * @since 1.0.0
 */
public class WatchRegistry {

    private static final class WatchEntry {
        private int refCount;
        private long lastVersion;
    }

    private final Map<RedisBytes, WatchEntry> watched = new ConcurrentHashMap<>();

    /**
     * 增加一次监视引用
     *
     * @param key 键
     */
    public void watch(final RedisBytes key) {
        watched.compute(key, (k, entry) -> {
            final WatchEntry e = entry == null ? new WatchEntry() : entry;
            e.refCount++;
            return e;
        });
    }

    /**
     * 减少一次监视引用
     *
     * @param key 键
     */
    public void unwatch(final RedisBytes key) {
        watched.computeIfPresent(key, (k, entry) -> --entry.refCount <= 0 ? null : entry);
    }

    /**
     * 键被修改或删除时记录新版本，未被监视的键直接忽略
     *
     * @param key 键
     * @param version 新版本号
     */
    public void onTouch(final RedisBytes key, final long version) {
        if (watched.isEmpty()) {
            return;
        }
        watched.computeIfPresent(key, (k, entry) -> {
            entry.lastVersion = version;
            return entry;
        });
    }

    /**
     * @param key 键
     * @return 最近一次记录的版本号，没有记录返回0
     */
    public long lastVersion(final RedisBytes key) {
        final WatchEntry entry = watched.get(key);
        return entry == null ? 0 : entry.lastVersion;
    }

    /**
     * 对所有被监视的键记录同一个版本号，用于 FLUSHDB/FLUSHALL
     *
     * @param version 新版本号
     */
    public void touchAll(final long version) {
        for (final RedisBytes key : watched.keySet()) {
            onTouch(key, version);
        }
    }

    public boolean isWatched(final RedisBytes key) {
        return watched.containsKey(key);
    }

    public int size() {
        return watched.size();
    }
}
