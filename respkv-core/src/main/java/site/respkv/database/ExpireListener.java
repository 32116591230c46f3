package site.respkv.database;

import site.respkv.datastructure.RedisBytes;

/**
 * 键因过期被删除时的回调，主节点用它把删除传播为 DEL。
 *
 * <p>回调发生在删除该键的线程上，此时仍持有该键的锁。
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ExpireListener {

    ExpireListener NONE = (dbIndex, key) -> { };

    void onExpired(int dbIndex, RedisBytes key);
}
