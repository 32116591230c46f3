package site.respkv.core;

import site.respkv.datastructure.RedisBytes;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 分段键锁
 *
 * <p>(数据库, 键) 被散列到固定数量的读写锁上。修改持有独占锁，读取持有共享锁，
 * 不相关的键落在不同分段上可以并行执行。
 *
 * <p>一次请求涉及多个键时，先合并到分段（同一分段取最强的模式），
 * 再按分段编号升序加锁，任意两个请求之间不会形成环路等待。
 *
 * @since 1.0.0
 */
public class KeyLockManager {

    private final ReentrantReadWriteLock[] stripes;

    private final int mask;

    /**
     * @param stripeCount 分段数量，向上取整到2的幂
     */
    public KeyLockManager(final int stripeCount) {
        if (stripeCount <= 0) {
            throw new IllegalArgumentException("stripe count must be positive: " + stripeCount);
        }
        final int size = Integer.highestOneBit(stripeCount - 1) << 1;
        final int actual = stripeCount == 1 ? 1 : size;
        this.stripes = new ReentrantReadWriteLock[actual];
        for (int i = 0; i < actual; i++) {
            stripes[i] = new ReentrantReadWriteLock();
        }
        this.mask = actual - 1;
    }

    public int getStripeCount() {
        return stripes.length;
    }

    /**
     * @return 键所在的分段编号
     */
    public int stripeOf(final int dbIndex, final RedisBytes key) {
        int h = key.hashCode() * 31 + dbIndex;
        h ^= (h >>> 16);
        return h & mask;
    }

    /**
     * @return 一个新的加锁请求
     */
    public LockRequest request() {
        return new LockRequest();
    }

    /**
     * 锁定全部分段，用于 KEYS、FLUSHALL 以及快照
     *
     * @param write 是否独占
     * @return 锁句柄
     */
    public LockHandle acquireAll(final boolean write) {
        return request().addAll(write).acquire();
    }

    /**
     * 一次加锁请求，收集完所有键后调用 {@link #acquire()}
     */
    public final class LockRequest {

        /** 分段编号到是否独占 */
        private final TreeMap<Integer, Boolean> modes = new TreeMap<>();

        private LockRequest() {
        }

        public LockRequest add(final int dbIndex, final RedisBytes key, final boolean write) {
            modes.merge(stripeOf(dbIndex, key), write, Boolean::logicalOr);
            return this;
        }

        public LockRequest addAll(final boolean write) {
            for (int i = 0; i < stripes.length; i++) {
                modes.merge(i, write, Boolean::logicalOr);
            }
            return this;
        }

        public boolean isEmpty() {
            return modes.isEmpty();
        }

        /**
         * 按分段升序加锁，阻塞直到全部拿到
         *
         * @return 锁句柄，关闭时逆序释放
         */
        public LockHandle acquire() {
            final List<Lock> held = new ArrayList<>(modes.size());
            try {
                for (final Map.Entry<Integer, Boolean> entry : modes.entrySet()) {
                    final ReentrantReadWriteLock rw = stripes[entry.getKey()];
                    final Lock lock = entry.getValue() ? rw.writeLock() : rw.readLock();
                    lock.lock();
                    held.add(lock);
                }
            } catch (RuntimeException | Error e) {
                release(held);
                throw e;
            }
            return new LockHandle(held);
        }
    }

    private static void release(final List<Lock> held) {
        for (int i = held.size() - 1; i >= 0; i--) {
            held.get(i).unlock();
        }
        held.clear();
    }

    /**
     * 已持有的一组锁
     */
    public static final class LockHandle implements AutoCloseable {

        private final List<Lock> held;

        private LockHandle(final List<Lock> held) {
            this.held = held;
        }

        public int size() {
            return held.size();
        }

        @Override
        public void close() {
            release(held);
        }
    }
}
