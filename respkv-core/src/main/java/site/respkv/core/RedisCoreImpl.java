package site.respkv.core;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.respkv.database.ExpireListener;
import site.respkv.database.RedisDB;
import site.respkv.datastructure.RedisBytes;

import java.util.List;

/**
 * Redis核心功能实现类
 *
 * @since 1.0.0
 */
@Slf4j
@Getter
public class RedisCoreImpl implements RedisCore {

    /** 采样中过期比例超过该值时继续清理 */
    private static final int EXPIRED_RATIO_PERCENT = 25;

    /** 数据库数组 */
    private final RedisDB[] dataBases;

    /** 数据库数量 */
    private final int dbNum;

    private final KeyLockManager lockManager;

    private volatile boolean replicaMode;

    /**
     * 构造函数
     *
     * @param dbNum 数据库数量
     * @param lockStripes 键锁分段数
     */
    public RedisCoreImpl(final int dbNum, final int lockStripes) {
        if (dbNum <= 0) {
            throw new IllegalArgumentException("database count must be positive: " + dbNum);
        }
        this.dbNum = dbNum;
        this.dataBases = new RedisDB[dbNum];
        for (int i = 0; i < dbNum; i++) {
            dataBases[i] = new RedisDB(i);
        }
        this.lockManager = new KeyLockManager(lockStripes);
    }

    public RedisCoreImpl(final int dbNum) {
        this(dbNum, 1024);
    }

    @Override
    public RedisDB getDB(final int dbIndex) {
        if (dbIndex < 0 || dbIndex >= dbNum) {
            throw new IndexOutOfBoundsException("DB index is out of range: " + dbIndex);
        }
        return dataBases[dbIndex];
    }

    @Override
    public int getDBNum() {
        return dbNum;
    }

    @Override
    public RedisDB[] getDataBases() {
        return dataBases;
    }

    @Override
    public void flushAll() {
        for (final RedisDB db : dataBases) {
            db.clear();
        }
    }

    @Override
    public void setReplicaMode(final boolean replicaMode) {
        this.replicaMode = replicaMode;
        for (final RedisDB db : dataBases) {
            db.setReplicaMode(replicaMode);
        }
        log.info("键空间切换为{}模式", replicaMode ? "从节点" : "主节点");
    }

    @Override
    public void setExpireListener(final ExpireListener listener) {
        for (final RedisDB db : dataBases) {
            db.setExpireListener(listener == null ? ExpireListener.NONE : listener);
        }
    }

    @Override
    public int activeExpireCycle(final int sampleSize, final long budgetMillis) {
        if (replicaMode) {
            return 0;
        }
        final long deadline = System.currentTimeMillis() + budgetMillis;
        int total = 0;
        for (final RedisDB db : dataBases) {
            while (true) {
                // 1. 从带过期时间的键中采样
                final List<RedisBytes> sample = db.sampleExpiring(sampleSize);
                if (sample.isEmpty()) {
                    break;
                }

                // 2. 逐个在独占锁下检查并删除
                int expired = 0;
                for (final RedisBytes key : sample) {
                    try (KeyLockManager.LockHandle ignored =
                                 lockManager.request().add(db.getId(), key, true).acquire()) {
                        if (db.expireIfNeeded(key, System.currentTimeMillis())) {
                            expired++;
                        }
                    }
                }
                total += expired;

                // 3. 过期比例低或超出时间预算时停止
                if (expired * 100 <= sample.size() * EXPIRED_RATIO_PERCENT
                        || System.currentTimeMillis() >= deadline) {
                    break;
                }
            }
            if (System.currentTimeMillis() >= deadline) {
                break;
            }
        }
        if (total > 0) {
            log.debug("主动过期清理删除了 {} 个键", total);
        }
        return total;
    }
}
