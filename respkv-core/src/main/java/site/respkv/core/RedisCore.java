package site.respkv.core;

import site.respkv.database.ExpireListener;
import site.respkv.database.RedisDB;

/**
 * Redis核心操作接口
 *
 * <p>持有全部数据库和键锁，是所有连接共享的唯一数据源。
 * 在启动时构造一次，以引用方式传给需要它的组件。
 *
 * @since 1.0.0
 */
public interface RedisCore {

    /**
     * 获取指定索引的数据库
     *
     * @param dbIndex 数据库索引
     * @return 数据库实例
     * @throws IndexOutOfBoundsException 索引越界
     */
    RedisDB getDB(int dbIndex);

    /**
     * 获取数据库总数
     *
     * @return 数据库数量
     */
    int getDBNum();

    /**
     * 获取所有数据库实例
     *
     * @return 数据库实例数组
     */
    RedisDB[] getDataBases();

    KeyLockManager getLockManager();

    /**
     * 清空所有数据库的数据，调用方持有全部分段的独占锁
     */
    void flushAll();

    /**
     * 切换主从角色，从节点上过期键只被隐藏不被删除
     *
     * @param replicaMode 是否为从节点
     */
    void setReplicaMode(boolean replicaMode);

    boolean isReplicaMode();

    /**
     * 注册过期删除回调，作用于所有数据库
     *
     * @param listener 回调
     */
    void setExpireListener(ExpireListener listener);

    /**
     * 执行一轮主动过期清理
     *
     * @param sampleSize 每个数据库每次采样的键数
     * @param budgetMillis 本轮时间预算
     * @return 删除的键数量
     */
    int activeExpireCycle(int sampleSize, long budgetMillis);
}
