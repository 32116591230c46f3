package site.respkv.server.context;

import site.respkv.cluster.replication.ReplicaClient;
import site.respkv.cluster.replication.ReplicationManager;
import site.respkv.core.RedisCore;
import site.respkv.rdb.RdbManager;
import site.respkv.server.blocking.BlockingCoordinator;
import site.respkv.server.config.RedisServerConfig;

/**
 * 服务器上下文，命令通过它访问所有共享组件。
 *
 * <p>各组件在启动时构造一次，以引用方式注入，测试可以只构造需要的部分。
 *
 * @since 1.0.0
 */
public interface RedisContext {

    // ========== 数据 ==========

    RedisCore getRedisCore();

    // ========== 配置 ==========

    RedisServerConfig getConfig();

    /**
     * @return 实际监听的端口，配置为0时是绑定后分配的端口
     */
    int getServerPort();

    // ========== 持久化 ==========

    RdbManager getRdbManager();

    // ========== 复制 ==========

    /**
     * @return 主节点上的复制管理器，从节点上为null
     */
    ReplicationManager getReplicationManager();

    /**
     * @return 从节点上的复制客户端，主节点上为null
     */
    ReplicaClient getReplicaClient();

    default boolean isReplica() {
        return getReplicaClient() != null;
    }

    // ========== 阻塞 ==========

    BlockingCoordinator getBlockingCoordinator();

    /**
     * @return 进程启动时间戳（毫秒）
     */
    long getStartTime();
}
