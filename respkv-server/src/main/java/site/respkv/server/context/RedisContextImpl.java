package site.respkv.server.context;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import site.respkv.cluster.replication.ReplicaClient;
import site.respkv.cluster.replication.ReplicationManager;
import site.respkv.core.RedisCore;
import site.respkv.rdb.RdbManager;
import site.respkv.server.blocking.BlockingCoordinator;
import site.respkv.server.config.RedisServerConfig;

/**
 * {@link RedisContext} 的默认实现，复制组件在服务器启动时按角色设置
 *
 * @since 1.0.0
 */
@Slf4j
@Getter
public class RedisContextImpl implements RedisContext {

    private final RedisCore redisCore;

    private final RedisServerConfig config;

    private final RdbManager rdbManager;

    private final BlockingCoordinator blockingCoordinator;

    private final long startTime = System.currentTimeMillis();

    @Setter
    private volatile ReplicationManager replicationManager;

    @Setter
    private volatile ReplicaClient replicaClient;

    @Setter
    private volatile int serverPort;

    public RedisContextImpl(final RedisCore redisCore, final RedisServerConfig config,
                            final RdbManager rdbManager, final BlockingCoordinator blockingCoordinator) {
        this.redisCore = redisCore;
        this.config = config;
        this.rdbManager = rdbManager;
        this.blockingCoordinator = blockingCoordinator;
        this.serverPort = config.getPort();
    }

    /**
     * 设置为主节点，复制管理器同时作为 WAIT 的ACK来源
     *
     * @param manager 复制管理器
     */
    public void becomePrimary(final ReplicationManager manager) {
        this.replicationManager = manager;
        this.replicaClient = null;
        blockingCoordinator.setReplicationManager(manager);
        manager.setAckListener(blockingCoordinator);
        redisCore.setReplicaMode(false);
    }

    /**
     * 设置为从节点
     *
     * @param client 复制客户端
     */
    public void becomeReplica(final ReplicaClient client) {
        this.replicaClient = client;
        this.replicationManager = null;
        blockingCoordinator.setReplicationManager(null);
        redisCore.setReplicaMode(true);
    }
}
