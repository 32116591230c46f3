package site.respkv.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.ServerChannel;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.epoll.EpollServerSocketChannel;
import io.netty.channel.kqueue.KQueue;
import io.netty.channel.kqueue.KQueueEventLoopGroup;
import io.netty.channel.kqueue.KQueueServerSocketChannel;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutorGroup;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.respkv.cluster.host.ReplicationHost;
import site.respkv.cluster.replication.ReplicaClient;
import site.respkv.cluster.replication.ReplicationManager;
import site.respkv.core.KeyLockManager;
import site.respkv.core.RedisCore;
import site.respkv.core.RedisCoreImpl;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.Errors;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespArray;
import site.respkv.protocol.handler.RespDecoder;
import site.respkv.protocol.handler.RespEncoder;
import site.respkv.rdb.RdbManager;
import site.respkv.server.blocking.BlockingCoordinator;
import site.respkv.server.config.RedisServerConfig;
import site.respkv.server.context.RedisContextImpl;
import site.respkv.server.dispatch.CommandDispatcher;
import site.respkv.server.handler.RespCommandHandler;
import site.respkv.server.session.ClientSession;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Redis服务器的轻量级实现。
 *
 * <p>该类实现了{@link RedisServer}和{@link ReplicationHost}接口：
 * <ul>
 *   <li>基于Netty的网络层，按操作系统选择 Epoll/KQueue/NIO</li>
 *   <li>独立的命令执行线程池，同一连接的命令总在同一线程上执行</li>
 *   <li>主节点持有复制管理器，从节点持有复制客户端，主节点的复制流在专用会话上重放</li>
 *   <li>定时任务线程负责主动过期、复制心跳和阻塞超时</li>
 * </ul>
 *
 * @since 1.0.0
 */
@Slf4j
@Getter
public class RedisMiniServer implements RedisServer, ReplicationHost {

    /** 主动过期每轮的时间预算 */
    private static final long ACTIVE_EXPIRE_BUDGET_MILLIS = 25;

    private final RedisServerConfig config;

    private Class<? extends ServerChannel> serverChannelClass;

    private EventLoopGroup bossGroup;

    private EventLoopGroup workerGroup;

    /** 命令执行线程池 */
    private EventExecutorGroup commandExecutor;

    /** 主动过期、复制心跳、阻塞超时 */
    private final ScheduledExecutorService cron;

    private Channel serverChannel;

    private final RedisCore redisCore;

    private final RdbManager rdbManager;

    private final RedisContextImpl redisContext;

    private final CommandDispatcher dispatcher;

    /** 重放主节点复制流的会话，全量同步后重建 */
    private volatile ClientSession masterSession = newMasterSession();

    private volatile boolean running;

    public RedisMiniServer(final RedisServerConfig config) {
        config.validate();
        this.config = config;

        // 1. 初始化事件循环组和命令执行器
        initializeEventLoopGroups();
        initializeCommandExecutor();
        this.cron = Executors.newSingleThreadScheduledExecutor(new DefaultThreadFactory("redis-cron", true));

        // 2. 初始化数据和持久化
        this.redisCore = new RedisCoreImpl(config.getDatabaseCount(), config.getLockStripes());
        this.rdbManager = new RdbManager(redisCore, config.getDir(), config.getRdbFileName());

        // 3. 上下文和调度器
        this.redisContext = new RedisContextImpl(redisCore, config, rdbManager, new BlockingCoordinator(cron));
        this.dispatcher = new CommandDispatcher(redisContext);
    }

    private static ClientSession newMasterSession() {
        final ClientSession session = new ClientSession();
        session.setMasterLink(true);
        return session;
    }

    @Override
    public void start() {
        // 1. 加载快照文件
        if (config.isRdbEnabled()) {
            try {
                final int loaded = rdbManager.load();
                log.info("从 {} 加载了 {} 个键", rdbManager.getFile().getAbsolutePath(), loaded);
            } catch (IOException e) {
                throw new IllegalStateException("加载RDB文件失败: " + rdbManager.getFile().getAbsolutePath(), e);
            }
        }

        // 2. 主节点在接受连接前就绪
        if (!config.isReplica()) {
            becomePrimary();
        }

        // 3. 绑定端口
        final ServerBootstrap serverBootstrap = new ServerBootstrap();
        serverBootstrap.group(bossGroup, workerGroup)
                .channel(serverChannelClass)
                .option(ChannelOption.SO_BACKLOG, config.getBacklogSize())
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_RCVBUF, config.getReceiveBufferSize())
                .childOption(ChannelOption.SO_SNDBUF, config.getSendBufferSize())
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(final SocketChannel ch) {
                        final ChannelPipeline pipeline = ch.pipeline();
                        pipeline.addLast(new RespDecoder());
                        pipeline.addLast(new RespEncoder());
                        pipeline.addLast(commandExecutor, new RespCommandHandler(redisContext, dispatcher));
                    }
                });
        try {
            serverChannel = serverBootstrap.bind(config.getHost(), config.getPort()).sync().channel();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stop();
            throw new IllegalStateException("启动被中断", e);
        }
        final int port = ((InetSocketAddress) serverChannel.localAddress()).getPort();
        redisContext.setServerPort(port);
        running = true;
        log.info("Redis server started at {}:{}", config.getHost(), port);

        // 4. 从节点需要知道自己的端口后再连接主节点
        if (config.isReplica()) {
            becomeReplica(port);
        }

        // 5. 后台任务
        cron.scheduleWithFixedDelay(this::activeExpire, config.getActiveExpireIntervalMillis(),
                config.getActiveExpireIntervalMillis(), TimeUnit.MILLISECONDS);
    }

    private void becomePrimary() {
        final ReplicationManager manager = new ReplicationManager(this, config.getReplBacklogSize());
        redisContext.becomePrimary(manager);
        // 过期删除以 DEL 进入复制流
        redisCore.setExpireListener((dbIndex, key) -> manager.propagate(dbIndex,
                new RespArray(new Resp[]{BulkString.fromString("DEL"), BulkString.create(key)})));
        manager.startHeartbeat(cron, config.getReplPingPeriodSeconds());
        log.info("以主节点身份运行，replid: {}", manager.getReplicationId());
    }

    private void becomeReplica(final int port) {
        final ReplicaClient client = new ReplicaClient(this, config.getReplicaOfHost(), config.getReplicaOfPort(),
                port, config.getReplicaAckPeriodMillis());
        redisContext.becomeReplica(client);
        client.start();
        log.info("以从节点身份运行，主节点 {}:{}", config.getReplicaOfHost(), config.getReplicaOfPort());
    }

    private void activeExpire() {
        if (redisCore.isReplicaMode()) {
            return;
        }
        try {
            final int expired = redisCore.activeExpireCycle(config.getActiveExpireSampleSize(),
                    ACTIVE_EXPIRE_BUDGET_MILLIS);
            if (expired > 0) {
                log.debug("主动过期删除了 {} 个键", expired);
            }
        } catch (RuntimeException e) {
            log.error("主动过期任务失败", e);
        }
    }

    @Override
    public synchronized void stop() {
        if (cron.isShutdown()) {
            return;
        }
        running = false;
        try {
            // 1. 停止接受新连接
            if (serverChannel != null) {
                serverChannel.close().sync();
            }
            // 2. 断开复制链路
            final ReplicaClient replicaClient = redisContext.getReplicaClient();
            if (replicaClient != null) {
                replicaClient.stop();
            }
            final ReplicationManager manager = redisContext.getReplicationManager();
            if (manager != null) {
                manager.stop();
            }
            cron.shutdownNow();
            // 3. 关闭客户端连接和命令线程
            workerGroup.shutdownGracefully().sync();
            bossGroup.shutdownGracefully().sync();
            commandExecutor.shutdownGracefully().sync();
        } catch (InterruptedException e) {
            log.error("Redis server stop interrupted", e);
            Thread.currentThread().interrupt();
        }
        // 4. 最后一次快照
        if (config.isRdbEnabled()) {
            try {
                rdbManager.save();
            } catch (IOException e) {
                log.error("关闭时保存快照失败", e);
            }
        }
        rdbManager.close();
        log.info("Redis server stopped");
    }

    @Override
    public int getPort() {
        return redisContext.getServerPort();
    }

    // ========== ReplicationHost ==========

    @Override
    public <T> T withWritesPaused(final Supplier<T> action) {
        try (KeyLockManager.LockHandle ignored = redisCore.getLockManager().acquireAll(false)) {
            return action.get();
        }
    }

    @Override
    public byte[] generateSnapshot() {
        return rdbManager.snapshot();
    }

    @Override
    public void loadSnapshot(final byte[] snapshot) throws IOException {
        final int loaded = rdbManager.restore(snapshot);
        masterSession = newMasterSession();
        log.info("全量同步完成，加载了 {} 个键", loaded);
    }

    @Override
    public void applyReplicatedCommand(final RespArray command) {
        final Resp reply = dispatcher.dispatch(masterSession, command);
        if (reply instanceof Errors) {
            log.warn("重放复制命令 {} 失败: {}", command, reply);
        }
    }

    private void initializeEventLoopGroups() {
        final String osName = System.getProperty("os.name").toLowerCase();
        if (Epoll.isAvailable()) {
            log.info("使用Epoll EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new EpollEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("epoll-boss"));
            this.workerGroup = new EpollEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("epoll-worker"));
            this.serverChannelClass = EpollServerSocketChannel.class;
        } else if (KQueue.isAvailable()) {
            log.info("使用KQueue EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new KQueueEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("kqueue-boss"));
            this.workerGroup = new KQueueEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("kqueue-worker"));
            this.serverChannelClass = KQueueServerSocketChannel.class;
        } else {
            log.info("使用NIO EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new NioEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("nio-boss"));
            this.workerGroup = new NioEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("nio-worker"));
            this.serverChannelClass = NioServerSocketChannel.class;
        }
    }

    private void initializeCommandExecutor() {
        this.commandExecutor = new DefaultEventExecutorGroup(config.getCommandExecutorThreadCount(),
                new DefaultThreadFactory("redis-cmd"));
    }
}
