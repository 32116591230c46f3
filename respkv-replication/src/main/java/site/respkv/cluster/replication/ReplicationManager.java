package site.respkv.cluster.replication;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import site.respkv.cluster.host.ReplicationHost;
import site.respkv.protocol.RespArray;
import site.respkv.protocol.SimpleString;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 主节点侧的复制管理器
 *
 * <p>所有写命令在提交它的临界区内调用 {@link #propagate}，
 * 因此复制流的顺序与键空间的修改顺序一致。传播在本对象的监视器下完成：
 * 编码一次，追加到积压缓冲区，再原样写给每个在线的从节点。
 * 命令所在数据库与上一条不同时先插入一条 SELECT。
 *
 * <p>全量同步在暂停写入的状态下确定快照对应的偏移量，
 * 快照之后的命令都会进入该从节点的流。
 *
 * @since 1.0.0
 */
@Slf4j
public class ReplicationManager {

    private static final byte[] CRLF = {'\r', '\n'};

    private final ReplicationHost host;

    /** 本次运行的复制ID，40位十六进制 */
    @Getter
    private final String replicationId;

    @Getter
    private final ReplBackLog backlog;

    private final List<ReplicaInfo> replicas = new CopyOnWriteArrayList<>();

    /** 上一条传播命令所在的数据库，-1表示下一条必须带 SELECT */
    private int lastPropagatedDb = -1;

    /** 全量同步次数 */
    private final AtomicLong syncFull = new AtomicLong();

    /** 接受的部分同步次数 */
    private final AtomicLong syncPartialOk = new AtomicLong();

    /** 被拒绝、改为全量同步的部分同步请求次数 */
    private final AtomicLong syncPartialErr = new AtomicLong();

    @Setter
    private volatile AckListener ackListener;

    private ScheduledFuture<?> pingTask;

    public ReplicationManager(final ReplicationHost host, final int backlogSize) {
        this.host = host;
        this.backlog = new ReplBackLog(backlogSize);
        this.replicationId = generateReplicationId();
        log.info("复制管理器初始化完成，replid: {}, 积压缓冲区: {} 字节", replicationId, backlogSize);
    }

    private static String generateReplicationId() {
        final byte[] bytes = new byte[20];
        new SecureRandom().nextBytes(bytes);
        final StringBuilder sb = new StringBuilder(40);
        for (final byte b : bytes) {
            sb.append(Character.forDigit((b >> 4) & 0xF, 16)).append(Character.forDigit(b & 0xF, 16));
        }
        return sb.toString();
    }

    public long getSyncFull() {
        return syncFull.get();
    }

    public long getSyncPartialOk() {
        return syncPartialOk.get();
    }

    public long getSyncPartialErr() {
        return syncPartialErr.get();
    }

    /**
     * @return 主节点复制偏移量
     */
    public synchronized long getMasterOffset() {
        return backlog.getEndOffset();
    }

    /**
     * 传播一条写命令
     *
     * @param dbIndex 命令执行时的数据库
     * @param command 传播形式的命令
     */
    public synchronized void propagate(final int dbIndex, final RespArray command) {
        selectIfNeeded(dbIndex);
        feed(command);
    }

    /**
     * 以 MULTI/EXEC 包裹传播一个事务中的全部写命令
     *
     * @param commands 按执行顺序排列的命令
     */
    public synchronized void propagateTransaction(final List<PropagatedCommand> commands) {
        if (commands.isEmpty()) {
            return;
        }
        selectIfNeeded(commands.get(0).getDbIndex());
        feed(RespArray.command("MULTI"));
        for (final PropagatedCommand command : commands) {
            selectIfNeeded(command.getDbIndex());
            feed(command.getCommand());
        }
        feed(RespArray.command("EXEC"));
    }

    /**
     * 传播与数据库无关的命令，如心跳 PING 和 REPLCONF GETACK
     */
    public synchronized void propagateControl(final RespArray command) {
        feed(command);
    }

    private void selectIfNeeded(final int dbIndex) {
        if (dbIndex != lastPropagatedDb) {
            feed(RespArray.command("SELECT", String.valueOf(dbIndex)));
            lastPropagatedDb = dbIndex;
        }
    }

    private void feed(final RespArray command) {
        final byte[] bytes = command.toBytes();
        backlog.append(bytes);
        for (final ReplicaInfo replica : replicas) {
            replica.getChannel().writeAndFlush(Unpooled.wrappedBuffer(bytes));
        }
    }

    /**
     * 处理从节点的 PSYNC 请求，回复由本方法直接写出
     *
     * @param channel 从节点连接
     * @param requestedId 从节点记住的复制ID，首次为 "?"
     * @param requestedOffset 从节点已处理的偏移量，首次为-1
     * @param listeningPort 从节点报告的监听端口
     * @return true表示部分同步，false表示全量同步
     */
    public boolean handlePsync(final Channel channel, final String requestedId, final long requestedOffset,
                               final int listeningPort) {
        // 1. 复制ID一致且偏移量仍在积压缓冲区内时部分同步
        synchronized (this) {
            if (replicationId.equals(requestedId) && backlog.contains(requestedOffset)) {
                final byte[] missing = backlog.readFrom(requestedOffset);
                channel.write(new SimpleString("CONTINUE " + replicationId));
                if (missing.length > 0) {
                    channel.write(Unpooled.wrappedBuffer(missing));
                }
                channel.flush();
                addReplica(new ReplicaInfo(channel, listeningPort, requestedOffset));
                syncPartialOk.incrementAndGet();
                log.info("从节点 {} 部分同步，从偏移量 {} 补发 {} 字节",
                        channel.remoteAddress(), requestedOffset, missing.length);
                return true;
            }
        }
        if (!"?".equals(requestedId)) {
            syncPartialErr.incrementAndGet();
            log.warn("从节点 {} 无法部分同步 (replid={}, offset={}, 积压范围=[{}, {}])，改为全量同步",
                    channel.remoteAddress(), requestedId, requestedOffset,
                    backlog.getStartOffset(), backlog.getEndOffset());
        }

        // 2. 暂停写入，确定快照的切点并在同一临界区内挂上从节点
        host.withWritesPaused(() -> {
            synchronized (this) {
                final long offset = backlog.getEndOffset();
                final byte[] snapshot = host.generateSnapshot();
                channel.write(new SimpleString("FULLRESYNC " + replicationId + " " + offset));
                channel.writeAndFlush(snapshotPayload(snapshot));
                lastPropagatedDb = -1;
                addReplica(new ReplicaInfo(channel, listeningPort, offset));
                syncFull.incrementAndGet();
                log.info("从节点 {} 全量同步，快照 {} 字节，偏移量 {}",
                        channel.remoteAddress(), snapshot.length, offset);
            }
            return null;
        });
        return false;
    }

    /**
     * 快照以 "$长度\r\n" 加内容发送，末尾没有CRLF
     */
    private static ByteBuf snapshotPayload(final byte[] snapshot) {
        final byte[] prefix = ("$" + snapshot.length).getBytes(StandardCharsets.US_ASCII);
        return Unpooled.wrappedBuffer(prefix, CRLF, snapshot);
    }

    private void addReplica(final ReplicaInfo replica) {
        replicas.add(replica);
        replica.getChannel().closeFuture().addListener(f -> {
            if (replicas.remove(replica)) {
                log.info("从节点 {} 断开连接", replica.getChannel().remoteAddress());
            }
        });
    }

    /**
     * 处理从节点的 REPLCONF ACK
     *
     * @param channel 从节点连接
     * @param offset 从节点已处理的偏移量
     */
    public void handleAck(final Channel channel, final long offset) {
        for (final ReplicaInfo replica : replicas) {
            if (replica.getChannel() == channel) {
                if (offset > replica.getAckOffset()) {
                    replica.setAckOffset(offset);
                }
                replica.setLastAckTime(System.currentTimeMillis());
                final AckListener listener = ackListener;
                if (listener != null) {
                    listener.onAck(offset);
                }
                return;
            }
        }
        log.debug("忽略未登记连接的ACK: {}", channel.remoteAddress());
    }

    /**
     * @param offset 目标偏移量
     * @return 确认偏移量不小于目标的从节点数
     */
    public int countAcked(final long offset) {
        int count = 0;
        for (final ReplicaInfo replica : replicas) {
            if (replica.getAckOffset() >= offset) {
                count++;
            }
        }
        return count;
    }

    /**
     * 让所有从节点尽快回报偏移量
     */
    public void requestAcks() {
        if (!replicas.isEmpty()) {
            propagateControl(RespArray.command("REPLCONF", "GETACK", "*"));
        }
    }

    public List<ReplicaInfo> getReplicas() {
        return Collections.unmodifiableList(replicas);
    }

    public boolean isReplica(final Channel channel) {
        for (final ReplicaInfo replica : replicas) {
            if (replica.getChannel() == channel) {
                return true;
            }
        }
        return false;
    }

    /**
     * 启动周期性心跳，心跳作为 PING 进入复制流
     *
     * @param scheduler 调度器
     * @param periodSeconds 周期
     */
    public synchronized void startHeartbeat(final ScheduledExecutorService scheduler, final int periodSeconds) {
        if (pingTask != null) {
            return;
        }
        pingTask = scheduler.scheduleAtFixedRate(() -> {
            if (!replicas.isEmpty()) {
                propagateControl(RespArray.command("PING"));
            }
        }, periodSeconds, periodSeconds, TimeUnit.SECONDS);
    }

    public synchronized void stop() {
        if (pingTask != null) {
            pingTask.cancel(false);
            pingTask = null;
        }
        for (final ReplicaInfo replica : replicas) {
            replica.getChannel().close();
        }
    }
}
