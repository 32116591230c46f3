package site.respkv.cluster.replication;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.concurrent.DefaultThreadFactory;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.respkv.cluster.host.ReplicationHost;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.Errors;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespArray;
import site.respkv.protocol.SimpleString;
import site.respkv.protocol.handler.RespEncoder;

import java.io.IOException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 从节点侧的复制客户端
 *
 * <p>连接主节点后依次发送 PING、REPLCONF listening-port、REPLCONF capa psync2
 * 和 PSYNC，然后接收快照或补发的积压数据，之后按接收顺序重放命令流。
 * 偏移量按已处理的字节数推进，定期以 REPLCONF ACK 回报。
 * 连接断开后以指数退避重连，并用记住的复制ID和偏移量尝试部分同步。
 *
 * @since 1.0.0
 */
@Slf4j
public class ReplicaClient {

    private static final long INITIAL_RECONNECT_DELAY_MILLIS = 100;

    private static final long MAX_RECONNECT_DELAY_MILLIS = 5000;

    private final ReplicationHost host;

    @Getter
    private final String masterHost;

    @Getter
    private final int masterPort;

    /** 本节点对外服务的端口 */
    private final int listeningPort;

    private final long ackPeriodMillis;

    private final EventLoopGroup group = new NioEventLoopGroup(1, new DefaultThreadFactory("replica-link"));

    @Getter
    private volatile ReplicationState state = ReplicationState.DISCONNECTED;

    /** 主节点的复制ID，首次同步前为 "?" */
    @Getter
    private volatile String masterReplId = "?";

    /** 已处理的复制偏移量，首次同步前为-1 */
    @Getter
    private volatile long processedOffset = -1;

    private volatile boolean running;

    private volatile Channel channel;

    private long reconnectDelayMillis = INITIAL_RECONNECT_DELAY_MILLIS;

    /** FULLRESYNC 带来的、快照加载后生效的复制ID和偏移量 */
    private String pendingReplId;
    private long pendingOffset;

    public ReplicaClient(final ReplicationHost host, final String masterHost, final int masterPort,
                         final int listeningPort, final long ackPeriodMillis) {
        this.host = host;
        this.masterHost = masterHost;
        this.masterPort = masterPort;
        this.listeningPort = listeningPort;
        this.ackPeriodMillis = ackPeriodMillis;
    }

    /**
     * 开始连接主节点，立即返回
     */
    public void start() {
        running = true;
        log.info("开始复制主节点 {}:{}", masterHost, masterPort);
        group.execute(this::connect);
    }

    public void stop() {
        running = false;
        final Channel current = channel;
        if (current != null) {
            current.close();
        }
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        state = ReplicationState.DISCONNECTED;
    }

    /**
     * @return 处于命令流阶段时返回true
     */
    public boolean isLinkUp() {
        return state == ReplicationState.STREAMING;
    }

    private void connect() {
        if (!running) {
            return;
        }
        state = ReplicationState.CONNECTING;
        final Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5000)
                .handler(new ChannelInitializer<Channel>() {
                    @Override
                    protected void initChannel(final Channel ch) {
                        ch.pipeline().addLast(new ReplicationStreamDecoder(), new RespEncoder(),
                                new MasterLinkHandler());
                    }
                });
        bootstrap.connect(masterHost, masterPort).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                log.warn("连接主节点 {}:{} 失败: {}", masterHost, masterPort, future.cause().getMessage());
                scheduleReconnect();
            }
        });
    }

    private void scheduleReconnect() {
        state = ReplicationState.DISCONNECTED;
        if (!running || group.isShuttingDown()) {
            return;
        }
        final long delay = reconnectDelayMillis;
        reconnectDelayMillis = Math.min(delay * 2, MAX_RECONNECT_DELAY_MILLIS);
        log.info("{} 毫秒后重连主节点", delay);
        group.schedule(this::connect, delay, TimeUnit.MILLISECONDS);
    }

    private void sendAck(final Channel ch) {
        if (ch.isActive()) {
            ch.writeAndFlush(RespArray.command("REPLCONF", "ACK", String.valueOf(processedOffset)));
        }
    }

    /**
     * 复制连接上的消息处理，全部在连接所属的事件循环线程上执行
     */
    private class MasterLinkHandler extends SimpleChannelInboundHandler<Object> {

        private ScheduledFuture<?> ackTask;

        @Override
        public void channelActive(final ChannelHandlerContext ctx) {
            channel = ctx.channel();
            log.info("已连接主节点 {}:{}，开始握手", masterHost, masterPort);
            state = ReplicationState.HANDSHAKE_PING;
            ctx.writeAndFlush(RespArray.command("PING"));
        }

        @Override
        protected void channelRead0(final ChannelHandlerContext ctx, final Object msg) {
            if (msg instanceof SnapshotPayload) {
                onSnapshot(ctx, ((SnapshotPayload) msg).getData());
                return;
            }
            final StreamFrame frame = (StreamFrame) msg;
            final Resp resp = frame.getResp();
            switch (state) {
                case HANDSHAKE_PING:
                    if (!expectOk(ctx, resp, "PING")) {
                        return;
                    }
                    state = ReplicationState.HANDSHAKE_PORT;
                    ctx.writeAndFlush(RespArray.command("REPLCONF", "listening-port", String.valueOf(listeningPort)));
                    break;
                case HANDSHAKE_PORT:
                    if (resp instanceof Errors) {
                        log.warn("主节点不接受 REPLCONF listening-port: {}", ((Errors) resp).getContent());
                    }
                    state = ReplicationState.HANDSHAKE_CAPA;
                    ctx.writeAndFlush(RespArray.command("REPLCONF", "capa", "psync2"));
                    break;
                case HANDSHAKE_CAPA:
                    if (resp instanceof Errors) {
                        log.warn("主节点不接受 REPLCONF capa: {}", ((Errors) resp).getContent());
                    }
                    state = ReplicationState.WAIT_PSYNC;
                    log.info("发送 PSYNC {} {}", masterReplId, processedOffset);
                    ctx.writeAndFlush(RespArray.command("PSYNC", masterReplId, String.valueOf(processedOffset)));
                    break;
                case WAIT_PSYNC:
                    onPsyncReply(ctx, resp);
                    break;
                case STREAMING:
                    applyFrame(ctx, frame);
                    break;
                default:
                    log.warn("状态 {} 下收到意外的消息: {}", state, resp);
                    break;
            }
        }

        private boolean expectOk(final ChannelHandlerContext ctx, final Resp resp, final String step) {
            if (resp instanceof Errors) {
                log.error("握手步骤 {} 失败: {}", step, ((Errors) resp).getContent());
                ctx.close();
                return false;
            }
            return true;
        }

        private void onPsyncReply(final ChannelHandlerContext ctx, final Resp resp) {
            if (!(resp instanceof SimpleString)) {
                log.error("PSYNC 回复无法识别: {}", resp);
                ctx.close();
                return;
            }
            final String[] parts = ((SimpleString) resp).getContent().split(" ");
            if ("FULLRESYNC".equals(parts[0]) && parts.length == 3) {
                pendingReplId = parts[1];
                pendingOffset = Long.parseLong(parts[2]);
                state = ReplicationState.TRANSFER;
                log.info("主节点要求全量同步，replid={}, offset={}", pendingReplId, pendingOffset);
            } else if ("CONTINUE".equals(parts[0])) {
                if (parts.length > 1 && !parts[1].equals(masterReplId)) {
                    masterReplId = parts[1];
                }
                log.info("部分同步继续，从偏移量 {} 开始", processedOffset);
                onLinkUp(ctx);
            } else {
                log.error("PSYNC 回复无法识别: {}", resp);
                ctx.close();
            }
        }

        private void onSnapshot(final ChannelHandlerContext ctx, final byte[] snapshot) {
            try {
                host.loadSnapshot(snapshot);
            } catch (IOException e) {
                log.error("加载主节点快照失败，断开后重新全量同步", e);
                masterReplId = "?";
                processedOffset = -1;
                ctx.close();
                return;
            }
            masterReplId = pendingReplId;
            processedOffset = pendingOffset;
            log.info("快照加载完成 ({} 字节)，偏移量 {}", snapshot.length, processedOffset);
            onLinkUp(ctx);
        }

        private void onLinkUp(final ChannelHandlerContext ctx) {
            state = ReplicationState.STREAMING;
            reconnectDelayMillis = INITIAL_RECONNECT_DELAY_MILLIS;
            sendAck(ctx.channel());
            ackTask = ctx.executor().scheduleAtFixedRate(() -> sendAck(ctx.channel()),
                    ackPeriodMillis, ackPeriodMillis, TimeUnit.MILLISECONDS);
        }

        private void applyFrame(final ChannelHandlerContext ctx, final StreamFrame frame) {
            final Resp resp = frame.getResp();
            if (resp instanceof RespArray && ((RespArray) resp).size() > 0) {
                final RespArray command = (RespArray) resp;
                final String name = command.getContent()[0].toString().toUpperCase();
                if ("REPLCONF".equals(name) && command.size() > 1
                        && "GETACK".equalsIgnoreCase(command.getContent()[1].toString())) {
                    // 回报 GETACK 之前的偏移量
                    sendAck(ctx.channel());
                } else if (!"PING".equals(name)) {
                    host.applyReplicatedCommand(command);
                }
            } else if (!(resp instanceof BulkString)) {
                log.warn("复制流中收到非命令帧: {}", resp);
            }
            processedOffset += frame.getSize();
        }

        @Override
        public void channelInactive(final ChannelHandlerContext ctx) {
            if (ackTask != null) {
                ackTask.cancel(false);
            }
            channel = null;
            log.warn("与主节点 {}:{} 的连接断开，已处理偏移量 {}", masterHost, masterPort, processedOffset);
            scheduleReconnect();
        }

        @Override
        public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
            log.error("复制连接异常: {}", cause.getMessage(), cause);
            ctx.close();
        }
    }
}
