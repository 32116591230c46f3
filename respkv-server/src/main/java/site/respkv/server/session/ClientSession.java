package site.respkv.server.session;

import io.netty.channel.Channel;
import io.netty.util.concurrent.EventExecutor;
import lombok.Getter;
import lombok.Setter;
import site.respkv.command.Command;
import site.respkv.core.RedisCore;
import site.respkv.datastructure.RedisBytes;
import site.respkv.protocol.Resp;
import site.respkv.server.blocking.Waiter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * 单个连接的会话状态：选中的数据库、事务队列、监视的键和阻塞状态。
 *
 * <p>只由所属连接的命令线程访问；阻塞唤醒通过 {@link #resume(Resp)}
 * 把回复投递回该线程。
 *
 * @since 1.0.0
 */
@Getter
public class ClientSession {

    private static final AtomicLong ID_GENERATOR = new AtomicLong();

    private final long id = ID_GENERATOR.incrementAndGet();

    /** 客户端连接，主节点复制会话和测试会话为null */
    private final Channel channel;

    /** 命令线程，为null时唤醒回调在调用线程上直接执行 */
    private final EventExecutor executor;

    @Setter
    private int dbIndex;

    // ========== 事务 ==========

    private boolean inMulti;

    /** 排队阶段出现过错误，EXEC 时放弃 */
    private boolean dirty;

    private final List<Command> queued = new ArrayList<>();

    /** EXEC 正在执行队列中的命令 */
    @Setter
    private boolean executingTransaction;

    /** 监视的键及 WATCH 时的版本 */
    private final Map<WatchedKey, Long> watchedKeys = new LinkedHashMap<>();

    // ========== 复制 ==========

    /** 本连接来自主节点，可以在只读从节点上写入 */
    @Setter
    private boolean masterLink;

    /** 本连接是已完成 PSYNC 的从节点 */
    @Setter
    private boolean replicaLink;

    /** 从节点通过 REPLCONF listening-port 报告的端口 */
    @Setter
    private int listeningPort;

    // ========== 阻塞 ==========

    private volatile boolean blocked;

    /** 当前挂起的等待记录，由阻塞协调器维护 */
    @Setter
    private volatile Waiter waiter;

    /** 阻塞期间收到的后续输入 */
    private final Deque<Resp> pendingInput = new ArrayDeque<>();

    @Setter
    private Consumer<Resp> resumeHandler;

    /** 回复写出后关闭连接 */
    @Setter
    private boolean closeRequested;

    public ClientSession(final Channel channel, final EventExecutor executor) {
        this.channel = channel;
        this.executor = executor;
    }

    /**
     * 无连接的会话，用于主节点复制流和测试
     */
    public ClientSession() {
        this(null, null);
    }

    public void beginMulti() {
        inMulti = true;
        dirty = false;
        queued.clear();
    }

    public void queue(final Command command) {
        queued.add(command);
    }

    public void markDirty() {
        if (inMulti) {
            dirty = true;
        }
    }

    /**
     * 结束事务状态，丢弃队列
     */
    public void endMulti() {
        inMulti = false;
        dirty = false;
        queued.clear();
    }

    /**
     * 记录监视的键，同一个键重复 WATCH 只保留第一次的版本
     *
     * @param core 数据源
     * @param dbIndex 数据库
     * @param key 键
     * @param version 当前版本
     */
    public void watch(final RedisCore core, final int dbIndex, final RedisBytes key, final long version) {
        final WatchedKey watchedKey = new WatchedKey(dbIndex, key);
        if (!watchedKeys.containsKey(watchedKey)) {
            watchedKeys.put(watchedKey, version);
            core.getDB(dbIndex).getWatchRegistry().watch(key);
        }
    }

    /**
     * 取消全部监视
     *
     * @param core 数据源
     */
    public void unwatchAll(final RedisCore core) {
        for (final WatchedKey watchedKey : watchedKeys.keySet()) {
            core.getDB(watchedKey.getDbIndex()).getWatchRegistry().unwatch(watchedKey.getKey());
        }
        watchedKeys.clear();
    }

    public List<Command> getQueued() {
        return Collections.unmodifiableList(queued);
    }

    /**
     * 底层连接已关闭。无连接的会话永远返回false
     */
    public boolean isDisconnected() {
        return channel != null && !channel.isActive();
    }

    public void setBlocked(final boolean blocked) {
        this.blocked = blocked;
        if (!blocked) {
            this.waiter = null;
        }
    }

    /**
     * 投递阻塞命令的最终回复，在会话的命令线程上执行
     *
     * @param reply 回复
     */
    public void resume(final Resp reply) {
        final Consumer<Resp> handler = resumeHandler;
        if (handler == null) {
            setBlocked(false);
            return;
        }
        if (executor != null) {
            executor.execute(() -> handler.accept(reply));
        } else {
            handler.accept(reply);
        }
    }

    @Override
    public String toString() {
        return "session-" + id + (channel != null ? "(" + channel.remoteAddress() + ")" : "");
    }

    /**
     * 被监视的 (数据库, 键)
     */
    @Getter
    public static final class WatchedKey {

        private final int dbIndex;

        private final RedisBytes key;

        public WatchedKey(final int dbIndex, final RedisBytes key) {
            this.dbIndex = dbIndex;
            this.key = key;
        }

        @Override
        public boolean equals(final Object obj) {
            if (this == obj) {
                return true;
            }
            if (!(obj instanceof WatchedKey)) {
                return false;
            }
            final WatchedKey other = (WatchedKey) obj;
            return dbIndex == other.dbIndex && key.equals(other.key);
        }

        @Override
        public int hashCode() {
            return Objects.hash(dbIndex, key);
        }
    }
}
