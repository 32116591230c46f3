package site.respkv.server.blocking;

import lombok.extern.slf4j.Slf4j;
import site.respkv.cluster.replication.AckListener;
import site.respkv.cluster.replication.ReplicationManager;
import site.respkv.database.RedisDB;
import site.respkv.datastructure.RedisBytes;
import site.respkv.datastructure.RedisList;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespArray;
import site.respkv.protocol.RespInteger;
import site.respkv.server.session.ClientSession;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * 阻塞命令协调器
 *
 * <p>列表等待：每个 (数据库, 键) 一个按登记顺序排列的队列。
 * 登记发生在持有键独占锁的 BLPOP/BRPOP 内部，推入元素的命令在同一把锁内调用
 * {@link #serveList}，按先来先服务把元素逐个交给等待者，因此不会丢失唤醒，
 * 也不会被其他连接的 LPOP 抢走。
 *
 * <p>副本等待：WAIT 挂起后在每次从节点 ACK 时重新计数。
 *
 * <p>等待者不占用线程，回复通过 {@link ClientSession#resume(Resp)} 投递。
 *
 * @since 1.0.0
 */
@Slf4j
public class BlockingCoordinator implements AckListener {

    private final Map<BlockKey, Deque<ListWaiter>> listWaiters = new HashMap<>();

    private final List<ReplicaWaiter> replicaWaiters = new ArrayList<>();

    private final ScheduledExecutorService timer;

    private volatile ReplicationManager replicationManager;

    private long sequence;

    public BlockingCoordinator(final ScheduledExecutorService timer) {
        this.timer = timer;
    }

    public void setReplicationManager(final ReplicationManager replicationManager) {
        this.replicationManager = replicationManager;
    }

    /**
     * 挂起一个列表弹出，调用方持有这些键的独占锁且确认它们都为空
     *
     * @param session 会话
     * @param dbIndex 数据库
     * @param keys 等待的键
     * @param left 从左端弹出
     * @param timeoutMillis 超时，0表示一直等待
     * @return 等待记录
     */
    public synchronized ListWaiter blockOnLists(final ClientSession session, final int dbIndex,
                                                final List<RedisBytes> keys, final boolean left,
                                                final long timeoutMillis) {
        final List<RedisBytes> distinct = new ArrayList<>(new LinkedHashSet<>(keys));
        final ListWaiter waiter = new ListWaiter(session, ++sequence, dbIndex, distinct, left);
        for (final RedisBytes key : distinct) {
            listWaiters.computeIfAbsent(new BlockKey(dbIndex, key), k -> new ArrayDeque<>()).addLast(waiter);
        }
        suspend(session, waiter, timeoutMillis);
        log.debug("{} 阻塞等待键 {}，超时 {} 毫秒", session, distinct, timeoutMillis);
        return waiter;
    }

    /**
     * 挂起一个 WAIT
     *
     * @param session 会话
     * @param numReplicas 需要的从节点数
     * @param targetOffset 目标偏移量
     * @param timeoutMillis 超时，0表示一直等待
     * @return 等待记录
     */
    public synchronized ReplicaWaiter waitForReplicas(final ClientSession session, final int numReplicas,
                                                      final long targetOffset, final long timeoutMillis) {
        final ReplicaWaiter waiter = new ReplicaWaiter(session, ++sequence, numReplicas, targetOffset);
        replicaWaiters.add(waiter);
        suspend(session, waiter, timeoutMillis);
        return waiter;
    }

    private void suspend(final ClientSession session, final Waiter waiter, final long timeoutMillis) {
        session.setBlocked(true);
        session.setWaiter(waiter);
        if (timeoutMillis > 0) {
            waiter.setTimeoutTask(timer.schedule(() -> onTimeout(waiter), timeoutMillis, TimeUnit.MILLISECONDS));
        }
    }

    private void onTimeout(final Waiter waiter) {
        final Resp reply;
        synchronized (this) {
            if (!waiter.finish()) {
                return;
            }
            detach(waiter);
            if (waiter instanceof ReplicaWaiter) {
                reply = RespInteger.valueOf(countAcked(((ReplicaWaiter) waiter).getTargetOffset()));
            } else {
                reply = RespArray.NULL;
            }
        }
        log.debug("{} 阻塞超时", waiter.getSession());
        waiter.getSession().resume(reply);
    }

    /**
     * 把列表中的元素按登记顺序交给等待者，每个元素唤醒一个等待者。
     * 调用方持有该键的独占锁。
     *
     * @param db 数据库
     * @param key 键
     * @param list 刚被推入元素的列表
     * @param propagation 接收替代传播命令（LPOP/RPOP）
     * @return 被唤醒的等待者数量
     */
    public int serveList(final RedisDB db, final RedisBytes key, final RedisList list,
                         final Consumer<RespArray> propagation) {
        int served = 0;
        while (list.size() > 0) {
            final ListWaiter waiter;
            synchronized (this) {
                waiter = pollFirst(new BlockKey(db.getId(), key));
            }
            if (waiter == null) {
                break;
            }
            final RedisBytes element = waiter.isLeft() ? list.lpop() : list.rpop();
            propagation.accept(new RespArray(new Resp[]{
                    BulkString.fromString(waiter.isLeft() ? "LPOP" : "RPOP"), BulkString.create(key)}));
            waiter.getSession().resume(new RespArray(new Resp[]{BulkString.create(key), BulkString.create(element)}));
            served++;
        }
        if (served > 0) {
            db.touch(key);
            db.removeIfEmpty(key, list);
            log.debug("键 {} 唤醒了 {} 个阻塞连接", key, served);
        }
        return served;
    }

    private ListWaiter pollFirst(final BlockKey blockKey) {
        final Deque<ListWaiter> queue = listWaiters.get(blockKey);
        if (queue == null) {
            return null;
        }
        ListWaiter found = null;
        while (found == null && !queue.isEmpty()) {
            final ListWaiter candidate = queue.pollFirst();
            if (!candidate.finish()) {
                continue;
            }
            if (candidate.getSession().isDisconnected()) {
                // 连接已断开但还没来得及取消，跳过它，元素留给下一个等待者
                detach(candidate);
                candidate.getSession().setBlocked(false);
                log.debug("{} 连接已关闭，跳过该等待者", candidate.getSession());
                continue;
            }
            found = candidate;
        }
        if (queue.isEmpty()) {
            listWaiters.remove(blockKey);
        }
        if (found != null) {
            detach(found);
        }
        return found;
    }

    public synchronized boolean hasListWaiters(final int dbIndex, final RedisBytes key) {
        return listWaiters.containsKey(new BlockKey(dbIndex, key));
    }

    /**
     * 连接关闭时取消它的等待，不发送回复
     *
     * @param session 会话
     */
    public void cancel(final ClientSession session) {
        final Waiter waiter = session.getWaiter();
        if (waiter == null) {
            return;
        }
        synchronized (this) {
            if (waiter.finish()) {
                detach(waiter);
            }
        }
        session.setBlocked(false);
    }

    private void detach(final Waiter waiter) {
        if (waiter instanceof ListWaiter) {
            final ListWaiter listWaiter = (ListWaiter) waiter;
            for (final RedisBytes key : listWaiter.getKeys()) {
                final BlockKey blockKey = new BlockKey(listWaiter.getDbIndex(), key);
                final Deque<ListWaiter> queue = listWaiters.get(blockKey);
                if (queue != null) {
                    queue.remove(listWaiter);
                    if (queue.isEmpty()) {
                        listWaiters.remove(blockKey);
                    }
                }
            }
        } else {
            replicaWaiters.remove(waiter);
        }
    }

    /**
     * 从节点确认偏移量后检查挂起的 WAIT
     */
    @Override
    public void onAck(final long ackOffset) {
        final List<ReplicaWaiter> ready = new ArrayList<>();
        final List<Integer> counts = new ArrayList<>();
        synchronized (this) {
            final Iterator<ReplicaWaiter> it = replicaWaiters.iterator();
            while (it.hasNext()) {
                final ReplicaWaiter waiter = it.next();
                final int count = countAcked(waiter.getTargetOffset());
                if (count >= waiter.getNumReplicas() && waiter.finish()) {
                    it.remove();
                    ready.add(waiter);
                    counts.add(count);
                }
            }
        }
        for (int i = 0; i < ready.size(); i++) {
            ready.get(i).getSession().resume(RespInteger.valueOf(counts.get(i)));
        }
    }

    private int countAcked(final long offset) {
        final ReplicationManager manager = replicationManager;
        return manager == null ? 0 : manager.countAcked(offset);
    }

    public synchronized int getBlockedCount() {
        final Set<Waiter> all = new HashSet<>(replicaWaiters);
        for (final Deque<ListWaiter> queue : listWaiters.values()) {
            all.addAll(queue);
        }
        return all.size();
    }

    private static final class BlockKey {

        private final int dbIndex;

        private final RedisBytes key;

        private BlockKey(final int dbIndex, final RedisBytes key) {
            this.dbIndex = dbIndex;
            this.key = key;
        }

        @Override
        public boolean equals(final Object obj) {
            if (this == obj) {
                return true;
            }
            if (!(obj instanceof BlockKey)) {
                return false;
            }
            final BlockKey other = (BlockKey) obj;
            return dbIndex == other.dbIndex && key.equals(other.key);
        }

        @Override
        public int hashCode() {
            return Objects.hash(dbIndex, key);
        }
    }
}
