package site.respkv.server.dispatch;

import io.netty.channel.Channel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import site.respkv.cluster.replication.ReplicaInfo;
import site.respkv.datastructure.RedisBytes;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespArray;
import site.respkv.protocol.RespInteger;
import site.respkv.server.session.ClientSession;

import java.util.Collections;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

@DisplayName("阻塞命令单元测试")
class BlockingCommandTest extends DispatcherTestSupport {

    /**
     * 创建一个把唤醒回复收集到队列里的会话
     */
    private ClientSession blockingSession(final BlockingQueue<Resp> replies) {
        final ClientSession client = new ClientSession();
        client.setResumeHandler(reply -> {
            client.setBlocked(false);
            replies.add(reply);
        });
        return client;
    }

    @Test
    @DisplayName("列表非空时 BLPOP 立即返回")
    void testImmediatePop() {
        call("RPUSH", "q", "a", "b");
        assertArray(call("BLPOP", "empty", "q", "0"), "q", "a");
        assertArray(call("BRPOP", "q", "0"), "q", "b");
        assertInt(0, call("EXISTS", "q"));
        verify(manager).propagate(0, RespArray.command("LPOP", "q"));
        verify(manager).propagate(0, RespArray.command("RPOP", "q"));
    }

    @Test
    @DisplayName("多个阻塞客户端按到达顺序被唤醒")
    void testFifoWakeUp() {
        final BlockingQueue<Resp> repliesA = new LinkedBlockingQueue<>();
        final BlockingQueue<Resp> repliesB = new LinkedBlockingQueue<>();
        final BlockingQueue<Resp> repliesC = new LinkedBlockingQueue<>();
        final ClientSession a = blockingSession(repliesA);
        final ClientSession b = blockingSession(repliesB);
        final ClientSession c = blockingSession(repliesC);

        assertNull(call(a, "BLPOP", "q", "0"));
        assertNull(call(b, "BLPOP", "q", "0"));
        assertNull(call(c, "BLPOP", "q", "0"));
        assertTrue(a.isBlocked());
        assertEquals(3, coordinator.getBlockedCount());

        assertInt(2, call("RPUSH", "q", "x", "y"));

        assertArray(repliesA.poll(), "q", "x");
        assertArray(repliesB.poll(), "q", "y");
        assertTrue(repliesC.isEmpty());
        assertTrue(c.isBlocked());
        assertInt(0, call("LLEN", "q"));

        // 推入命令先于唤醒产生的弹出传播
        final InOrder inOrder = inOrder(manager);
        inOrder.verify(manager).propagate(0, RespArray.command("RPUSH", "q", "x", "y"));
        inOrder.verify(manager, times(2)).propagate(0, RespArray.command("LPOP", "q"));
    }

    @Test
    @DisplayName("等待多个键时由第一个有数据的键唤醒")
    void testMultipleKeys() {
        final BlockingQueue<Resp> replies = new LinkedBlockingQueue<>();
        final ClientSession client = blockingSession(replies);
        assertNull(call(client, "BRPOP", "k1", "k2", "0"));

        call("LPUSH", "k2", "v");
        assertArray(replies.poll(), "k2", "v");
        assertEquals(0, coordinator.getBlockedCount());
        assertFalse(coordinator.hasListWaiters(0, RedisBytes.fromString("k1")));
    }

    @Test
    @DisplayName("超时后回复空数组")
    void testTimeout() throws InterruptedException {
        final BlockingQueue<Resp> replies = new LinkedBlockingQueue<>();
        final ClientSession client = blockingSession(replies);
        assertNull(call(client, "BLPOP", "q", "0.05"));

        final Resp reply = replies.poll(2, TimeUnit.SECONDS);
        assertEquals(RespArray.NULL, reply);
        assertFalse(client.isBlocked());

        // 超时后的推入不会再交给该客户端
        call("RPUSH", "q", "late");
        assertInt(1, call("LLEN", "q"));
    }

    @Test
    @DisplayName("取消等待后推入的元素留在列表中")
    void testCancel() {
        final BlockingQueue<Resp> replies = new LinkedBlockingQueue<>();
        final ClientSession client = blockingSession(replies);
        call(client, "BLPOP", "q", "0");
        coordinator.cancel(client);

        call("RPUSH", "q", "v");
        assertTrue(replies.isEmpty());
        assertInt(1, call("LLEN", "q"));
    }

    @Test
    @DisplayName("事务中的 BLPOP 不阻塞")
    void testBlockingPopInsideTransaction() {
        call("MULTI");
        call("BLPOP", "q", "0");
        final Resp reply = call("EXEC");
        assertEquals(RespArray.NULL, ((RespArray) reply).getContent()[0]);
        assertFalse(session.isBlocked());
    }

    @Test
    @DisplayName("非法超时参数")
    void testInvalidTimeout() {
        assertError("ERR timeout is negative", call("BLPOP", "q", "-1"));
        assertError("ERR timeout is not a float or out of range", call("BLPOP", "q", "abc"));
    }

    @Test
    @DisplayName("对非列表键的 BLPOP 返回 WRONGTYPE")
    void testBlockingPopWrongType() {
        call("SET", "s", "v");
        assertError("WRONGTYPE", call("BLPOP", "s", "0"));
        assertFalse(session.isBlocked());
    }

    @Test
    @DisplayName("没有从节点时 WAIT 立即返回0")
    void testWaitWithoutReplicas() {
        assertEquals(RespInteger.ZERO, call("WAIT", "1", "100"));
    }

    @Test
    @DisplayName("WAIT 在从节点确认后被唤醒")
    void testWaitWokenByAck() {
        when(manager.getReplicas()).thenReturn(Collections.singletonList(mock(ReplicaInfo.class)));
        when(manager.getMasterOffset()).thenReturn(100L);
        when(manager.countAcked(anyLong())).thenReturn(0);

        final BlockingQueue<Resp> replies = new LinkedBlockingQueue<>();
        final ClientSession client = blockingSession(replies);
        assertNull(call(client, "WAIT", "1", "0"));
        verify(manager).requestAcks();
        assertTrue(client.isBlocked());

        when(manager.countAcked(100L)).thenReturn(1);
        coordinator.onAck(100L);
        assertEquals(RespInteger.ONE, replies.poll());
        assertFalse(client.isBlocked());
    }

    @Test
    @DisplayName("已满足时 WAIT 直接返回确认数")
    void testWaitAlreadySatisfied() {
        when(manager.getReplicas()).thenReturn(Collections.singletonList(mock(ReplicaInfo.class)));
        when(manager.countAcked(anyLong())).thenReturn(1);
        assertEquals(RespInteger.ONE, call("WAIT", "1", "1000"));
        verify(manager, never()).requestAcks();
    }

    @Test
    @DisplayName("WAIT 超时返回当前确认数")
    void testWaitTimeout() throws InterruptedException {
        when(manager.getReplicas()).thenReturn(Collections.singletonList(mock(ReplicaInfo.class)));
        when(manager.countAcked(anyLong())).thenReturn(0);
        final BlockingQueue<Resp> replies = new LinkedBlockingQueue<>();
        final ClientSession client = blockingSession(replies);
        assertNull(call(client, "WAIT", "2", "50"));
        assertEquals(RespInteger.ZERO, replies.poll(2, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("连接已关闭的等待者被跳过，元素交给下一个等待者")
    void testClosedWaiterSkipped() {
        final Channel closed = mock(Channel.class);
        when(closed.isActive()).thenReturn(true);
        final BlockingQueue<Resp> closedReplies = new LinkedBlockingQueue<>();
        final ClientSession gone = new ClientSession(closed, null);
        gone.setResumeHandler(closedReplies::add);
        final BlockingQueue<Resp> liveReplies = new LinkedBlockingQueue<>();
        final ClientSession live = blockingSession(liveReplies);

        assertNull(call(gone, "BLPOP", "q", "0"));
        assertNull(call(live, "BLPOP", "q", "0"));
        assertEquals(2, coordinator.getBlockedCount());

        // 连接断开，但取消还没执行
        when(closed.isActive()).thenReturn(false);
        assertInt(1, call("RPUSH", "q", "x"));

        assertTrue(closedReplies.isEmpty());
        assertFalse(gone.isBlocked());
        assertArray(liveReplies.poll(), "q", "x");
        assertEquals(0, coordinator.getBlockedCount());
        verify(manager, times(1)).propagate(0, RespArray.command("LPOP", "q"));
    }

    @Test
    @DisplayName("唯一的等待者连接已关闭时元素留在列表中")
    void testClosedWaiterLeavesElement() {
        final Channel closed = mock(Channel.class);
        when(closed.isActive()).thenReturn(true);
        final ClientSession gone = new ClientSession(closed, null);
        gone.setResumeHandler(reply -> fail("已关闭的连接不应收到回复"));

        assertNull(call(gone, "BRPOP", "q", "0"));
        when(closed.isActive()).thenReturn(false);
        assertInt(1, call("RPUSH", "q", "x"));

        assertInt(1, call("LLEN", "q"));
        assertFalse(coordinator.hasListWaiters(0, RedisBytes.fromString("q")));
        verify(manager, never()).propagate(0, RespArray.command("RPOP", "q"));
    }
}
