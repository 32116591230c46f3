package site.respkv.cluster.replication;

import io.netty.buffer.ByteBuf;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import site.respkv.cluster.host.ReplicationHost;
import site.respkv.protocol.RespArray;
import site.respkv.protocol.handler.RespEncoder;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("ReplicationManager单元测试")
class ReplicationManagerTest {

    private static final String SELECT0 = "*2\r\n$6\r\nSELECT\r\n$1\r\n0\r\n";
    private static final String SET_K_V = "*3\r\n$3\r\nSET\r\n$1\r\nk\r\n$1\r\nv\r\n";

    private ReplicationHost host;
    private ReplicationManager manager;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        host = mock(ReplicationHost.class);
        when(host.withWritesPaused(any())).thenAnswer(inv -> ((Supplier<Object>) inv.getArgument(0)).get());
        when(host.generateSnapshot()).thenReturn("SNAP".getBytes(StandardCharsets.US_ASCII));
        manager = new ReplicationManager(host, 1024);
    }

    private static EmbeddedChannel replicaChannel() {
        return new EmbeddedChannel(new RespEncoder());
    }

    private static String drain(EmbeddedChannel channel) {
        StringBuilder sb = new StringBuilder();
        ByteBuf buf;
        while ((buf = channel.readOutbound()) != null) {
            sb.append(buf.toString(StandardCharsets.US_ASCII));
            buf.release();
        }
        return sb.toString();
    }

    @Test
    void testReplicationId() {
        assertEquals(40, manager.getReplicationId().length());
        assertTrue(manager.getReplicationId().matches("[0-9a-f]+"));
        assertNotEquals(manager.getReplicationId(), new ReplicationManager(host, 16).getReplicationId());
    }

    @Test
    @DisplayName("数据库切换时插入SELECT，偏移量按字节推进")
    void testPropagateSelect() {
        manager.propagate(0, RespArray.command("SET", "k", "v"));
        assertEquals(SELECT0.length() + SET_K_V.length(), manager.getMasterOffset());

        manager.propagate(0, RespArray.command("SET", "k", "v"));
        assertEquals(SELECT0.length() + 2L * SET_K_V.length(), manager.getMasterOffset());

        manager.propagate(3, RespArray.command("DEL", "k"));
        String history = new String(manager.getBacklog().readFrom(0), StandardCharsets.US_ASCII);
        assertTrue(history.endsWith("*2\r\n$6\r\nSELECT\r\n$1\r\n3\r\n*2\r\n$3\r\nDEL\r\n$1\r\nk\r\n"));
    }

    @Test
    @DisplayName("首次PSYNC执行全量同步并发送快照")
    void testFullResync() {
        manager.propagate(0, RespArray.command("SET", "k", "v"));
        long offset = manager.getMasterOffset();
        EmbeddedChannel replica = replicaChannel();

        assertFalse(manager.handlePsync(replica, "?", -1, 6380));

        String expected = "+FULLRESYNC " + manager.getReplicationId() + " " + offset + "\r\n$4\r\nSNAP";
        assertEquals(expected, drain(replica));
        assertEquals(1, manager.getReplicas().size());
        assertEquals(offset, manager.getReplicas().get(0).getAckOffset());
        assertEquals(6380, manager.getReplicas().get(0).getListeningPort());
        verify(host).withWritesPaused(any());
        verify(host).generateSnapshot();

        // 快照之后的第一条命令重新带上SELECT
        manager.propagate(0, RespArray.command("SET", "k", "v"));
        assertEquals(SELECT0 + SET_K_V, drain(replica));
    }

    @Test
    @DisplayName("偏移量在积压缓冲区内时部分同步并补发缺失字节")
    void testPartialResync() {
        manager.propagate(0, RespArray.command("SET", "k", "v"));
        long replicaOffset = manager.getMasterOffset();
        manager.propagate(0, RespArray.command("SET", "k", "v"));
        EmbeddedChannel replica = replicaChannel();

        assertTrue(manager.handlePsync(replica, manager.getReplicationId(), replicaOffset, 6380));

        assertEquals("+CONTINUE " + manager.getReplicationId() + "\r\n" + SET_K_V, drain(replica));
        verify(host, never()).generateSnapshot();
        assertTrue(manager.isReplica(replica));
    }

    @Test
    @DisplayName("复制ID不符或偏移量已被覆盖时退化为全量同步")
    void testPartialResyncRejected() {
        ReplicationManager small = new ReplicationManager(host, 16);
        small.propagate(0, RespArray.command("SET", "k", "v"));
        small.propagate(0, RespArray.command("SET", "k", "v"));

        assertFalse(small.handlePsync(replicaChannel(), small.getReplicationId(), 0, 1));
        assertFalse(small.handlePsync(replicaChannel(), "0000000000000000000000000000000000000000",
                small.getMasterOffset(), 1));
        verify(host, times(2)).generateSnapshot();
    }

    @Test
    @DisplayName("事务以MULTI/EXEC包裹传播")
    void testPropagateTransaction() {
        EmbeddedChannel replica = replicaChannel();
        manager.handlePsync(replica, "?", -1, 1);
        drain(replica);

        manager.propagateTransaction(Arrays.asList(
                new PropagatedCommand(0, RespArray.command("SET", "k", "v")),
                new PropagatedCommand(1, RespArray.command("SET", "k", "v"))));

        String expected = SELECT0 + "*1\r\n$5\r\nMULTI\r\n" + SET_K_V
                + "*2\r\n$6\r\nSELECT\r\n$1\r\n1\r\n" + SET_K_V + "*1\r\n$4\r\nEXEC\r\n";
        assertEquals(expected, drain(replica));
    }

    @Test
    @DisplayName("ACK更新从节点偏移量并通知监听器")
    void testAck() {
        List<Long> acks = new ArrayList<>();
        manager.setAckListener(acks::add);
        EmbeddedChannel first = replicaChannel();
        EmbeddedChannel second = replicaChannel();
        manager.handlePsync(first, "?", -1, 1);
        manager.handlePsync(second, "?", -1, 2);
        manager.propagate(0, RespArray.command("SET", "k", "v"));
        long target = manager.getMasterOffset();

        assertEquals(0, manager.countAcked(target));
        manager.handleAck(first, target);
        assertEquals(1, manager.countAcked(target));
        // 旧的ACK不会让偏移量回退
        manager.handleAck(first, 1);
        assertEquals(1, manager.countAcked(target));
        assertEquals(2, manager.countAcked(0));
        assertEquals(Arrays.asList(target, 1L), acks);

        manager.handleAck(replicaChannel(), target);
        assertEquals(2, acks.size());
    }

    @Test
    @DisplayName("GETACK只在有从节点时进入复制流")
    void testRequestAcks() {
        manager.requestAcks();
        assertEquals(0, manager.getMasterOffset());

        EmbeddedChannel replica = replicaChannel();
        manager.handlePsync(replica, "?", -1, 1);
        drain(replica);
        manager.requestAcks();
        assertEquals("*3\r\n$8\r\nREPLCONF\r\n$6\r\nGETACK\r\n$1\r\n*\r\n", drain(replica));
    }

    @Test
    @DisplayName("连接关闭后从节点被移除")
    void testReplicaRemovedOnClose() {
        EmbeddedChannel replica = replicaChannel();
        manager.handlePsync(replica, "?", -1, 1);
        assertEquals(1, manager.getReplicas().size());
        replica.close();
        assertTrue(manager.getReplicas().isEmpty());
        assertFalse(manager.isReplica(replica));
    }
}
