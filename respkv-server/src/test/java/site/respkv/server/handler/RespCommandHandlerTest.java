package site.respkv.server.handler;

import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import site.respkv.protocol.Errors;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespArray;
import site.respkv.protocol.RespInteger;
import site.respkv.protocol.SimpleString;
import site.respkv.server.dispatch.DispatcherTestSupport;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RespCommandHandler 单元测试")
class RespCommandHandlerTest extends DispatcherTestSupport {

    private RespCommandHandler handler;

    private EmbeddedChannel channel;

    @BeforeEach
    void setUpChannel() {
        handler = new RespCommandHandler(context, dispatcher);
        channel = new EmbeddedChannel(handler);
    }

    @AfterEach
    void tearDownChannel() {
        channel.finishAndReleaseAll();
    }

    @Test
    @DisplayName("PING 返回 PONG")
    void testPing() {
        channel.writeInbound(RespArray.command("PING"));
        final Object reply = channel.readOutbound();
        assertTrue(reply instanceof SimpleString);
        assertEquals("PONG", ((SimpleString) reply).getContent());
    }

    @Test
    @DisplayName("每个连接有独立的会话")
    void testSessionPerChannel() {
        final EmbeddedChannel second = new EmbeddedChannel(new RespCommandHandler(context, dispatcher));
        channel.writeInbound(RespArray.command("SELECT", "1"));
        channel.readOutbound();
        assertEquals(1, handler.getSession().getDbIndex());

        second.writeInbound(RespArray.command("SET", "k", "v"));
        second.readOutbound();
        channel.writeInbound(RespArray.command("EXISTS", "k"));
        assertEquals(RespInteger.ZERO, channel.readOutbound());
        second.finishAndReleaseAll();
    }

    @Test
    @DisplayName("非数组请求返回协议错误")
    void testNotAnArray() {
        channel.writeInbound(new SimpleString("PING"));
        final Object reply = channel.readOutbound();
        assertTrue(reply instanceof Errors);
        assertTrue(((Errors) reply).getContent().startsWith("ERR Protocol error"));
    }

    @Test
    @DisplayName("QUIT 回复 OK 后关闭连接")
    void testQuit() {
        channel.writeInbound(RespArray.command("QUIT"));
        channel.runPendingTasks();
        final Object reply = channel.readOutbound();
        assertEquals("OK", ((SimpleString) reply).getContent());
        assertFalse(channel.isOpen());
    }

    @Test
    @DisplayName("阻塞期间的请求在唤醒后按顺序处理")
    void testPipelineWhileBlocked() {
        channel.writeInbound(RespArray.command("BLPOP", "q", "0"));
        channel.writeInbound(RespArray.command("PING"));
        assertNull(channel.readOutbound());
        assertTrue(handler.getSession().isBlocked());
        assertEquals(1, handler.getSession().getPendingInput().size());

        // 另一个客户端推入元素，唤醒回调投递到连接的事件循环
        call("RPUSH", "q", "v");
        channel.runPendingTasks();

        assertArray((Resp) channel.readOutbound(), "q", "v");
        final Object pong = channel.readOutbound();
        assertEquals("PONG", ((SimpleString) pong).getContent());
        assertFalse(handler.getSession().isBlocked());
    }

    @Test
    @DisplayName("连接关闭时取消等待并清理事务状态")
    void testCloseCancelsWaiter() {
        channel.writeInbound(RespArray.command("BLPOP", "q", "0"));
        assertEquals(1, coordinator.getBlockedCount());
        channel.close();
        channel.runPendingTasks();
        assertEquals(0, coordinator.getBlockedCount());

        // 推入的元素不会丢
        call("RPUSH", "q", "v");
        assertInt(1, call("LLEN", "q"));
    }
}
