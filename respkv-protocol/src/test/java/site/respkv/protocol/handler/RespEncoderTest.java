package site.respkv.protocol.handler;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.Test;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespArray;
import site.respkv.protocol.RespInteger;
import site.respkv.protocol.SimpleString;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class RespEncoderTest {

    private static String encode(final Object msg) {
        EmbeddedChannel channel = new EmbeddedChannel(new RespEncoder());
        assertTrue(channel.writeOutbound(msg));
        ByteBuf out = channel.readOutbound();
        String result = out.toString(StandardCharsets.UTF_8);
        out.release();
        channel.finish();
        return result;
    }

    @Test
    public void testEncodeReplies() {
        assertEquals("+OK\r\n", encode(SimpleString.OK));
        assertEquals(":-3\r\n", encode(RespInteger.valueOf(-3)));
        assertEquals("$-1\r\n", encode(BulkString.NULL));
        assertEquals("$0\r\n\r\n", encode(BulkString.fromString("")));
        assertEquals("*-1\r\n", encode(RespArray.NULL));
        assertEquals("*2\r\n$1\r\na\r\n:7\r\n",
                encode(new RespArray(new Resp[]{BulkString.fromString("a"), RespInteger.valueOf(7)})));
    }

    @Test
    public void testRawBytesPassThrough() {
        assertEquals("$3\r\nabc", encode(Unpooled.copiedBuffer("$3\r\nabc", StandardCharsets.UTF_8)));
    }
}
