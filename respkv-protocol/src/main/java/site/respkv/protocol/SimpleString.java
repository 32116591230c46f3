package site.respkv.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * 简单字符串回复，如 "+OK\r\n"。
 *
 * <p>常用回复预先分配并通过 {@link #valueOf(String)} 复用。
 *
 * @since 1.0.0
 */
@Getter
public class SimpleString extends Resp {
    public static final SimpleString OK = new SimpleString("OK");
    public static final SimpleString PONG = new SimpleString("PONG");
    public static final SimpleString QUEUED = new SimpleString("QUEUED");

    private final String content;

    public SimpleString(final String content) {
        this.content = content;
    }

    /**
     * @param content 字符串内容
     * @return 常用内容返回共享实例，否则新建
     */
    public static SimpleString valueOf(final String content) {
        if ("OK".equals(content)) {
            return OK;
        } else if ("PONG".equals(content)) {
            return PONG;
        } else if ("QUEUED".equals(content)) {
            return QUEUED;
        }
        return new SimpleString(content);
    }

    @Override
    public void encode(final Resp resp, final ByteBuf byteBuf) {
        byteBuf.writeByte('+');
        byteBuf.writeBytes(((SimpleString) resp).content.getBytes(StandardCharsets.UTF_8));
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public String toString() {
        return "+" + content;
    }
}
