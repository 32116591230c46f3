package site.respkv.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;

/**
 * RESP3 布尔值 "#t\r\n" / "#f\r\n"。
 *
 * @since 1.0.0
 */
@Getter
public final class RespBoolean extends Resp {
    public static final RespBoolean TRUE = new RespBoolean(true);
    public static final RespBoolean FALSE = new RespBoolean(false);

    private final boolean value;

    private RespBoolean(final boolean value) {
        this.value = value;
    }

    @Override
    public void encode(final Resp resp, final ByteBuf byteBuf) {
        byteBuf.writeByte('#');
        byteBuf.writeByte(((RespBoolean) resp).value ? 't' : 'f');
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public String toString() {
        return value ? "#t" : "#f";
    }
}
