package site.respkv.protocol;

import io.netty.buffer.ByteBuf;

/**
 * RESP3 空值 "_\r\n"，仅在解码对端回复时出现。
 *
 * @since 1.0.0
 */
public final class RespNull extends Resp {
    public static final RespNull INSTANCE = new RespNull();

    private static final byte[] BYTES = "_\r\n".getBytes();

    private RespNull() {
    }

    @Override
    public void encode(final Resp resp, final ByteBuf byteBuf) {
        byteBuf.writeBytes(BYTES);
    }

    @Override
    public String toString() {
        return "(null)";
    }
}
