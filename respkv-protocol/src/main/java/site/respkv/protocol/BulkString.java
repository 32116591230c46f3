package site.respkv.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;
import site.respkv.datastructure.RedisBytes;

/**
 * 批量字符串，二进制安全，content 为 null 时编码为 "$-1\r\n"。
 *
 * <p>使用建议：
 * <ul>
 *     <li>外部传入的数组使用 {@link #create(byte[])}，会复制内容</li>
 *     <li>解码器等受信任路径使用 {@link #wrapTrusted(byte[])}</li>
 * </ul>
 *
 * @since 1.0.0
 */
@Getter
public class BulkString extends Resp {
    public static final byte[] NULL_BYTES = "$-1\r\n".getBytes();
    public static final byte[] EMPTY_BULK = "$0\r\n\r\n".getBytes();

    /** 空值回复 */
    public static final BulkString NULL = new BulkString((RedisBytes) null);

    private final RedisBytes content;

    public BulkString(final RedisBytes content) {
        this.content = content;
    }

    public static BulkString create(final byte[] content) {
        return content == null ? NULL : new BulkString(new RedisBytes(content));
    }

    public static BulkString create(final RedisBytes content) {
        return content == null ? NULL : new BulkString(content);
    }

    public static BulkString wrapTrusted(final byte[] trustedBytes) {
        return trustedBytes == null ? NULL : new BulkString(RedisBytes.wrapTrusted(trustedBytes));
    }

    public static BulkString fromString(final String str) {
        return str == null ? NULL : new BulkString(RedisBytes.fromString(str));
    }

    public static BulkString fromLong(final long value) {
        return new BulkString(RedisBytes.fromLong(value));
    }

    public boolean isNull() {
        return content == null;
    }

    @Override
    public void encode(final Resp resp, final ByteBuf byteBuf) {
        final RedisBytes value = ((BulkString) resp).content;
        if (value == null) {
            byteBuf.writeBytes(NULL_BYTES);
            return;
        }
        final byte[] bytes = value.getBytesUnsafe();
        if (bytes.length == 0) {
            byteBuf.writeBytes(EMPTY_BULK);
            return;
        }
        // 1. 预留容量：'$' + 长度 + CRLF + 内容 + CRLF
        byteBuf.ensureWritable(bytes.length + 16);
        byteBuf.writeByte('$');
        writeIntegerAsBytes(byteBuf, bytes.length);
        byteBuf.writeBytes(CRLF);
        // 2. 写入内容与结束分隔符
        byteBuf.writeBytes(bytes);
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof BulkString)) {
            return false;
        }
        final RedisBytes other = ((BulkString) obj).content;
        return content == null ? other == null : content.equals(other);
    }

    @Override
    public int hashCode() {
        return content == null ? 0 : content.hashCode();
    }

    @Override
    public String toString() {
        return content != null ? content.getString() : null;
    }
}
