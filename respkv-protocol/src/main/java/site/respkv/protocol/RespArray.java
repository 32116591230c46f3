package site.respkv.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;
import site.respkv.datastructure.RedisBytes;

import java.util.Arrays;
import java.util.List;

/**
 * 数组帧。客户端请求总是由批量字符串组成的数组，
 * 回复中的数组可以嵌套任意类型。
 *
 * <p>预定义实例：EMPTY 对应 "*0\r\n"，NULL 对应 "*-1\r\n"。
 *
 * @since 1.0.0
 */
@Getter
public class RespArray extends Resp {
    private static final byte[] NULL_ARRAY_BYTES = "*-1\r\n".getBytes();
    private static final byte[] EMPTY_ARRAY_BYTES = "*0\r\n".getBytes();

    public static final RespArray EMPTY = new RespArray(new Resp[0]);
    public static final RespArray NULL = new RespArray((Resp[]) null);

    private final Resp[] content;

    public RespArray(final Resp[] content) {
        this.content = content;
    }

    public static RespArray valueOf(final Resp[] content) {
        if (content == null) {
            return NULL;
        }
        if (content.length == 0) {
            return EMPTY;
        }
        return new RespArray(content);
    }

    public static RespArray valueOf(final List<? extends Resp> content) {
        return valueOf(content.toArray(new Resp[0]));
    }

    /**
     * 由字符串参数构造命令数组。
     *
     * @param parts 命令名与参数
     * @return 命令帧
     */
    public static RespArray command(final String... parts) {
        final Resp[] array = new Resp[parts.length];
        for (int i = 0; i < parts.length; i++) {
            array[i] = BulkString.fromString(parts[i]);
        }
        return new RespArray(array);
    }

    public static RespArray command(final List<RedisBytes> parts) {
        final Resp[] array = new Resp[parts.size()];
        for (int i = 0; i < array.length; i++) {
            array[i] = new BulkString(parts.get(i));
        }
        return new RespArray(array);
    }

    public boolean isNull() {
        return content == null;
    }

    public int size() {
        return content == null ? 0 : content.length;
    }

    @Override
    public void encode(final Resp resp, final ByteBuf byteBuf) {
        final Resp[] arrayContent = ((RespArray) resp).content;
        // 1. 处理null与空数组
        if (arrayContent == null) {
            byteBuf.writeBytes(NULL_ARRAY_BYTES);
            return;
        }
        if (arrayContent.length == 0) {
            byteBuf.writeBytes(EMPTY_ARRAY_BYTES);
            return;
        }
        // 2. 写入长度头
        byteBuf.writeByte('*');
        writeIntegerAsBytes(byteBuf, arrayContent.length);
        byteBuf.writeBytes(CRLF);
        // 3. 编码所有元素
        for (final Resp element : arrayContent) {
            element.encode(element, byteBuf);
        }
    }

    @Override
    public boolean equals(final Object obj) {
        return obj instanceof RespArray && Arrays.equals(content, ((RespArray) obj).content);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return content == null ? "(nil)" : Arrays.toString(content);
    }
}
