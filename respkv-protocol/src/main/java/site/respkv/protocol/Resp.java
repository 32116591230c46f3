package site.respkv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;

/**
 * RESP 协议帧的基类，提供解码入口和共享的编码工具。
 *
 * <p>支持解码的类型：
 * <ul>
 *     <li>简单字符串 - "+OK\r\n"</li>
 *     <li>错误消息 - "-ERR message\r\n"</li>
 *     <li>整数 - ":1000\r\n"</li>
 *     <li>批量字符串 - "$6\r\nfoobar\r\n"，"$-1\r\n" 为空值</li>
 *     <li>数组 - "*2\r\n...", "*-1\r\n" 为空值</li>
 *     <li>RESP3 空值 - "_\r\n"</li>
 *     <li>RESP3 布尔 - "#t\r\n" / "#f\r\n"</li>
 * </ul>
 *
 * <p>解码是可恢复的：数据不完整时返回 null 且不移动读索引，
 * 调用者等待更多字节后重试；格式错误时抛出 {@link ProtocolException}。
 *
 * @since 1.0.0
 */
@Slf4j
public abstract class Resp {
    /** 行结束符 */
    public static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);

    /** 数字的字节表示缓存 */
    protected static final byte[][] NUMBERS = new byte[512][];

    /** 最大缓存数字 */
    protected static final int MAX_CACHED_NUMBER = 255;

    static final int PROTO_MAX_BULK_LEN = 512 * 1024 * 1024;
    static final int PROTO_MAX_ARRAY_LEN = 1024 * 1024;

    static {
        for (int i = 0; i <= MAX_CACHED_NUMBER; i++) {
            NUMBERS[i] = String.valueOf(i).getBytes(StandardCharsets.US_ASCII);
        }
        for (int i = 1; i <= MAX_CACHED_NUMBER; i++) {
            NUMBERS[i + 256] = String.valueOf(-i).getBytes(StandardCharsets.US_ASCII);
        }
    }

    /**
     * 写入整数的十进制表示，常用数字走缓存。
     *
     * @param buf 目标缓冲区
     * @param value 要写入的整数值
     */
    protected static void writeIntegerAsBytes(final ByteBuf buf, final long value) {
        if (value >= 0 && value <= MAX_CACHED_NUMBER) {
            buf.writeBytes(NUMBERS[(int) value]);
        } else if (value < 0 && value >= -MAX_CACHED_NUMBER) {
            buf.writeBytes(NUMBERS[(int) -value + 256]);
        } else {
            buf.writeBytes(Long.toString(value).getBytes(StandardCharsets.US_ASCII));
        }
    }

    /**
     * 解码一个完整的 RESP 帧。
     *
     * @param buffer 输入缓冲区
     * @return 解码结果，数据不完整时返回null且读索引不变
     * @throws ProtocolException 当数据不符合RESP格式时
     */
    public static Resp decode(final ByteBuf buffer) {
        if (buffer.readableBytes() <= 0) {
            return null;
        }
        final int initialIndex = buffer.readerIndex();
        try {
            return decodeFrame(buffer);
        } catch (IllegalStateException e) {
            // 数据不完整，回滚读索引等待更多数据
            buffer.readerIndex(initialIndex);
            return null;
        } catch (ProtocolException e) {
            buffer.readerIndex(initialIndex);
            throw e;
        }
    }

    private static Resp decodeFrame(final ByteBuf buffer) {
        final byte typeIndicator = buffer.readByte();
        switch (typeIndicator) {
            case '+':
                return SimpleString.valueOf(getString(buffer));
            case '-':
                return new Errors(getString(buffer));
            case ':':
                return RespInteger.valueOf(getNumber(buffer));
            case '_':
                getString(buffer);
                return RespNull.INSTANCE;
            case '#':
                return decodeBoolean(getString(buffer));
            case '$':
                return decodeBulk(buffer);
            case '*':
                return decodeArray(buffer);
            default:
                log.warn("无法识别的RESP类型标识: 字节值 {}", typeIndicator & 0xFF);
                throw new ProtocolException("expected '$', got '" + (char) typeIndicator + "'");
        }
    }

    private static Resp decodeBoolean(final String value) {
        if ("t".equals(value)) {
            return RespBoolean.TRUE;
        }
        if ("f".equals(value)) {
            return RespBoolean.FALSE;
        }
        throw new ProtocolException("invalid boolean '" + value + "'");
    }

    private static Resp decodeBulk(final ByteBuf buffer) {
        // 1. 读取长度前缀
        final long length = getNumber(buffer);
        if (length == -1) {
            return BulkString.NULL;
        }
        if (length < 0 || length > PROTO_MAX_BULK_LEN) {
            throw new ProtocolException("invalid bulk length");
        }

        // 2. 内容加CRLF必须全部到达
        if (buffer.readableBytes() < length + 2) {
            throw new IllegalStateException("数据不完整：BulkString内容长度不足");
        }
        final byte[] content = new byte[(int) length];
        buffer.readBytes(content);

        // 3. 校验结尾的CRLF
        if (buffer.readByte() != '\r' || buffer.readByte() != '\n') {
            throw new ProtocolException("bulk string not terminated by CRLF");
        }
        return BulkString.wrapTrusted(content);
    }

    private static Resp decodeArray(final ByteBuf buffer) {
        final long number = getNumber(buffer);
        if (number > PROTO_MAX_ARRAY_LEN) {
            throw new ProtocolException("invalid multibulk length");
        }
        if (number < 0) {
            return RespArray.NULL;
        }
        if (number == 0) {
            return RespArray.EMPTY;
        }
        final Resp[] array = new Resp[(int) number];
        for (int i = 0; i < number; i++) {
            if (buffer.readableBytes() <= 0) {
                throw new IllegalStateException("数组元素数据不完整");
            }
            array[i] = decodeFrame(buffer);
        }
        return new RespArray(array);
    }

    /**
     * 将帧编码到缓冲区。
     *
     * @param resp 响应对象
     * @param byteBuf 输出缓冲区
     */
    public abstract void encode(Resp resp, ByteBuf byteBuf);

    /**
     * 编码为独立的字节数组，用于复制流和积压缓冲区。
     *
     * @return 编码后的字节
     */
    public byte[] toBytes() {
        final ByteBuf buf = Unpooled.buffer();
        try {
            encode(this, buf);
            final byte[] bytes = new byte[buf.readableBytes()];
            buf.readBytes(bytes);
            return bytes;
        } finally {
            buf.release();
        }
    }

    /**
     * 读取一行直到 \r\n，用于简单字符串和错误。
     *
     * @throws IllegalStateException 如果数据不完整
     */
    static String getString(final ByteBuf buffer) {
        final int startIndex = buffer.readerIndex();
        final int endIndex = buffer.indexOf(startIndex, buffer.writerIndex(), (byte) '\r');
        if (endIndex < 0 || endIndex + 1 >= buffer.writerIndex()) {
            throw new IllegalStateException("数据不完整：没有找到换行符");
        }
        final int length = endIndex - startIndex;
        final byte[] bytes = new byte[length];
        buffer.getBytes(startIndex, bytes);
        buffer.readerIndex(endIndex);
        if (buffer.readByte() != '\r' || buffer.readByte() != '\n') {
            throw new ProtocolException("line not terminated by CRLF");
        }
        return new String(bytes, StandardCharsets.UTF_8);
    }

    /**
     * 读取一行十进制整数直到 \r\n，用于整数类型和长度前缀。
     *
     * @throws IllegalStateException 如果数据不完整
     * @throws ProtocolException 如果包含非数字字符
     */
    static long getNumber(final ByteBuf buffer) {
        // 1. 查找CRLF位置
        final int startIndex = buffer.readerIndex();
        final int endIndex = buffer.indexOf(startIndex, buffer.writerIndex(), (byte) '\r');
        if (endIndex < 0 || endIndex + 1 >= buffer.writerIndex()) {
            throw new IllegalStateException("数据不完整：没有找到换行符");
        }

        // 2. 逐字节解析，允许一个前导负号
        final int length = endIndex - startIndex;
        if (length == 0 || length > 20) {
            throw new ProtocolException("invalid length");
        }
        boolean negative = false;
        int i = startIndex;
        if (buffer.getByte(i) == '-') {
            if (length == 1) {
                throw new ProtocolException("invalid length");
            }
            negative = true;
            i++;
        }
        long value = 0;
        for (; i < endIndex; i++) {
            final byte b = buffer.getByte(i);
            if (b < '0' || b > '9') {
                throw new ProtocolException("invalid length");
            }
            try {
                value = Math.addExact(Math.multiplyExact(value, 10L), b - '0');
            } catch (ArithmeticException e) {
                throw new ProtocolException("invalid length");
            }
        }

        // 3. 更新读指针并验证CRLF
        buffer.readerIndex(endIndex);
        if (buffer.readByte() != '\r' || buffer.readByte() != '\n') {
            throw new ProtocolException("line not terminated by CRLF");
        }
        return negative ? -value : value;
    }
}
