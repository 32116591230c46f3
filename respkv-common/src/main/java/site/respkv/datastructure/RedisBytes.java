package site.respkv.datastructure;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 二进制安全的不可变字节串，键、字段、成员以及命令参数都以它表示。
 *
 * <p>主要特性：
 * <ul>
 *   <li>哈希值预计算，适合作为 HashMap 的键
 *   <li>字符串表示延迟初始化并缓存
 *   <li>常用命令名与响应使用共享实例
 *   <li>{@link #wrapTrusted(byte[])} 提供零拷贝的内部构造路径
 * </ul>
 *
 * <p>线程安全性：本类不可变，可在连接之间共享。
 *
 * @since 1.0.0
 */
public final class RedisBytes implements Comparable<RedisBytes> {

    /** 字符串编码解码使用的字符集 */
    public static final Charset CHARSET = StandardCharsets.UTF_8;

    /** 自动缓存字符串表示的最大长度 */
    private static final int MAX_CACHED_STRING_SIZE = 128;

    /** 常用命令名缓存池 */
    private static final ConcurrentHashMap<String, RedisBytes> COMMAND_CACHE = new ConcurrentHashMap<>(64);

    /** 空字节串 */
    public static final RedisBytes EMPTY = new RedisBytes(new byte[0], true);

    public static final RedisBytes OK;
    public static final RedisBytes PONG;

    static {
        // 1. 初始化常用命令缓存池
        initializeCommonCommands();

        // 2. 初始化常用常量实例
        OK = fromString("OK");
        PONG = fromString("PONG");
    }

    /** 存储的字节数组（不可变） */
    private final byte[] bytes;

    /** 预计算的哈希值 */
    private final int hashCode;

    /** 延迟初始化的字符串值 */
    private volatile String stringValue;

    /**
     * 创建字节串实例，执行防御性拷贝。
     *
     * @param bytes 源字节数组，不能为null
     * @throws IllegalArgumentException 如果bytes为null
     */
    public RedisBytes(final byte[] bytes) {
        this(bytes, false);
    }

    private RedisBytes(final byte[] bytes, final boolean trusted) {
        if (bytes == null) {
            throw new IllegalArgumentException("字节数组不能为null");
        }
        this.bytes = trusted ? bytes : bytes.clone();
        this.hashCode = Arrays.hashCode(this.bytes);
    }

    /**
     * 零拷贝构造，调用者必须保证数组此后不再被修改。
     *
     * @param trustedBytes 受信任的字节数组
     * @return RedisBytes实例，输入为null时返回null
     */
    public static RedisBytes wrapTrusted(final byte[] trustedBytes) {
        if (trustedBytes == null) {
            return null;
        }
        return new RedisBytes(trustedBytes, true);
    }

    /**
     * 由字符串创建实例，命令名优先命中缓存池。
     *
     * @param str 源字符串
     * @return RedisBytes实例，输入为null时返回null
     */
    public static RedisBytes fromString(final String str) {
        if (str == null) {
            return null;
        }
        if (str.isEmpty()) {
            return EMPTY;
        }

        // 1. 仅全大写的命令名才命中缓存，避免改变参数的大小写
        final RedisBytes cached = COMMAND_CACHE.get(str);
        if (cached != null) {
            return cached;
        }

        // 2. 创建新实例并预设短字符串的字符串值
        final RedisBytes redisBytes = new RedisBytes(str.getBytes(CHARSET), true);
        if (str.length() <= MAX_CACHED_STRING_SIZE) {
            redisBytes.stringValue = str;
        }
        return redisBytes;
    }

    /**
     * 由 long 值创建十进制表示的字节串。
     *
     * @param value 整数值
     * @return RedisBytes实例
     */
    public static RedisBytes fromLong(final long value) {
        return fromString(Long.toString(value));
    }

    private static void initializeCommonCommands() {
        final String[] commands = {
                "GET", "SET", "DEL", "PING", "SELECT", "MULTI", "EXEC",
                "LPUSH", "RPUSH", "LPOP", "RPOP", "SREM", "PEXPIREAT",
                "REPLCONF", "ACK", "GETACK", "PSYNC"
        };
        for (final String cmd : commands) {
            final RedisBytes redisBytes = new RedisBytes(cmd.getBytes(CHARSET), true);
            redisBytes.stringValue = cmd;
            COMMAND_CACHE.put(cmd, redisBytes);
        }
    }

    /**
     * @return 字节数组的副本
     */
    public byte[] getBytes() {
        return bytes.clone();
    }

    /**
     * 获取底层数组的直接引用，调用者不得修改返回的数组。
     *
     * @return 底层字节数组
     */
    public byte[] getBytesUnsafe() {
        return bytes;
    }

    /**
     * @return UTF-8 解码后的字符串
     */
    public String getString() {
        String result = stringValue;
        if (result == null) {
            result = new String(bytes, CHARSET);
            stringValue = result;
        }
        return result;
    }

    /**
     * ASCII 范围内忽略大小写的比较，用于命令名和选项匹配。
     *
     * @param other 另一个字节串
     * @return 是否相等（忽略大小写）
     */
    public boolean equalsIgnoreCase(final RedisBytes other) {
        if (this == other) {
            return true;
        }
        if (other == null || bytes.length != other.bytes.length) {
            return false;
        }
        for (int i = 0; i < bytes.length; i++) {
            if (toLower(bytes[i]) != toLower(other.bytes[i])) {
                return false;
            }
        }
        return true;
    }

    /**
     * @param text ASCII 文本
     * @return 忽略大小写时是否与 text 相等
     */
    public boolean equalsIgnoreCase(final String text) {
        if (text == null || text.length() != bytes.length) {
            return false;
        }
        for (int i = 0; i < bytes.length; i++) {
            if (toLower(bytes[i]) != toLower((byte) text.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static byte toLower(final byte b) {
        return b >= 'A' && b <= 'Z' ? (byte) (b + 32) : b;
    }

    /**
     * @return ASCII 大写形式的字符串，用于命令查找
     */
    public String toUpperCaseString() {
        final byte[] upper = new byte[bytes.length];
        for (int i = 0; i < bytes.length; i++) {
            final byte b = bytes[i];
            upper[i] = b >= 'a' && b <= 'z' ? (byte) (b - 32) : b;
        }
        return new String(upper, CHARSET);
    }

    public int length() {
        return bytes.length;
    }

    public boolean isEmpty() {
        return bytes.length == 0;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final RedisBytes other = (RedisBytes) obj;
        return hashCode == other.hashCode && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return getString();
    }

    /**
     * 无符号字节的字典序比较，前缀相同时较短者在前。
     */
    @Override
    public int compareTo(final RedisBytes other) {
        if (this == other) {
            return 0;
        }
        final byte[] otherBytes = other.bytes;
        final int minLength = Math.min(bytes.length, otherBytes.length);
        for (int i = 0; i < minLength; i++) {
            final int a = bytes[i] & 0xFF;
            final int b = otherBytes[i] & 0xFF;
            if (a != b) {
                return a - b;
            }
        }
        return Integer.compare(bytes.length, otherBytes.length);
    }
}
