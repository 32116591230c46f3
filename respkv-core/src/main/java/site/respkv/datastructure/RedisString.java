package site.respkv.datastructure;

import lombok.Getter;
import lombok.Setter;

/**
 * Redis字符串数据结构实现
 *
 * <p>二进制安全，同时承载 INCR 系列的整数语义：
 * 只有十进制表示的64位有符号整数才能参与自增。
 *
 * @since 1.0.0
 */
@Getter
@Setter
public class RedisString extends AbstractRedisData {

    /** 字符串内容 */
    private RedisBytes value;

    public RedisString(final RedisBytes value) {
        this.value = value;
    }

    @Override
    public RedisType type() {
        return RedisType.STRING;
    }

    @Override
    public boolean isEmpty() {
        return false;
    }

    /**
     * 以整数解释当前值并加上增量
     *
     * @param delta 增量
     * @return 新值
     * @throws NumberFormatException 当前值不是整数
     * @throws ArithmeticException 结果溢出
     */
    public long incrBy(final long delta) {
        final long current = parseStrictLong(value);
        final long next = Math.addExact(current, delta);
        this.value = RedisBytes.fromLong(next);
        return next;
    }

    /**
     * 追加内容
     *
     * @param suffix 追加的字节
     * @return 追加后的长度
     */
    public int append(final RedisBytes suffix) {
        final byte[] current = value.getBytesUnsafe();
        final byte[] tail = suffix.getBytesUnsafe();
        final byte[] merged = new byte[current.length + tail.length];
        System.arraycopy(current, 0, merged, 0, current.length);
        System.arraycopy(tail, 0, merged, current.length, tail.length);
        this.value = RedisBytes.wrapTrusted(merged);
        return merged.length;
    }

    public int length() {
        return value.length();
    }

    /**
     * 严格解析十进制整数：不允许空白、前导加号和前导零。
     *
     * @param bytes 输入
     * @return 解析结果
     * @throws NumberFormatException 格式不合法或超出范围
     */
    public static long parseStrictLong(final RedisBytes bytes) {
        final byte[] raw = bytes.getBytesUnsafe();
        if (raw.length == 0 || raw.length > 20) {
            throw new NumberFormatException("not an integer");
        }
        final int first = raw[0] == '-' ? 1 : 0;
        if (first == raw.length || (raw[first] == '0' && raw.length > first + 1)
                || (first == 1 && raw[1] == '0')) {
            throw new NumberFormatException("not an integer");
        }
        for (int i = first; i < raw.length; i++) {
            if (raw[i] < '0' || raw[i] > '9') {
                throw new NumberFormatException("not an integer");
            }
        }
        return Long.parseLong(bytes.getString());
    }
}
