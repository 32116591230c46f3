package site.respkv.rdb.crc;

/**
 * Redis兼容的CRC64校验和算法实现
 *
 * <p>Jones多项式的反射形式，初始值0，不做最终异或，
 * 与 Redis 的 crc64 结果一致（"123456789" 的校验和为 0xe9c6d914c4b8d9ca）。
 * 使用256项查找表，每个字节一次查表。
 *
 * <p>使用示例：
 * <pre>{@code
 * long crc = Crc64.INITIAL_CRC;
 * crc = Crc64.crc64(crc, data1, 0, data1.length);
 * crc = Crc64.crc64(crc, data2, 0, data2.length);
 * }</pre>
 *
 * @since 1.0.0
 */
public final class Crc64 {

    /** Jones多项式（反射形式） */
    private static final long POLY = 0x95ac9329ac4bc9b5L;

    /** 预计算的查找表 */
    private static final long[] TABLE = new long[256];

    /** CRC64计算的初始值 */
    public static final long INITIAL_CRC = 0L;

    static {
        for (int i = 0; i < 256; i++) {
            long crc = i;
            for (int j = 0; j < 8; j++) {
                if ((crc & 1) != 0) {
                    crc = (crc >>> 1) ^ POLY;
                } else {
                    crc >>>= 1;
                }
            }
            TABLE[i] = crc;
        }
    }

    private Crc64() {
        throw new UnsupportedOperationException("工具类不允许实例化");
    }

    /**
     * 增量计算CRC64
     *
     * @param crc 之前的CRC值，首次计算使用{@link #INITIAL_CRC}
     * @param data 数据
     * @param offset 起始偏移量
     * @param length 长度
     * @return 更新后的CRC64值
     * @throws IllegalArgumentException 如果参数无效
     */
    public static long crc64(long crc, final byte[] data, final int offset, final int length) {
        if (data == null) {
            throw new IllegalArgumentException("数据不能为null");
        }
        if (offset < 0 || length < 0 || offset + length > data.length) {
            throw new IllegalArgumentException("无效的偏移量或长度参数");
        }
        for (int i = offset; i < offset + length; i++) {
            crc = TABLE[(int) ((crc ^ data[i]) & 0xFF)] ^ (crc >>> 8);
        }
        return crc;
    }

    public static long crc64(final byte[] data) {
        return crc64(INITIAL_CRC, data, 0, data.length);
    }

    /**
     * 单字节更新
     */
    public static long update(final long crc, final int b) {
        return TABLE[(int) ((crc ^ b) & 0xFF)] ^ (crc >>> 8);
    }
}
