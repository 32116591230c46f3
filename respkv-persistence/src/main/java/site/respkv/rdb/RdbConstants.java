package site.respkv.rdb;

/**
 * RDB持久化相关常量定义
 *
 * <p>统一管理文件格式、操作码与数据类型标识。
 *
 * @since 1.0.0
 */
public final class RdbConstants {

    // ========== RDB文件相关常量 ==========

    /** 默认RDB文件名 */
    public static final String RDB_FILE_NAME = "dump.rdb";

    /** 文件头：魔数加版本号 */
    public static final String RDB_HEADER = "REDIS0011";

    /** RDB文件结束标记 */
    public static final byte RDB_OPCODE_EOF = (byte) 255;

    /** 数据库选择操作码 */
    public static final byte RDB_OPCODE_SELECTDB = (byte) 254;

    /** 毫秒级过期时间操作码，后跟8字节小端序时间戳 */
    public static final byte RDB_OPCODE_EXPIRETIME_MS = (byte) 252;

    // ========== 数据类型常量 ==========

    /** 字符串类型标识 */
    public static final byte STRING_TYPE = (byte) 0;

    /** 列表类型标识 */
    public static final byte LIST_TYPE = (byte) 1;

    /** 集合类型标识 */
    public static final byte SET_TYPE = (byte) 2;

    /** 有序集合类型标识 */
    public static final byte ZSET_TYPE = (byte) 3;

    /** 哈希表类型标识 */
    public static final byte HASH_TYPE = (byte) 4;

    // ========== 长度编码 ==========

    static final int LEN_6BIT = 0;
    static final int LEN_14BIT = 1;
    static final int LEN_32BIT = 2;

    /**
     * 私有构造函数，防止工具类被实例化
     */
    private RdbConstants() {
        throw new UnsupportedOperationException("常量类不允许实例化");
    }
}
