package site.respkv.protocol;

/**
 * 错误回复的类别前缀，客户端据此区分错误种类。
 *
 * @since 1.0.0
 */
public enum ErrorKind {
    /** 通用错误：未知命令、参数错误、语法错误等 */
    ERR,
    /** 键持有的值类型与命令不符 */
    WRONGTYPE,
    /** 事务因排队阶段的错误被放弃 */
    EXECABORT,
    /** 只读从节点拒绝写命令 */
    READONLY,
    /** 没有足够的从节点 */
    NOREPLICAS;

    /**
     * 按名称解析错误类别，未知名称返回null。
     *
     * @param name 错误前缀
     * @return 对应的类别
     */
    public static ErrorKind parse(final String name) {
        for (final ErrorKind kind : values()) {
            if (kind.name().equals(name)) {
                return kind;
            }
        }
        return null;
    }
}
