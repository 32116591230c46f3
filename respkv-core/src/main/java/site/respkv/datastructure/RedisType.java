package site.respkv.datastructure;

/**
 * 值的类型标签，TYPE 命令直接返回 {@link #getDisplayName()}。
 *
 * @since 1.0.0
 */
public enum RedisType {
    STRING("string"),
    LIST("list"),
    HASH("hash"),
    SET("set"),
    ZSET("zset");

    private final String displayName;

    RedisType(final String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
