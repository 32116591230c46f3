package site.respkv.datastructure;

/**
 * Redis数据结构基础接口
 *
 * <p>每个键对应一个值，值携带类型标签、绝对过期时间和版本号。
 * 版本号由所属数据库的时钟在每次修改时写入，用于 WATCH 的乐观并发检查。
 *
 * <p>线程安全性：值本身不做同步，读写由键锁保护
 * （修改持有独占锁，读取持有共享锁）。
 *
 * @since 1.0.0
 */
public interface RedisData {

    /**
     * @return 值的类型标签
     */
    RedisType type();

    /**
     * 获取过期时间
     *
     * @return 绝对过期时间戳（毫秒），-1表示永不过期
     */
    long expireAt();

    /**
     * 设置过期时间
     *
     * @param expireAt 绝对过期时间戳（毫秒），-1表示永不过期
     */
    void setExpireAt(long expireAt);

    /**
     * @return 最近一次修改时写入的版本号
     */
    long version();

    void setVersion(long version);

    /**
     * 聚合类型没有元素时返回true，此时键应被删除。
     * 字符串总是返回false，空字符串也是合法的值。
     *
     * @return 是否为空
     */
    boolean isEmpty();

    /**
     * 判断在给定时刻是否已过期
     *
     * @param now 当前时间戳（毫秒）
     * @return 已过期返回true
     */
    default boolean isExpired(final long now) {
        final long at = expireAt();
        return at >= 0 && at <= now;
    }
}
