package site.respkv.datastructure;

/**
 * 过期时间和版本号的公共实现。
 *
 * @since 1.0.0
 */
public abstract class AbstractRedisData implements RedisData {

    /** 数据过期时间，-1表示永不过期 */
    private volatile long expireAt = -1;

    private volatile long version;

    @Override
    public long expireAt() {
        return expireAt;
    }

    @Override
    public void setExpireAt(final long expireAt) {
        this.expireAt = expireAt;
    }

    @Override
    public long version() {
        return version;
    }

    @Override
    public void setVersion(final long version) {
        this.version = version;
    }
}
