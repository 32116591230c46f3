package site.respkv.command;

import lombok.AccessLevel;
import lombok.Getter;
import site.respkv.command.impl.cluster.Psync;
import site.respkv.command.impl.cluster.Replconf;
import site.respkv.command.impl.cluster.Wait;
import site.respkv.command.impl.connection.Echo;
import site.respkv.command.impl.connection.Ping;
import site.respkv.command.impl.connection.Quit;
import site.respkv.command.impl.connection.Select;
import site.respkv.command.impl.hash.Hdel;
import site.respkv.command.impl.hash.Hexists;
import site.respkv.command.impl.hash.Hget;
import site.respkv.command.impl.hash.Hgetall;
import site.respkv.command.impl.hash.Hincrby;
import site.respkv.command.impl.hash.Hlen;
import site.respkv.command.impl.hash.Hmget;
import site.respkv.command.impl.hash.Hset;
import site.respkv.command.impl.key.Dbsize;
import site.respkv.command.impl.key.Del;
import site.respkv.command.impl.key.Exists;
import site.respkv.command.impl.key.Expire;
import site.respkv.command.impl.key.Flushall;
import site.respkv.command.impl.key.Flushdb;
import site.respkv.command.impl.key.Keys;
import site.respkv.command.impl.key.Persist;
import site.respkv.command.impl.key.Ttl;
import site.respkv.command.impl.key.Type;
import site.respkv.command.impl.list.BlockingPop;
import site.respkv.command.impl.list.Lindex;
import site.respkv.command.impl.list.Llen;
import site.respkv.command.impl.list.Lrange;
import site.respkv.command.impl.list.Pop;
import site.respkv.command.impl.list.Push;
import site.respkv.command.impl.rdb.Bgsave;
import site.respkv.command.impl.rdb.Save;
import site.respkv.command.impl.server.ConfigGet;
import site.respkv.command.impl.server.Info;
import site.respkv.command.impl.set.Sadd;
import site.respkv.command.impl.set.Scard;
import site.respkv.command.impl.set.SetAlgebra;
import site.respkv.command.impl.set.Sismember;
import site.respkv.command.impl.set.Smembers;
import site.respkv.command.impl.set.Spop;
import site.respkv.command.impl.set.Srem;
import site.respkv.command.impl.string.Append;
import site.respkv.command.impl.string.Get;
import site.respkv.command.impl.string.Incr;
import site.respkv.command.impl.string.Mget;
import site.respkv.command.impl.string.Mset;
import site.respkv.command.impl.string.Set;
import site.respkv.command.impl.string.Setnx;
import site.respkv.command.impl.string.Strlen;
import site.respkv.command.impl.transaction.Discard;
import site.respkv.command.impl.transaction.Exec;
import site.respkv.command.impl.transaction.Multi;
import site.respkv.command.impl.transaction.Unwatch;
import site.respkv.command.impl.transaction.Watch;
import site.respkv.command.impl.zset.Zadd;
import site.respkv.command.impl.zset.Zcard;
import site.respkv.command.impl.zset.Zincrby;
import site.respkv.command.impl.zset.Zrange;
import site.respkv.command.impl.zset.Zrangebyscore;
import site.respkv.command.impl.zset.Zrank;
import site.respkv.command.impl.zset.Zrem;
import site.respkv.command.impl.zset.Zscore;
import site.respkv.datastructure.RedisBytes;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;

import static site.respkv.command.CommandFlag.ADMIN;
import static site.respkv.command.CommandFlag.BLOCKING;
import static site.respkv.command.CommandFlag.GLOBAL;
import static site.respkv.command.CommandFlag.NO_MULTI;
import static site.respkv.command.CommandFlag.READONLY;
import static site.respkv.command.CommandFlag.WRITE;

/**
 * 命令表，定义了系统支持的所有命令。
 *
 * <p>每一项包含命令名、参数个数范围（包含命令名本身，-1表示不限）、
 * 键的位置（首个、末个、步长，末个为负数时从末尾倒数，首个为0表示没有键）、
 * 标志和实例工厂。键的位置决定调度器加哪些锁：
 * 写命令加独占锁，其余加共享锁，{@link CommandFlag#GLOBAL} 命令锁定全部分段。
 *
 * @since 1.0.0
 */
@Getter
public enum CommandType {
    // ========== 连接命令 ==========
    PING("PING", 1, 2, 0, 0, 0, Ping::new, READONLY),
    ECHO("ECHO", 2, 2, 0, 0, 0, Echo::new, READONLY),
    SELECT("SELECT", 2, 2, 0, 0, 0, Select::new, READONLY),
    QUIT("QUIT", 1, -1, 0, 0, 0, Quit::new, READONLY, NO_MULTI),

    // ========== 键命令 ==========
    DEL("DEL", 2, -1, 1, -1, 1, Del::new, WRITE),
    EXISTS("EXISTS", 2, -1, 1, -1, 1, Exists::new, READONLY),
    TYPE("TYPE", 2, 2, 1, 1, 1, Type::new, READONLY),
    EXPIRE("EXPIRE", 3, 3, 1, 1, 1, Expire::new, WRITE),
    PEXPIRE("PEXPIRE", 3, 3, 1, 1, 1, Expire::new, WRITE),
    EXPIREAT("EXPIREAT", 3, 3, 1, 1, 1, Expire::new, WRITE),
    PEXPIREAT("PEXPIREAT", 3, 3, 1, 1, 1, Expire::new, WRITE),
    PERSIST("PERSIST", 2, 2, 1, 1, 1, Persist::new, WRITE),
    TTL("TTL", 2, 2, 1, 1, 1, Ttl::new, READONLY),
    PTTL("PTTL", 2, 2, 1, 1, 1, Ttl::new, READONLY),
    KEYS("KEYS", 2, 2, 0, 0, 0, Keys::new, READONLY, GLOBAL),
    DBSIZE("DBSIZE", 1, 1, 0, 0, 0, Dbsize::new, READONLY, GLOBAL),
    FLUSHDB("FLUSHDB", 1, 2, 0, 0, 0, Flushdb::new, WRITE, GLOBAL),
    FLUSHALL("FLUSHALL", 1, 2, 0, 0, 0, Flushall::new, WRITE, GLOBAL),

    // ========== 字符串命令 ==========
    GET("GET", 2, 2, 1, 1, 1, Get::new, READONLY),
    SET("SET", 3, -1, 1, 1, 1, Set::new, WRITE),
    SETNX("SETNX", 3, 3, 1, 1, 1, Setnx::new, WRITE),
    MGET("MGET", 2, -1, 1, -1, 1, Mget::new, READONLY),
    MSET("MSET", 3, -1, 1, -1, 2, Mset::new, WRITE),
    INCR("INCR", 2, 2, 1, 1, 1, Incr::new, WRITE),
    DECR("DECR", 2, 2, 1, 1, 1, Incr::new, WRITE),
    INCRBY("INCRBY", 3, 3, 1, 1, 1, Incr::new, WRITE),
    DECRBY("DECRBY", 3, 3, 1, 1, 1, Incr::new, WRITE),
    APPEND("APPEND", 3, 3, 1, 1, 1, Append::new, WRITE),
    STRLEN("STRLEN", 2, 2, 1, 1, 1, Strlen::new, READONLY),

    // ========== 列表命令 ==========
    LPUSH("LPUSH", 3, -1, 1, 1, 1, Push::new, WRITE),
    RPUSH("RPUSH", 3, -1, 1, 1, 1, Push::new, WRITE),
    LPOP("LPOP", 2, 3, 1, 1, 1, Pop::new, WRITE),
    RPOP("RPOP", 2, 3, 1, 1, 1, Pop::new, WRITE),
    LRANGE("LRANGE", 4, 4, 1, 1, 1, Lrange::new, READONLY),
    LLEN("LLEN", 2, 2, 1, 1, 1, Llen::new, READONLY),
    LINDEX("LINDEX", 3, 3, 1, 1, 1, Lindex::new, READONLY),
    BLPOP("BLPOP", 3, -1, 1, -2, 1, BlockingPop::new, WRITE, BLOCKING),
    BRPOP("BRPOP", 3, -1, 1, -2, 1, BlockingPop::new, WRITE, BLOCKING),

    // ========== 哈希命令 ==========
    HSET("HSET", 4, -1, 1, 1, 1, Hset::new, WRITE),
    HGET("HGET", 3, 3, 1, 1, 1, Hget::new, READONLY),
    HMGET("HMGET", 3, -1, 1, 1, 1, Hmget::new, READONLY),
    HDEL("HDEL", 3, -1, 1, 1, 1, Hdel::new, WRITE),
    HGETALL("HGETALL", 2, 2, 1, 1, 1, Hgetall::new, READONLY),
    HEXISTS("HEXISTS", 3, 3, 1, 1, 1, Hexists::new, READONLY),
    HLEN("HLEN", 2, 2, 1, 1, 1, Hlen::new, READONLY),
    HINCRBY("HINCRBY", 4, 4, 1, 1, 1, Hincrby::new, WRITE),

    // ========== 集合命令 ==========
    SADD("SADD", 3, -1, 1, 1, 1, Sadd::new, WRITE),
    SREM("SREM", 3, -1, 1, 1, 1, Srem::new, WRITE),
    SMEMBERS("SMEMBERS", 2, 2, 1, 1, 1, Smembers::new, READONLY),
    SISMEMBER("SISMEMBER", 3, 3, 1, 1, 1, Sismember::new, READONLY),
    SCARD("SCARD", 2, 2, 1, 1, 1, Scard::new, READONLY),
    SPOP("SPOP", 2, 3, 1, 1, 1, Spop::new, WRITE),
    SUNION("SUNION", 2, -1, 1, -1, 1, SetAlgebra::new, READONLY),
    SINTER("SINTER", 2, -1, 1, -1, 1, SetAlgebra::new, READONLY),
    SDIFF("SDIFF", 2, -1, 1, -1, 1, SetAlgebra::new, READONLY),

    // ========== 有序集合命令 ==========
    ZADD("ZADD", 4, -1, 1, 1, 1, Zadd::new, WRITE),
    ZREM("ZREM", 3, -1, 1, 1, 1, Zrem::new, WRITE),
    ZSCORE("ZSCORE", 3, 3, 1, 1, 1, Zscore::new, READONLY),
    ZRANK("ZRANK", 3, 3, 1, 1, 1, Zrank::new, READONLY),
    ZCARD("ZCARD", 2, 2, 1, 1, 1, Zcard::new, READONLY),
    ZINCRBY("ZINCRBY", 4, 4, 1, 1, 1, Zincrby::new, WRITE),
    ZRANGE("ZRANGE", 4, 5, 1, 1, 1, Zrange::new, READONLY),
    ZRANGEBYSCORE("ZRANGEBYSCORE", 4, 5, 1, 1, 1, Zrangebyscore::new, READONLY),

    // ========== 事务命令 ==========
    MULTI("MULTI", 1, 1, 0, 0, 0, Multi::new, NO_MULTI),
    EXEC("EXEC", 1, 1, 0, 0, 0, Exec::new, NO_MULTI),
    DISCARD("DISCARD", 1, 1, 0, 0, 0, Discard::new, NO_MULTI),
    WATCH("WATCH", 2, -1, 1, -1, 1, Watch::new, READONLY, NO_MULTI),
    UNWATCH("UNWATCH", 1, 1, 0, 0, 0, Unwatch::new),

    // ========== 复制命令 ==========
    REPLCONF("REPLCONF", 1, -1, 0, 0, 0, Replconf::new, ADMIN, NO_MULTI),
    PSYNC("PSYNC", 3, 3, 0, 0, 0, Psync::new, ADMIN, NO_MULTI, GLOBAL),
    WAIT("WAIT", 3, 3, 0, 0, 0, Wait::new, BLOCKING),

    // ========== 持久化命令 ==========
    SAVE("SAVE", 1, 1, 0, 0, 0, Save::new, ADMIN, GLOBAL),
    BGSAVE("BGSAVE", 1, 2, 0, 0, 0, Bgsave::new, ADMIN, GLOBAL),

    // ========== 服务器命令 ==========
    CONFIG("CONFIG", 2, -1, 0, 0, 0, ConfigGet::new, ADMIN),
    INFO("INFO", 1, 2, 0, 0, 0, Info::new, READONLY);

    /** 命令查找缓存 */
    private static final Map<RedisBytes, CommandType> COMMAND_CACHE = new HashMap<>();

    static {
        for (final CommandType type : CommandType.values()) {
            COMMAND_CACHE.put(type.commandBytes, type);
        }
    }

    private final String commandName;

    private final RedisBytes commandBytes;

    private final int minArity;

    private final int maxArity;

    private final int firstKey;

    private final int lastKey;

    private final int keyStep;

    @Getter(AccessLevel.NONE)
    private final CommandFactory factory;

    @Getter(AccessLevel.NONE)
    private final EnumSet<CommandFlag> flags;

    CommandType(final String commandName, final int minArity, final int maxArity,
                final int firstKey, final int lastKey, final int keyStep,
                final CommandFactory factory, final CommandFlag... flags) {
        this.commandName = commandName;
        this.commandBytes = RedisBytes.fromString(commandName);
        this.minArity = minArity;
        this.maxArity = maxArity;
        this.firstKey = firstKey;
        this.lastKey = lastKey;
        this.keyStep = keyStep;
        this.factory = factory;
        this.flags = EnumSet.noneOf(CommandFlag.class);
        for (final CommandFlag flag : flags) {
            this.flags.add(flag);
        }
    }

    /**
     * 根据命令名查找命令类型，大小写不敏感
     *
     * @param commandBytes 命令名
     * @return 对应的CommandType，如果不存在则返回null
     */
    public static CommandType findByBytes(final RedisBytes commandBytes) {
        if (commandBytes == null) {
            return null;
        }
        // 1. 直接查找缓存
        final CommandType result = COMMAND_CACHE.get(commandBytes);
        if (result != null) {
            return result;
        }
        // 2. 转换为大写再查找
        return COMMAND_CACHE.get(RedisBytes.fromString(commandBytes.toUpperCaseString()));
    }

    public boolean hasFlag(final CommandFlag flag) {
        return flags.contains(flag);
    }

    public boolean isWrite() {
        return flags.contains(WRITE);
    }

    /**
     * @param argc 参数个数，包含命令名
     * @return 参数个数在允许范围内返回true
     */
    public boolean checkArity(final int argc) {
        return argc >= minArity && (maxArity < 0 || argc <= maxArity);
    }

    /**
     * 使用上下文创建命令实例
     *
     * @param context 服务器上下文
     * @param session 发起命令的会话
     * @return 命令实例
     */
    public Command createCommand(final RedisContext context, final ClientSession session) {
        return factory.create(this, context, session);
    }
}
