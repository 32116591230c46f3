package site.respkv.server.dispatch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import site.respkv.cluster.replication.ReplBackLog;
import site.respkv.cluster.replication.ReplicaClient;
import site.respkv.core.RedisCoreImpl;
import site.respkv.datastructure.RedisBytes;
import site.respkv.datastructure.RedisString;
import site.respkv.datastructure.RedisType;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespArray;
import site.respkv.protocol.RespInteger;
import site.respkv.rdb.RdbManager;
import site.respkv.server.session.ClientSession;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

@DisplayName("命令调度器单元测试")
class CommandDispatcherTest extends DispatcherTestSupport {

    @Test
    @DisplayName("基本字符串读写")
    void testSetAndGet() {
        assertOk(call("SET", "k", "v"));
        assertBulk("v", call("GET", "k"));
        assertBulk(null, call("GET", "missing"));
        assertInt(1, call("STRLEN", "k"));
        assertInt(3, call("APPEND", "k", "ab"));
        assertBulk("vab", call("get", "k"));
    }

    @Test
    @DisplayName("SET 的 NX/XX/GET 选项")
    void testSetOptions() {
        assertBulk(null, call("SET", "k", "v1", "XX"));
        assertOk(call("SET", "k", "v1", "NX"));
        assertBulk(null, call("SET", "k", "v2", "NX"));
        assertBulk("v1", call("SET", "k", "v3", "GET"));
        assertBulk("v3", call("GET", "k"));
        assertError("ERR syntax error", call("SET", "k", "v", "NX", "XX"));
        assertError("ERR invalid expire time", call("SET", "k", "v", "EX", "0"));
    }

    @Test
    @DisplayName("INCR 系列的整数校验与溢出")
    void testIncr() {
        assertInt(1, call("INCR", "n"));
        assertInt(11, call("INCRBY", "n", "10"));
        assertInt(10, call("DECR", "n"));
        assertOk(call("SET", "s", "abc"));
        assertError("ERR value is not an integer or out of range", call("INCR", "s"));
        assertOk(call("SET", "max", String.valueOf(Long.MAX_VALUE)));
        assertError("ERR increment or decrement would overflow", call("INCR", "max"));
    }

    @Test
    @DisplayName("未知命令和参数个数错误")
    void testUnknownAndArity() {
        assertError("ERR unknown command 'foo'", call("FOO", "bar"));
        assertError("ERR wrong number of arguments for 'get' command", call("GET"));
        assertError("ERR wrong number of arguments for 'mset' command", call("MSET", "a", "1", "b"));
    }

    @Test
    @DisplayName("对错误类型的键操作返回 WRONGTYPE")
    void testWrongType() {
        assertInt(1, call("LPUSH", "list", "a"));
        assertError("WRONGTYPE", call("GET", "list"));
        assertError("WRONGTYPE", call("SADD", "list", "x"));
        assertSimple("list", call("TYPE", "list"));
    }

    @Test
    @DisplayName("非批量字符串的请求元素是协议错误")
    void testNonBulkPart() {
        final Resp reply = dispatcher.dispatch(session, RespArray.valueOf(new Resp[]{RespInteger.ONE}));
        assertError("ERR Protocol error", reply);
        assertError("ERR empty command", dispatcher.dispatch(session, RespArray.EMPTY));
    }

    @Test
    @DisplayName("SELECT 切换数据库后键相互隔离")
    void testSelect() {
        assertOk(call("SET", "k", "db0"));
        assertOk(call("SELECT", "3"));
        assertEquals(3, session.getDbIndex());
        assertBulk(null, call("GET", "k"));
        assertOk(call("SET", "k", "db3"));
        assertError("ERR DB index is out of range", call("SELECT", "16"));
        assertOk(call("SELECT", "0"));
        assertBulk("db0", call("GET", "k"));
        verify(manager).propagate(3, RespArray.command("SET", "k", "db3"));
    }

    @Test
    @DisplayName("列表、哈希、集合、有序集合的基本操作")
    void testCollections() {
        assertInt(3, call("RPUSH", "l", "a", "b", "c"));
        assertArray(call("LRANGE", "l", "0", "-1"), "a", "b", "c");
        assertBulk("c", call("LINDEX", "l", "-1"));
        assertBulk("a", call("LPOP", "l"));
        assertInt(2, call("LLEN", "l"));

        assertInt(2, call("HSET", "h", "f1", "1", "f2", "2"));
        assertBulk("1", call("HGET", "h", "f1"));
        assertInt(12, call("HINCRBY", "h", "f2", "10"));
        assertInt(1, call("HDEL", "h", "f1", "nope"));
        assertArray(call("HGETALL", "h"), "f2", "12");

        assertInt(2, call("SADD", "s1", "a", "b"));
        assertInt(2, call("SADD", "s2", "b", "c"));
        assertArray(call("SINTER", "s1", "s2"), "b");
        assertInt(1, call("SISMEMBER", "s1", "a"));
        assertInt(2, call("SCARD", "s2"));

        assertInt(3, call("ZADD", "z", "1", "a", "2", "b", "3", "c"));
        assertArray(call("ZRANGE", "z", "0", "1"), "a", "b");
        assertArray(call("ZRANGEBYSCORE", "z", "(1", "3", "WITHSCORES"), "b", "2", "c", "3");
        assertInt(2, call("ZRANK", "z", "c"));
        assertBulk("4.5", call("ZINCRBY", "z", "2.5", "b"));
        assertBulk("4.5", call("ZSCORE", "z", "b"));
    }

    @Test
    @DisplayName("最后一个元素被删除后键随之消失")
    void testEmptyContainerRemoved() {
        call("RPUSH", "l", "a");
        call("RPOP", "l");
        assertInt(0, call("EXISTS", "l"));
        call("SADD", "s", "a");
        call("SREM", "s", "a");
        assertSimple("none", call("TYPE", "s"));
        assertInt(0, call("DBSIZE"));
    }

    @Test
    @DisplayName("过期时间：TTL、PERSIST 与过期后不可见")
    void testExpire() throws InterruptedException {
        call("SET", "k", "v");
        assertInt(-1, call("TTL", "k"));
        assertInt(-2, call("TTL", "missing"));
        assertInt(1, call("EXPIRE", "k", "100"));
        assertInt(100, call("TTL", "k"));
        assertInt(1, call("PERSIST", "k"));
        assertInt(-1, call("TTL", "k"));
        assertOk(call("SET", "short", "v", "PX", "30"));
        Thread.sleep(80);
        assertBulk(null, call("GET", "short"));
        assertInt(0, call("EXPIRE", "missing", "10"));
    }

    @Test
    @DisplayName("相对过期时间被改写为绝对时间传播")
    void testExpirePropagatedAsAbsolute() {
        call("SET", "k", "v");
        final long before = System.currentTimeMillis();
        call("EXPIRE", "k", "100");

        final ArgumentCaptor<RespArray> captor = ArgumentCaptor.forClass(RespArray.class);
        verify(manager, times(2)).propagate(eq(0), captor.capture());
        final Resp[] parts = captor.getAllValues().get(1).getContent();
        assertEquals(BulkString.fromString("PEXPIREAT"), parts[0]);
        final long at = Long.parseLong(((BulkString) parts[2]).getContent().getString());
        assertTrue(at >= before + 100_000 && at <= System.currentTimeMillis() + 100_000);
    }

    @Test
    @DisplayName("带 EX 的 SET 以 PXAT 传播")
    void testSetExPropagatedWithPxat() {
        call("SET", "k", "v", "EX", "10");
        final ArgumentCaptor<RespArray> captor = ArgumentCaptor.forClass(RespArray.class);
        verify(manager).propagate(eq(0), captor.capture());
        final Resp[] parts = captor.getValue().getContent();
        assertEquals(5, parts.length);
        assertEquals(BulkString.fromString("PXAT"), parts[3]);
    }

    @Test
    @DisplayName("未生效的写命令不传播")
    void testNoOpNotPropagated() {
        assertInt(0, call("DEL", "missing"));
        assertBulk(null, call("SET", "k", "v", "XX"));
        assertInt(0, call("SREM", "s", "a"));
        assertBulk(null, call("GET", "k"));
        verify(manager, never()).propagate(anyInt(), any());
    }

    @Test
    @DisplayName("DEL 只传播真正删除的键")
    void testDelPropagatesDeletedKeysOnly() {
        call("SET", "a", "1");
        assertInt(1, call("DEL", "a", "b"));
        verify(manager).propagate(0, RespArray.command("DEL", "a"));
    }

    @Test
    @DisplayName("SETNX 以 SET、SPOP 以 SREM 传播")
    void testRewrittenPropagation() {
        assertInt(1, call("SETNX", "k", "v"));
        assertInt(0, call("SETNX", "k", "v2"));
        call("SADD", "s", "only");
        assertBulk("only", call("SPOP", "s"));

        verify(manager).propagate(0, RespArray.command("SET", "k", "v"));
        verify(manager).propagate(0, RespArray.command("SREM", "s", "only"));
        verify(manager, never()).propagate(0, RespArray.command("SPOP", "s"));
    }

    @Test
    @DisplayName("从节点拒绝普通客户端写入，主节点链路可以写")
    void testReadonlyReplica() {
        context.becomeReplica(mock(ReplicaClient.class));
        assertError("READONLY", call("SET", "k", "v"));
        assertBulk(null, call("GET", "k"));

        final ClientSession master = new ClientSession();
        master.setMasterLink(true);
        assertOk(call(master, "SET", "k", "v"));
        assertBulk("v", call("GET", "k"));
    }

    @Test
    @DisplayName("FLUSHALL 清空所有数据库")
    void testFlushAll() {
        call("SET", "a", "1");
        call("SELECT", "1");
        call("SET", "b", "1");
        assertOk(call("FLUSHALL"));
        assertInt(0, call("DBSIZE"));
        call("SELECT", "0");
        assertInt(0, call("DBSIZE"));
    }

    @Test
    @DisplayName("KEYS 按glob模式匹配")
    void testKeys() {
        call("MSET", "user:1", "a", "user:2", "b", "other", "c");
        final Resp reply = call("KEYS", "user:*");
        assertTrue(reply instanceof RespArray);
        assertEquals(2, ((RespArray) reply).getContent().length);
        assertArray(call("MGET", "user:1", "nope", "other"), "a", null, "c");
    }
    @Test
    @DisplayName("INFO 按节输出复制和键空间信息")
    void testInfo() {
        final ReplBackLog backlog = new ReplBackLog(1024);
        when(manager.getBacklog()).thenReturn(backlog);
        when(manager.getReplicationId()).thenReturn("0123456789012345678901234567890123456789");
        when(manager.getMasterOffset()).thenReturn(42L);
        call("SET", "k", "v");

        final String replication = ((BulkString) call("INFO", "replication")).getContent().getString();
        assertTrue(replication.contains("role:master"));
        assertTrue(replication.contains("connected_slaves:0"));
        assertTrue(replication.contains("master_repl_offset:42"));
        assertFalse(replication.contains("# Keyspace"));

        final String all = ((BulkString) call("INFO")).getContent().getString();
        assertTrue(all.contains("# Server"));
        assertTrue(all.contains("db0:keys=1"));
    }

    @Test
    @DisplayName("CONFIG GET 按模式返回参数")
    void testConfigGet() {
        final Resp reply = call("CONFIG", "GET", "db*");
        assertArray(reply, "dbfilename", "dump.rdb", "databases", "16");
        assertArray(call("CONFIG", "GET", "appendonly"), "appendonly", "no");
        assertArray(call("CONFIG", "GET", "nosuch"));
        assertError("ERR unknown subcommand", call("CONFIG", "SET", "dir", "/tmp"));
    }

    /**
     * 集合类回复的顺序不固定，按成员比较
     */
    private static Set<String> members(final Resp reply) {
        assertTrue(reply instanceof RespArray, "期望数组回复，实际: " + reply);
        final Set<String> result = new HashSet<>();
        for (final Resp part : ((RespArray) reply).getContent()) {
            result.add(((BulkString) part).getContent().getString());
        }
        return result;
    }

    @Test
    @DisplayName("SUNION、SDIFF 与 SMEMBERS，缺失的键当作空集合")
    void testSetAlgebra() {
        call("SADD", "s1", "a", "b", "c");
        call("SADD", "s2", "c", "d");
        assertEquals(Set.of("a", "b", "c"), members(call("SMEMBERS", "s1")));
        assertEquals(Set.of("a", "b", "c", "d"), members(call("SUNION", "s1", "s2", "missing")));
        assertEquals(Set.of("a", "b"), members(call("SDIFF", "s1", "s2")));
        assertEquals(Set.of(), members(call("SDIFF", "missing", "s1")));
        assertEquals(Set.of(), members(call("SMEMBERS", "missing")));

        call("SET", "str", "v");
        assertError("WRONGTYPE", call("SUNION", "s1", "str"));
        assertError("WRONGTYPE", call("SMEMBERS", "str"));
        verify(manager, never()).propagate(anyInt(), eq(RespArray.command("SUNION", "s1", "s2", "missing")));
    }

    @Test
    @DisplayName("ZREM 与 ZCARD，删除最后一个成员后键消失")
    void testZremAndZcard() {
        call("ZADD", "z", "1", "a", "2", "b");
        assertInt(2, call("ZCARD", "z"));
        assertInt(0, call("ZCARD", "missing"));
        assertInt(1, call("ZREM", "z", "a", "nope"));
        assertInt(1, call("ZCARD", "z"));
        assertInt(0, call("ZREM", "z", "nope"));
        assertInt(1, call("ZREM", "z", "b"));
        assertInt(0, call("EXISTS", "z"));

        verify(manager).propagate(0, RespArray.command("ZREM", "z", "a", "nope"));
        verify(manager, never()).propagate(0, RespArray.command("ZREM", "z", "nope"));
    }

    @Test
    @DisplayName("HMGET、HEXISTS 与 HLEN")
    void testHashReads() {
        call("HSET", "h", "f1", "v1", "f2", "v2");
        assertArray(call("HMGET", "h", "f1", "nope", "f2"), "v1", null, "v2");
        assertArray(call("HMGET", "missing", "f1"), (String) null);
        assertInt(1, call("HEXISTS", "h", "f1"));
        assertInt(0, call("HEXISTS", "h", "nope"));
        assertInt(0, call("HEXISTS", "missing", "f1"));
        assertInt(2, call("HLEN", "h"));
        assertInt(0, call("HLEN", "missing"));

        call("SET", "str", "v");
        assertError("WRONGTYPE", call("HLEN", "str"));
    }

    @Test
    @DisplayName("DECRBY 的取值范围与整数校验")
    void testDecrby() {
        call("SET", "n", "10");
        assertInt(7, call("DECRBY", "n", "3"));
        assertInt(-5, call("DECRBY", "fresh", "5"));
        assertError("ERR value is not an integer", call("DECRBY", "n", "x"));
        assertError("ERR", call("DECRBY", "n", "-9223372036854775808"));
        call("SET", "text", "abc");
        assertError("ERR value is not an integer", call("DECRBY", "text", "1"));
        assertBulk("7", call("GET", "n"));
        verify(manager).propagate(0, RespArray.command("DECRBY", "n", "3"));
    }

    @Test
    @DisplayName("EXPIREAT 以毫秒绝对时间传播，过去的时间直接删除")
    void testExpireat() {
        call("SET", "k", "v");
        final long at = System.currentTimeMillis() / 1000 + 100;
        assertInt(1, call("EXPIREAT", "k", String.valueOf(at)));
        final long ttl = ((RespInteger) call("TTL", "k")).getContent();
        assertTrue(ttl > 90 && ttl <= 100, "ttl=" + ttl);
        verify(manager).propagate(0, RespArray.command("PEXPIREAT", "k", String.valueOf(at * 1000)));

        call("SET", "old", "v");
        assertInt(1, call("EXPIREAT", "old", "1"));
        assertInt(0, call("EXISTS", "old"));
        verify(manager).propagate(0, RespArray.command("DEL", "old"));
        assertInt(0, call("EXPIREAT", "missing", String.valueOf(at)));
    }

    @Test
    @DisplayName("PTTL 以毫秒返回剩余时间")
    void testPttl() {
        assertInt(-2, call("PTTL", "missing"));
        call("SET", "k", "v");
        assertInt(-1, call("PTTL", "k"));
        call("SET", "t", "v", "PX", "5000");
        final long pttl = ((RespInteger) call("PTTL", "t")).getContent();
        assertTrue(pttl > 4000 && pttl <= 5000, "pttl=" + pttl);
    }

    @Test
    @DisplayName("FLUSHDB 只清空当前数据库")
    void testFlushDb() {
        call("SET", "a", "1");
        call("SELECT", "1");
        call("SET", "b", "1");
        call("SET", "c", "1");
        assertOk(call("FLUSHDB"));
        assertInt(0, call("DBSIZE"));
        call("SELECT", "0");
        assertInt(1, call("DBSIZE"));
        assertError("ERR syntax error", call("FLUSHDB", "LATER"));
        verify(manager).propagate(1, RespArray.command("FLUSHDB"));
    }

    @Test
    @DisplayName("BGSAVE 在后台写出可以重新加载的快照")
    void testBgsave() throws Exception {
        call("SET", "k", "v");
        call("RPUSH", "l", "a", "b");
        assertSimple("Background saving started", call("BGSAVE"));

        final long deadline = System.currentTimeMillis() + 5000;
        while (rdbManager.isBgSaveInProgress() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertFalse(rdbManager.isBgSaveInProgress());
        assertTrue(tempDir.resolve("dump.rdb").toFile().isFile());

        final RedisCoreImpl restored = new RedisCoreImpl(16, 64);
        final RdbManager loader = new RdbManager(restored, tempDir.toString(), "dump.rdb");
        try {
            assertEquals(2, loader.load());
        } finally {
            loader.close();
        }
        final RedisString value = restored.getDB(0).get(RedisBytes.fromString("k"), RedisType.STRING);
        assertEquals("v", value.getValue().getString());
        assertError("ERR syntax error", call("BGSAVE", "NOW"));
        verify(manager, never()).propagate(anyInt(), eq(RespArray.command("BGSAVE")));
    }

    @Test
    @DisplayName("浮点分数按Redis的格式输出")
    void testDoubleFormatting() {
        call("ZADD", "z", "1e20", "big", "0.1", "tenth", "1.5e-7", "tiny", "-2.5", "neg", "3", "int");
        assertBulk("1e+20", call("ZSCORE", "z", "big"));
        assertBulk("0.1", call("ZSCORE", "z", "tenth"));
        assertBulk("1.5e-07", call("ZSCORE", "z", "tiny"));
        assertBulk("-2.5", call("ZSCORE", "z", "neg"));
        assertBulk("3", call("ZSCORE", "z", "int"));
        assertBulk("inf", call("ZINCRBY", "z", "inf", "int"));
    }
}
