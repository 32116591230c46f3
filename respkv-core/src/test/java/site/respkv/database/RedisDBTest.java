package site.respkv.database;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import site.respkv.datastructure.RedisBytes;
import site.respkv.datastructure.RedisList;
import site.respkv.datastructure.RedisString;
import site.respkv.datastructure.RedisType;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RedisDB类的单元测试
 *
 * <p>覆盖过期、版本号和监视表的交互。
 */
@DisplayName("RedisDB单元测试")
class RedisDBTest {

    private RedisDB redisDB;
    private List<RedisBytes> expiredKeys;

    private static RedisBytes b(final String s) {
        return RedisBytes.fromString(s);
    }

    private static RedisString str(final String s) {
        return new RedisString(b(s));
    }

    @BeforeEach
    void setUp() {
        redisDB = new RedisDB(0);
        expiredKeys = new ArrayList<>();
        redisDB.setExpireListener((db, key) -> expiredKeys.add(key));
    }

    @Test
    @DisplayName("类型不匹配抛出WrongTypeException")
    void testTypedGet() {
        redisDB.put(b("k"), str("v"));
        assertNotNull(redisDB.get(b("k"), RedisType.STRING));
        WrongTypeException e = assertThrows(WrongTypeException.class, () -> redisDB.get(b("k"), RedisType.LIST));
        assertEquals(RedisType.STRING, e.getActual());
        assertNull(redisDB.get(b("missing"), RedisType.LIST));
    }

    @Test
    @DisplayName("每次修改版本号严格递增，读取不改变版本")
    void testVersionsIncrease() {
        redisDB.put(b("k"), str("1"));
        long v1 = redisDB.keyVersion(b("k"));
        redisDB.get(b("k"));
        assertEquals(v1, redisDB.keyVersion(b("k")));
        redisDB.touch(b("k"));
        long v2 = redisDB.keyVersion(b("k"));
        assertTrue(v2 > v1);
        redisDB.put(b("k"), str("2"));
        assertTrue(redisDB.keyVersion(b("k")) > v2);
    }

    @Test
    @DisplayName("被监视的键删除后再重建，版本与监视时不同")
    void testWatchedKeyDeleteAndRecreate() {
        redisDB.getWatchRegistry().watch(b("k"));
        long watchedAbsent = redisDB.keyVersion(b("k"));
        assertEquals(0, watchedAbsent);

        redisDB.put(b("k"), str("v"));
        long live = redisDB.keyVersion(b("k"));
        assertNotEquals(watchedAbsent, live);

        redisDB.delete(b("k"));
        long deleted = redisDB.keyVersion(b("k"));
        assertNotEquals(0, deleted);
        assertNotEquals(live, deleted);
    }

    @Test
    @DisplayName("FLUSHDB使所有被监视的键变化")
    void testClearTouchesWatched() {
        redisDB.getWatchRegistry().watch(b("absent"));
        long before = redisDB.keyVersion(b("absent"));
        redisDB.clear();
        assertNotEquals(before, redisDB.keyVersion(b("absent")));
    }

    @Test
    @DisplayName("惰性过期删除键并通知监听器")
    void testLazyExpiry() {
        RedisString value = str("v");
        value.setExpireAt(System.currentTimeMillis() - 1);
        redisDB.getData().put(b("k"), value);

        assertNull(redisDB.get(b("k")));
        assertFalse(redisDB.getData().containsKey(b("k")));
        assertEquals(List.of(b("k")), expiredKeys);
        assertEquals(-2, redisDB.pttl(b("k")));
    }

    @Test
    @DisplayName("从节点模式下过期键被隐藏但不删除")
    void testReplicaModeHidesExpired() {
        redisDB.setReplicaMode(true);
        RedisString value = str("v");
        value.setExpireAt(System.currentTimeMillis() - 1);
        redisDB.getData().put(b("k"), value);

        assertNull(redisDB.get(b("k")));
        assertTrue(redisDB.getData().containsKey(b("k")));
        assertTrue(expiredKeys.isEmpty());
        // 主节点传播的 DEL 才真正删除
        assertNull(redisDB.delete(b("k")));
        assertFalse(redisDB.getData().containsKey(b("k")));
    }

    @Test
    @DisplayName("删除不存在的键返回null")
    void testDeleteAbsentIsNoop() {
        assertNull(redisDB.delete(b("nothing")));
        assertNull(redisDB.delete(b("nothing")));
    }

    @Test
    @DisplayName("测试过期时间设置、查询和移除")
    void testExpireAndPersist() {
        redisDB.put(b("k"), str("v"));
        assertEquals(-1, redisDB.pttl(b("k")));
        assertTrue(redisDB.expire(b("k"), System.currentTimeMillis() + 10_000));
        long pttl = redisDB.pttl(b("k"));
        assertTrue(pttl > 9_000 && pttl <= 10_000);
        assertTrue(redisDB.persist(b("k")));
        assertFalse(redisDB.persist(b("k")));
        assertEquals(-1, redisDB.pttl(b("k")));

        assertTrue(redisDB.expire(b("k"), System.currentTimeMillis() - 1000));
        assertFalse(redisDB.exists(b("k")));
        assertFalse(redisDB.expire(b("k"), System.currentTimeMillis() + 1000));
    }

    @Test
    @DisplayName("空聚合被删除")
    void testRemoveIfEmpty() {
        RedisList list = new RedisList();
        list.rpush(b("x"));
        redisDB.put(b("l"), list);
        assertFalse(redisDB.removeIfEmpty(b("l"), list));
        list.lpop();
        assertTrue(redisDB.removeIfEmpty(b("l"), list));
        assertFalse(redisDB.exists(b("l")));
    }

    @Test
    void testKeysPattern() {
        redisDB.put(b("user:1"), str("a"));
        redisDB.put(b("user:2"), str("b"));
        redisDB.put(b("order:1"), str("c"));
        assertEquals(2, redisDB.keys(b("user:*")).size());
        assertEquals(3, redisDB.keys(b("*")).size());
        assertEquals(List.of(b("order:1")), redisDB.keys(b("o?der:[0-9]")));
    }

    @Test
    @DisplayName("采样游标遍历所有带过期时间的键")
    void testSampleExpiring() {
        for (int i = 0; i < 5; i++) {
            RedisString v = str("v");
            v.setExpireAt(System.currentTimeMillis() + 100_000);
            redisDB.put(RedisBytes.fromLong(i), v);
        }
        redisDB.put(b("plain"), str("v"));
        List<RedisBytes> first = redisDB.sampleExpiring(3);
        List<RedisBytes> second = redisDB.sampleExpiring(3);
        assertEquals(3, first.size());
        assertEquals(3, second.size());
        assertFalse(first.contains(b("plain")));
        assertFalse(second.contains(b("plain")));
    }
}
