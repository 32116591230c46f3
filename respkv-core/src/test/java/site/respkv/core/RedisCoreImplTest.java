package site.respkv.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import site.respkv.database.RedisDB;
import site.respkv.datastructure.RedisBytes;
import site.respkv.datastructure.RedisString;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RedisCoreImpl单元测试")
class RedisCoreImplTest {

    private RedisCoreImpl redisCore;

    @BeforeEach
    void setUp() {
        redisCore = new RedisCoreImpl(4, 64);
    }

    @Test
    void testDatabases() {
        assertEquals(4, redisCore.getDBNum());
        assertEquals(2, redisCore.getDB(2).getId());
        assertThrows(IndexOutOfBoundsException.class, () -> redisCore.getDB(4));
    }

    @Test
    @DisplayName("主动过期清理删除过期键并回调")
    void testActiveExpireCycle() {
        List<String> expired = new ArrayList<>();
        redisCore.setExpireListener((db, key) -> expired.add(db + ":" + key));
        RedisDB db = redisCore.getDB(1);
        for (int i = 0; i < 50; i++) {
            RedisString value = new RedisString(RedisBytes.fromString("v"));
            value.setExpireAt(System.currentTimeMillis() - 1);
            db.getData().put(RedisBytes.fromLong(i), value);
            db.getExpires().add(RedisBytes.fromLong(i));
        }
        RedisString keep = new RedisString(RedisBytes.fromString("v"));
        keep.setExpireAt(System.currentTimeMillis() + 60_000);
        db.put(RedisBytes.fromString("keep"), keep);

        int removed = redisCore.activeExpireCycle(20, 1000);
        assertEquals(50, removed);
        assertEquals(1, db.size());
        assertEquals(50, expired.size());
        assertTrue(expired.contains("1:7"));
    }

    @Test
    @DisplayName("从节点不执行主动过期")
    void testReplicaSkipsActiveExpire() {
        redisCore.setReplicaMode(true);
        RedisDB db = redisCore.getDB(0);
        RedisString value = new RedisString(RedisBytes.fromString("v"));
        value.setExpireAt(System.currentTimeMillis() - 1);
        db.put(RedisBytes.fromString("k"), value);
        assertEquals(0, redisCore.activeExpireCycle(20, 100));
        assertEquals(1, db.size());
    }

    @Test
    void testFlushAll() {
        redisCore.getDB(0).put(RedisBytes.fromString("a"), new RedisString(RedisBytes.fromString("1")));
        redisCore.getDB(3).put(RedisBytes.fromString("b"), new RedisString(RedisBytes.fromString("2")));
        redisCore.flushAll();
        assertEquals(0, redisCore.getDB(0).size());
        assertEquals(0, redisCore.getDB(3).size());
    }
}
