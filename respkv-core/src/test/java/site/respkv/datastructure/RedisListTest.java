package site.respkv.datastructure;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RedisList类的单元测试
 */
@DisplayName("RedisList单元测试")
class RedisListTest {

    private RedisList redisList;

    private static RedisBytes b(final String s) {
        return RedisBytes.fromString(s);
    }

    @BeforeEach
    void setUp() {
        redisList = new RedisList();
    }

    @Test
    @DisplayName("LPUSH多个参数时最后一个位于最左")
    void testLpushOrder() {
        redisList.lpush(b("a"), b("b"), b("c"));
        assertEquals(List.of(b("c"), b("b"), b("a")), redisList.getAll());
    }

    @Test
    @DisplayName("测试两端弹出")
    void testPopBothEnds() {
        redisList.rpush(b("1"), b("2"), b("3"));
        assertEquals(b("1"), redisList.lpop());
        assertEquals(b("3"), redisList.rpop());
        assertEquals(1, redisList.size());
        assertEquals(b("2"), redisList.lpop());
        assertNull(redisList.lpop());
        assertTrue(redisList.isEmpty());
    }

    @Test
    @DisplayName("测试带数量的弹出不超过列表长度")
    void testPopWithCount() {
        redisList.rpush(b("1"), b("2"), b("3"));
        assertEquals(List.of(b("3"), b("2")), redisList.pop(2, false));
        assertEquals(List.of(b("1")), redisList.pop(5, true));
    }

    @Test
    @DisplayName("测试范围查询与负数索引")
    void testRange() {
        redisList.rpush(b("a"), b("b"), b("c"), b("d"));
        assertEquals(List.of(b("a"), b("b"), b("c"), b("d")), redisList.lrange(0, -1));
        assertEquals(List.of(b("c"), b("d")), redisList.lrange(-2, 100));
        assertTrue(redisList.lrange(3, 1).isEmpty());
        assertTrue(redisList.lrange(10, 20).isEmpty());
        assertEquals(b("d"), redisList.index(-1));
        assertNull(redisList.index(4));
    }
}
