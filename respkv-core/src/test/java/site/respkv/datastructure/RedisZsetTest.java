package site.respkv.datastructure;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import site.respkv.internal.SkipList;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RedisZset单元测试")
class RedisZsetTest {

    private RedisZset zset;

    private static RedisBytes b(final String s) {
        return RedisBytes.fromString(s);
    }

    private static List<String> members(final List<SkipList.SkipListNode<RedisBytes>> nodes) {
        return nodes.stream().map(n -> n.member.getString()).collect(Collectors.toList());
    }

    @BeforeEach
    void setUp() {
        zset = new RedisZset();
        zset.add(1, b("one"));
        zset.add(2, b("two"));
        zset.add(3, b("three"));
    }

    @Test
    @DisplayName("更新分数后排序随之改变")
    void testUpdateScoreReorders() {
        assertFalse(zset.add(10, b("one")));
        assertEquals(List.of("two", "three", "one"), members(zset.rangeByRank(0, -1)));
        assertEquals(2, zset.rank(b("one")));
        assertEquals(10.0, zset.getScore(b("one")));
        assertEquals(3, zset.size());
    }

    @Test
    @DisplayName("同分成员按字典序排列")
    void testTieBreakByMember() {
        zset.add(2, b("alpha"));
        assertEquals(List.of("one", "alpha", "two", "three"), members(zset.rangeByRank(0, -1)));
    }

    @Test
    void testRangeByScoreExclusive() {
        assertEquals(List.of("two", "three"), members(zset.rangeByScore(1, true, 3, false)));
        assertEquals(List.of("one", "two", "three"),
                members(zset.rangeByScore(Double.NEGATIVE_INFINITY, false, Double.POSITIVE_INFINITY, false)));
    }

    @Test
    void testIncrByAndRemove() {
        assertEquals(4.5, zset.incrBy(2.5, b("two")));
        assertEquals(7.0, zset.incrBy(7, b("seven")));
        assertTrue(zset.remove(b("two")));
        assertFalse(zset.remove(b("two")));
        assertEquals(-1, zset.rank(b("two")));
        assertEquals(List.of("one", "three", "seven"), members(zset.rangeByRank(0, -1)));
    }
}
