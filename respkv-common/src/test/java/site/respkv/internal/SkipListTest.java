package site.respkv.internal;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SkipListTest {
    private SkipList<String> skipList;

    @BeforeEach
    void setUp() {
        skipList = new SkipList<>();
    }

    private static List<String> members(final List<SkipList.SkipListNode<String>> nodes) {
        return nodes.stream().map(n -> n.member).collect(Collectors.toList());
    }

    @Test
    void testInitialState() {
        assertTrue(skipList.isEmpty());
        assertEquals(0, skipList.size());
        assertNull(skipList.getFirst());
        assertNull(skipList.getLast());
    }

    @Test
    void testInsertKeepsScoreOrder() {
        skipList.insert(3.0, "three");
        skipList.insert(1.0, "one");
        skipList.insert(2.0, "two");

        assertEquals(3, skipList.size());
        assertEquals("one", skipList.getFirst().member);
        assertEquals("three", skipList.getLast().member);
        assertEquals(List.of("one", "two", "three"), members(skipList.getElementByRankRange(0, -1)));
    }

    @Test
    @DisplayName("分数相同时按成员字典序排列")
    void testEqualScoresOrderedByMember() {
        skipList.insert(1.0, "b");
        skipList.insert(1.0, "c");
        skipList.insert(1.0, "a");

        assertEquals(List.of("a", "b", "c"), members(skipList.getElementByRankRange(0, -1)));
        assertEquals(2, skipList.getRank(1.0, "b"));
    }

    @Test
    void testDelete() {
        skipList.insert(1.0, "one");
        skipList.insert(2.0, "two");
        skipList.insert(3.0, "three");

        assertTrue(skipList.delete(2.0, "two"));
        assertEquals(2, skipList.size());
        assertFalse(skipList.delete(2.0, "two"));
        // 分数不匹配时不删除
        assertFalse(skipList.delete(9.0, "one"));

        assertEquals(List.of("one", "three"), members(skipList.getElementByRankRange(0, -1)));
        assertEquals(2, skipList.getRank(3.0, "three"));
    }

    @Test
    void testGetElementByRank() {
        skipList.insert(1.0, "one");
        skipList.insert(2.0, "two");
        skipList.insert(3.0, "three");

        assertEquals("two", skipList.getElementByRank(2).member);
        assertNull(skipList.getElementByRank(0));
        assertNull(skipList.getElementByRank(4));
    }

    @Test
    @DisplayName("排名范围支持负数下标与越界裁剪")
    void testGetElementByRankRange() {
        for (int i = 1; i <= 5; i++) {
            skipList.insert(i, "m" + i);
        }

        assertEquals(List.of("m2", "m3"), members(skipList.getElementByRankRange(1, 2)));
        assertEquals(List.of("m4", "m5"), members(skipList.getElementByRankRange(-2, -1)));
        assertEquals(List.of("m1", "m2", "m3", "m4", "m5"), members(skipList.getElementByRankRange(-100, 100)));
        assertTrue(skipList.getElementByRankRange(3, 1).isEmpty());
        assertTrue(skipList.getElementByRankRange(5, 10).isEmpty());
    }

    @Test
    @DisplayName("分数范围支持开区间")
    void testGetElementByScoreRange() {
        for (int i = 1; i <= 5; i++) {
            skipList.insert(i, "m" + i);
        }

        assertEquals(List.of("m2", "m3", "m4"), members(skipList.getElementByScoreRange(2, 4)));
        assertEquals(List.of("m3"), members(skipList.getElementByScoreRange(2, true, 4, true)));
        assertEquals(List.of("m1", "m2"), members(skipList.getElementByScoreRange(
                Double.NEGATIVE_INFINITY, false, 3, true)));
        assertTrue(skipList.getElementByScoreRange(6, 10).isEmpty());
    }

    @Test
    void testRankAfterManyInserts() {
        for (int i = 0; i < 1000; i++) {
            skipList.insert(i, String.format("k%04d", i));
        }
        for (int i = 0; i < 1000; i += 97) {
            assertEquals(i + 1, skipList.getRank(i, String.format("k%04d", i)));
            assertEquals(String.format("k%04d", i), skipList.getElementByRank(i + 1).member);
        }
        assertEquals(0, skipList.getRank(5000, "missing"));
    }
}
