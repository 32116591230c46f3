package site.respkv.datastructure;

import site.respkv.internal.SkipList;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Redis有序集合数据结构实现类
 *
 * <p>使用双重数据结构实现O(1)的成员查找和O(log N)的有序范围查询：
 * <ul>
 *     <li>memberScores: 成员到分数的映射</li>
 *     <li>skipList: 按(分数, 成员)排序的跳表，支持排名和分数范围查询</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class RedisZset extends AbstractRedisData {

    /** 成员到分数的映射 */
    private final Map<RedisBytes, Double> memberScores = new HashMap<>();

    /** 分数有序的跳表结构 */
    private final SkipList<RedisBytes> skipList = new SkipList<>();

    @Override
    public RedisType type() {
        return RedisType.ZSET;
    }

    @Override
    public boolean isEmpty() {
        return memberScores.isEmpty();
    }

    /**
     * 添加成员或更新分数
     *
     * @param score 分数
     * @param member 成员
     * @return 新成员返回true，更新已有成员返回false
     */
    public boolean add(final double score, final RedisBytes member) {
        final Double old = memberScores.put(member, score);
        if (old != null) {
            if (old == score) {
                return false;
            }
            skipList.delete(old, member);
        }
        skipList.insert(score, member);
        return old == null;
    }

    public boolean remove(final RedisBytes member) {
        final Double old = memberScores.remove(member);
        if (old == null) {
            return false;
        }
        skipList.delete(old, member);
        return true;
    }

    /**
     * @return 分数，不存在返回null
     */
    public Double getScore(final RedisBytes member) {
        return memberScores.get(member);
    }

    /**
     * 分数加上增量，成员不存在时从0开始
     *
     * @return 新分数
     */
    public double incrBy(final double delta, final RedisBytes member) {
        final Double old = memberScores.get(member);
        final double next = (old == null ? 0 : old) + delta;
        add(next, member);
        return next;
    }

    /**
     * @return 从0开始的排名，成员不存在返回-1
     */
    public long rank(final RedisBytes member) {
        final Double score = memberScores.get(member);
        if (score == null) {
            return -1;
        }
        return skipList.getRank(score, member) - 1;
    }

    public int size() {
        return memberScores.size();
    }

    /**
     * 按排名范围获取，支持负数索引，两端包含
     */
    public List<SkipList.SkipListNode<RedisBytes>> rangeByRank(final long start, final long stop) {
        return skipList.getElementByRankRange(start, stop);
    }

    /**
     * 按分数范围获取
     */
    public List<SkipList.SkipListNode<RedisBytes>> rangeByScore(final double min, final boolean minExclusive,
                                                              final double max, final boolean maxExclusive) {
        return skipList.getElementByScoreRange(min, minExclusive, max, maxExclusive);
    }

    /**
     * @return 只读视图，调用方需持有键锁
     */
    public Map<RedisBytes, Double> getMemberScores() {
        return Collections.unmodifiableMap(memberScores);
    }
}
