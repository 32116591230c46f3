package site.respkv.internal;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 带跨度的跳表，有序集合的排序索引。
 *
 * <p>节点按 (score, member) 排序：分数相同时按成员自然序排列，
 * 因此同一成员最多出现一次。每个前向指针记录跨越的节点数，
 * 排名相关的查询均为 O(log N)。
 *
 * <p>主要操作：
 * <ul>
 *   <li>插入/删除：平均 O(log N)
 *   <li>按排名定位与按排名范围查询（支持负数下标）
 *   <li>按分数范围查询，上下界可分别为开区间
 *   <li>计算成员排名
 * </ul>
 *
 * <p>线程安全：本类不做同步，由键级锁保证独占访问。
 *
 * @param <T> 成员类型
 * @since 1.0.0
 */
public class SkipList<T extends Comparable<T>> {

    /** 最大层数 */
    private static final int MAX_LEVEL = 32;

    /** 层数增长概率 */
    private static final double P = 0.25;

    /** 头节点，不存放数据 */
    private final SkipListNode<T> head;

    /** 当前最大层数 */
    private int level;

    /** 节点数量 */
    private int size;

    /**
     * 跳表节点，包含分数、成员、后向指针与各层的前向指针。
     */
    public static final class SkipListNode<T> {
        public final double score;
        public final T member;
        SkipListNode<T> backward;
        final SkipListLevel<T>[] level;

        @SuppressWarnings("unchecked")
        SkipListNode(final int level, final double score, final T member) {
            this.level = new SkipListLevel[level];
            for (int i = 0; i < level; i++) {
                this.level[i] = new SkipListLevel<>();
            }
            this.score = score;
            this.member = member;
        }

        /**
         * @return 下一个节点，没有时返回null
         */
        public SkipListNode<T> next() {
            return level[0].forward;
        }
    }

    static final class SkipListLevel<T> {
        SkipListNode<T> forward;
        long span;
    }

    public SkipList() {
        head = new SkipListNode<>(MAX_LEVEL, Double.NEGATIVE_INFINITY, null);
        level = 1;
        size = 0;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * @return 分数最小的节点，跳表为空时返回null
     */
    public SkipListNode<T> getFirst() {
        return head.level[0].forward;
    }

    /**
     * @return 分数最大的节点，跳表为空时返回null
     */
    public SkipListNode<T> getLast() {
        SkipListNode<T> node = head;
        for (int i = level - 1; i >= 0; i--) {
            while (node.level[i].forward != null) {
                node = node.level[i].forward;
            }
        }
        return node != head ? node : null;
    }

    private static <T extends Comparable<T>> boolean precedes(final SkipListNode<T> node, final double score, final T member) {
        return node.score < score || (node.score == score && node.member.compareTo(member) < 0);
    }

    /**
     * 插入节点，调用者保证 (score, member) 不在表中。
     *
     * @param score 分数
     * @param member 成员
     * @return 新插入的节点
     */
    @SuppressWarnings("unchecked")
    public SkipListNode<T> insert(final double score, final T member) {
        final SkipListNode<T>[] update = new SkipListNode[MAX_LEVEL];
        final long[] rank = new long[MAX_LEVEL];

        // 1. 自顶向下查找每层的前驱，并累计前驱的排名
        SkipListNode<T> x = head;
        for (int i = level - 1; i >= 0; i--) {
            rank[i] = i == level - 1 ? 0 : rank[i + 1];
            while (x.level[i].forward != null && precedes(x.level[i].forward, score, member)) {
                rank[i] += x.level[i].span;
                x = x.level[i].forward;
            }
            update[i] = x;
        }

        // 2. 新层数高于当前层数时，初始化新增层
        final int newLevel = randomLevel();
        if (newLevel > level) {
            for (int i = level; i < newLevel; i++) {
                rank[i] = 0;
                update[i] = head;
                update[i].level[i].span = size;
            }
            level = newLevel;
        }

        // 3. 逐层接入新节点并修正跨度
        x = new SkipListNode<>(newLevel, score, member);
        for (int i = 0; i < newLevel; i++) {
            x.level[i].forward = update[i].level[i].forward;
            update[i].level[i].forward = x;
            x.level[i].span = update[i].level[i].span - (rank[0] - rank[i]);
            update[i].level[i].span = rank[0] - rank[i] + 1;
        }
        for (int i = newLevel; i < level; i++) {
            update[i].level[i].span++;
        }

        // 4. 设置后向指针
        x.backward = update[0] == head ? null : update[0];
        if (x.level[0].forward != null) {
            x.level[0].forward.backward = x;
        }
        size++;
        return x;
    }

    /**
     * 删除指定节点。
     *
     * @param score 分数
     * @param member 成员
     * @return 找到并删除时返回true
     */
    @SuppressWarnings("unchecked")
    public boolean delete(final double score, final T member) {
        final SkipListNode<T>[] update = new SkipListNode[MAX_LEVEL];
        SkipListNode<T> x = head;
        for (int i = level - 1; i >= 0; i--) {
            while (x.level[i].forward != null && precedes(x.level[i].forward, score, member)) {
                x = x.level[i].forward;
            }
            update[i] = x;
        }

        x = x.level[0].forward;
        if (x != null && x.score == score && x.member.compareTo(member) == 0) {
            deleteNode(x, update);
            return true;
        }
        return false;
    }

    private void deleteNode(final SkipListNode<T> x, final SkipListNode<T>[] update) {
        for (int i = 0; i < level; i++) {
            if (update[i].level[i].forward == x) {
                update[i].level[i].span += x.level[i].span - 1;
                update[i].level[i].forward = x.level[i].forward;
            } else {
                update[i].level[i].span--;
            }
        }
        if (x.level[0].forward != null) {
            x.level[0].forward.backward = x.backward;
        }
        while (level > 1 && head.level[level - 1].forward == null) {
            level--;
        }
        size--;
    }

    private int randomLevel() {
        int lvl = 1;
        final ThreadLocalRandom random = ThreadLocalRandom.current();
        while (random.nextDouble() < P && lvl < MAX_LEVEL) {
            lvl++;
        }
        return lvl;
    }

    /**
     * 按排名范围获取节点，start/end 为从0开始的闭区间，负数表示从尾部倒数。
     *
     * @param start 起始下标
     * @param end 结束下标
     * @return 范围内的节点，越界时返回空列表
     */
    public List<SkipListNode<T>> getElementByRankRange(long start, long end) {
        final List<SkipListNode<T>> result = new ArrayList<>();
        if (start < 0) {
            start = size + start;
        }
        if (end < 0) {
            end = size + end;
        }
        if (start < 0) {
            start = 0;
        }
        if (end >= size) {
            end = size - 1;
        }
        if (start > end || start >= size) {
            return result;
        }

        SkipListNode<T> x = getElementByRank(start + 1);
        for (long i = start; i <= end && x != null; i++) {
            result.add(x);
            x = x.level[0].forward;
        }
        return result;
    }

    /**
     * 按分数范围获取节点。
     *
     * @param min 下界
     * @param minExclusive 下界是否为开区间
     * @param max 上界
     * @param maxExclusive 上界是否为开区间
     * @return 范围内的节点，按分数升序
     */
    public List<SkipListNode<T>> getElementByScoreRange(final double min, final boolean minExclusive,
                                                        final double max, final boolean maxExclusive) {
        final List<SkipListNode<T>> result = new ArrayList<>();
        SkipListNode<T> x = head;

        // 1. 定位到第一个不小于下界的节点前驱
        for (int i = level - 1; i >= 0; i--) {
            while (x.level[i].forward != null && belowMin(x.level[i].forward.score, min, minExclusive)) {
                x = x.level[i].forward;
            }
        }

        // 2. 顺序收集直到超过上界
        x = x.level[0].forward;
        while (x != null && !aboveMax(x.score, max, maxExclusive)) {
            result.add(x);
            x = x.level[0].forward;
        }
        return result;
    }

    /**
     * 闭区间分数范围查询。
     */
    public List<SkipListNode<T>> getElementByScoreRange(final double min, final double max) {
        return getElementByScoreRange(min, false, max, false);
    }

    private static boolean belowMin(final double score, final double min, final boolean exclusive) {
        return exclusive ? score <= min : score < min;
    }

    private static boolean aboveMax(final double score, final double max, final boolean exclusive) {
        return exclusive ? score >= max : score > max;
    }

    /**
     * 获取指定排名的节点，排名从1开始。
     *
     * @param rank 排名
     * @return 节点，越界时返回null
     */
    public SkipListNode<T> getElementByRank(final long rank) {
        if (rank <= 0 || rank > size) {
            return null;
        }
        long traversed = 0;
        SkipListNode<T> x = head;
        for (int i = level - 1; i >= 0; i--) {
            while (x.level[i].forward != null && traversed + x.level[i].span <= rank) {
                traversed += x.level[i].span;
                x = x.level[i].forward;
            }
            if (traversed == rank) {
                return x;
            }
        }
        return null;
    }

    /**
     * 计算节点排名，排名从1开始。
     *
     * @param score 分数
     * @param member 成员
     * @return 排名，节点不存在时返回0
     */
    public long getRank(final double score, final T member) {
        long rank = 0;
        SkipListNode<T> x = head;
        for (int i = level - 1; i >= 0; i--) {
            while (x.level[i].forward != null
                    && (x.level[i].forward.score < score
                    || (x.level[i].forward.score == score && x.level[i].forward.member.compareTo(member) <= 0))) {
                rank += x.level[i].span;
                x = x.level[i].forward;
            }
            if (x != head && x.score == score && x.member.compareTo(member) == 0) {
                return rank;
            }
        }
        return 0;
    }
}
