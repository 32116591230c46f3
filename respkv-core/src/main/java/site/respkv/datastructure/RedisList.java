package site.respkv.datastructure;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;

/**
 * Redis列表数据结构实现
 *
 * <p>使用LinkedList作为底层存储结构，两端插入和弹出都是O(1)。
 *
 * @since 1.0.0
 */
public class RedisList extends AbstractRedisData {

    /** 底层存储结构 */
    private final LinkedList<RedisBytes> list = new LinkedList<>();

    @Override
    public RedisType type() {
        return RedisType.LIST;
    }

    @Override
    public boolean isEmpty() {
        return list.isEmpty();
    }

    public int size() {
        return list.size();
    }

    /**
     * 向列表左端推入元素，后面的参数最终位于最前
     *
     * @param values 要推入的元素
     */
    public void lpush(final RedisBytes... values) {
        for (final RedisBytes value : values) {
            list.addFirst(value);
        }
    }

    public void rpush(final RedisBytes... values) {
        Collections.addAll(list, values);
    }

    /**
     * @return 弹出的元素，列表为空返回null
     */
    public RedisBytes lpop() {
        return list.pollFirst();
    }

    /**
     * @return 弹出的元素，列表为空返回null
     */
    public RedisBytes rpop() {
        return list.pollLast();
    }

    /**
     * 从一端弹出最多count个元素
     *
     * @param count 数量
     * @param left true从左端弹出
     * @return 按弹出顺序排列的元素
     */
    public List<RedisBytes> pop(final int count, final boolean left) {
        final int n = Math.min(count, list.size());
        final List<RedisBytes> popped = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            popped.add(left ? list.pollFirst() : list.pollLast());
        }
        return popped;
    }

    /**
     * 获取列表指定范围内的元素，支持负数索引
     *
     * @param start 开始索引
     * @param stop 结束索引（包含）
     * @return 指定范围的元素列表
     */
    public List<RedisBytes> lrange(final long start, final long stop) {
        final int size = list.size();

        // 1. 处理负数索引
        long actualStart = start < 0 ? size + start : start;
        long actualStop = stop < 0 ? size + stop : stop;

        // 2. 边界检查
        actualStart = Math.max(0, actualStart);
        actualStop = Math.min(size - 1L, actualStop);

        // 3. 返回子列表
        if (actualStart <= actualStop && actualStart < size) {
            return new ArrayList<>(list.subList((int) actualStart, (int) actualStop + 1));
        }
        return Collections.emptyList();
    }

    /**
     * @param index 索引，支持负数
     * @return 元素，越界返回null
     */
    public RedisBytes index(final long index) {
        final long actual = index < 0 ? list.size() + index : index;
        if (actual < 0 || actual >= list.size()) {
            return null;
        }
        return list.get((int) actual);
    }

    /**
     * @return 按顺序的全部元素副本
     */
    public List<RedisBytes> getAll() {
        return new ArrayList<>(list);
    }
}
