package site.respkv.datastructure;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Redis集合数据结构实现
 *
 * @since 1.0.0
 */
public class RedisSet extends AbstractRedisData {

    private final Set<RedisBytes> members = new HashSet<>();

    @Override
    public RedisType type() {
        return RedisType.SET;
    }

    @Override
    public boolean isEmpty() {
        return members.isEmpty();
    }

    public boolean add(final RedisBytes member) {
        return members.add(member);
    }

    public boolean remove(final RedisBytes member) {
        return members.remove(member);
    }

    public boolean contains(final RedisBytes member) {
        return members.contains(member);
    }

    public int size() {
        return members.size();
    }

    /**
     * 随机弹出最多count个成员
     *
     * @param count 数量
     * @return 被弹出的成员
     */
    public List<RedisBytes> pop(final int count) {
        final List<RedisBytes> popped = new ArrayList<>(Math.min(count, members.size()));
        while (popped.size() < count && !members.isEmpty()) {
            // 随机跳过若干个，HashSet不支持随机访问
            final int skip = ThreadLocalRandom.current().nextInt(members.size());
            final Iterator<RedisBytes> it = members.iterator();
            for (int i = 0; i < skip; i++) {
                it.next();
            }
            popped.add(it.next());
            it.remove();
        }
        return popped;
    }

    /**
     * @return 只读视图，调用方需持有键锁
     */
    public Set<RedisBytes> getMembers() {
        return Collections.unmodifiableSet(members);
    }
}
