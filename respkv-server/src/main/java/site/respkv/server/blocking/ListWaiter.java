package site.respkv.server.blocking;

import lombok.Getter;
import site.respkv.datastructure.RedisBytes;
import site.respkv.server.session.ClientSession;

import java.util.List;

/**
 * BLPOP/BRPOP 的等待记录
 *
 * @since 1.0.0
 */
@Getter
public class ListWaiter extends Waiter {

    private final int dbIndex;

    private final List<RedisBytes> keys;

    /** true从左端弹出 */
    private final boolean left;

    ListWaiter(final ClientSession session, final long sequence, final int dbIndex,
               final List<RedisBytes> keys, final boolean left) {
        super(session, sequence);
        this.dbIndex = dbIndex;
        this.keys = keys;
        this.left = left;
    }
}
