package site.respkv.command.impl.list;

import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandException;
import site.respkv.command.CommandType;
import site.respkv.database.RedisDB;
import site.respkv.datastructure.RedisBytes;
import site.respkv.datastructure.RedisList;
import site.respkv.datastructure.RedisType;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespArray;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

import java.util.List;

/**
 * BLPOP、BRPOP key [key ...] timeout
 *
 * <p>按参数顺序找到第一个非空列表立即弹出；全部为空时在持有这些键的独占锁期间
 * 登记等待，回复稍后由推入元素的命令或超时投递。事务中不阻塞，直接回复空数组。
 * 传播形式为 LPOP/RPOP。
 */
public class BlockingPop extends AbstractCommand {

    private long timeoutMillis;

    public BlockingPop(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
        final double seconds;
        try {
            seconds = parseDouble(args.length - 1);
        } catch (CommandException e) {
            throw new CommandException("timeout is not a float or out of range");
        }
        if (seconds < 0) {
            throw new CommandException("timeout is negative");
        }
        if (Double.isInfinite(seconds)) {
            timeoutMillis = 0;
            return;
        }
        timeoutMillis = (long) Math.ceil(seconds * 1000);
    }

    public long getTimeoutMillis() {
        return timeoutMillis;
    }

    @Override
    public Resp handle() {
        final RedisDB db = db();
        final boolean left = type == CommandType.BLPOP;
        final List<RedisBytes> keys = keys();
        // 1. 先校验全部键的类型，再弹出
        for (final RedisBytes key : keys) {
            db.get(key, RedisType.LIST);
        }
        for (final RedisBytes key : keys) {
            final RedisList list = db.get(key, RedisType.LIST);
            if (list == null || list.size() == 0) {
                continue;
            }
            final RedisBytes element = left ? list.lpop() : list.rpop();
            db.touch(key);
            db.removeIfEmpty(key, list);
            propagate(commandOf(left ? "LPOP" : "RPOP", key));
            return new RespArray(new Resp[]{bulk(key), bulk(element)});
        }

        // 2. 事务中不阻塞
        if (session.isExecutingTransaction()) {
            return RespArray.NULL;
        }

        // 3. 登记等待，回复由协调器投递
        context.getBlockingCoordinator().blockOnLists(session, db.getId(), keys, left, timeoutMillis);
        return null;
    }
}
