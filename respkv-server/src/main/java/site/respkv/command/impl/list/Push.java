package site.respkv.command.impl.list;

import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandType;
import site.respkv.database.RedisDB;
import site.respkv.datastructure.RedisBytes;
import site.respkv.datastructure.RedisList;
import site.respkv.datastructure.RedisType;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespInteger;
import site.respkv.server.blocking.BlockingCoordinator;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

/**
 * LPUSH、RPUSH。
 *
 * <p>推入后如果有连接阻塞在该键上，在同一把锁内按登记顺序把元素交给它们，
 * 交付的元素以 LPOP/RPOP 的形式紧跟在本命令之后传播。
 */
public class Push extends AbstractCommand {

    public Push(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
    }

    @Override
    public Resp handle() {
        final RedisDB db = db();
        final RedisBytes key = arg(1);
        RedisList list = db.get(key, RedisType.LIST);
        final boolean created = list == null;
        if (created) {
            list = new RedisList();
        }
        final RedisBytes[] values = new RedisBytes[args.length - 2];
        for (int i = 2; i < args.length; i++) {
            values[i - 2] = arg(i);
        }
        if (type == CommandType.LPUSH) {
            list.lpush(values);
        } else {
            list.rpush(values);
        }
        if (created) {
            db.put(key, list);
        } else {
            db.touch(key);
        }
        final int length = list.size();
        propagateAsIs();

        final BlockingCoordinator coordinator = context.getBlockingCoordinator();
        if (coordinator.hasListWaiters(db.getId(), key)) {
            coordinator.serveList(db, key, list, this::propagate);
        }
        return RespInteger.valueOf(length);
    }
}
