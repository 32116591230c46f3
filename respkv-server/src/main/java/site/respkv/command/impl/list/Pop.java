package site.respkv.command.impl.list;

import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandException;
import site.respkv.command.CommandType;
import site.respkv.database.RedisDB;
import site.respkv.datastructure.RedisBytes;
import site.respkv.datastructure.RedisList;
import site.respkv.datastructure.RedisType;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespArray;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

import java.util.List;

/**
 * LPOP、RPOP key [count]
 */
public class Pop extends AbstractCommand {

    private RedisBytes key;

    /** -1表示没有 count 参数 */
    private long count = -1;

    public Pop(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
        key = arg(1);
        if (args.length == 3) {
            count = parseLong(2);
            if (count < 0) {
                throw new CommandException("value is out of range, must be positive");
            }
        }
    }

    @Override
    public Resp handle() {
        final RedisDB db = db();
        final RedisList list = db.get(key, RedisType.LIST);
        if (list == null) {
            return count < 0 ? BulkString.NULL : RespArray.NULL;
        }
        final boolean left = type == CommandType.LPOP;
        final Resp reply;
        if (count < 0) {
            reply = bulk(left ? list.lpop() : list.rpop());
        } else if (count == 0) {
            return RespArray.EMPTY;
        } else {
            final List<RedisBytes> popped = list.pop((int) Math.min(count, Integer.MAX_VALUE), left);
            final Resp[] elements = new Resp[popped.size()];
            for (int i = 0; i < elements.length; i++) {
                elements[i] = bulk(popped.get(i));
            }
            reply = new RespArray(elements);
        }
        db.touch(key);
        db.removeIfEmpty(key, list);
        propagateAsIs();
        return reply;
    }
}
