package site.respkv.command.impl.set;

import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandException;
import site.respkv.command.CommandType;
import site.respkv.database.RedisDB;
import site.respkv.datastructure.RedisBytes;
import site.respkv.datastructure.RedisSet;
import site.respkv.datastructure.RedisType;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespArray;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

import java.util.ArrayList;
import java.util.List;

/**
 * SPOP key [count]
 *
 * <p>弹出的成员是随机的，传播为删除这些成员的 SREM。
 */
public class Spop extends AbstractCommand {

    private RedisBytes key;

    /** -1表示没有 count 参数 */
    private long count = -1;

    public Spop(final CommandType type, final RedisContext context, final ClientSession session) {
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
        final RedisSet set = db.get(key, RedisType.SET);
        if (set == null) {
            return count < 0 ? BulkString.NULL : RespArray.EMPTY;
        }
        if (count == 0) {
            return RespArray.EMPTY;
        }
        final List<RedisBytes> popped = set.pop(count < 0 ? 1 : (int) Math.min(count, Integer.MAX_VALUE));
        db.touch(key);
        db.removeIfEmpty(key, set);

        final List<RedisBytes> srem = new ArrayList<>(popped.size() + 2);
        srem.add(RedisBytes.fromString("SREM"));
        srem.add(key);
        srem.addAll(popped);
        propagate(RespArray.command(srem));

        if (count < 0) {
            return bulk(popped.get(0));
        }
        final Resp[] reply = new Resp[popped.size()];
        for (int i = 0; i < reply.length; i++) {
            reply[i] = bulk(popped.get(i));
        }
        return new RespArray(reply);
    }
}
