package site.respkv.command.impl.zset;

import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandException;
import site.respkv.command.CommandType;
import site.respkv.database.RedisDB;
import site.respkv.datastructure.RedisBytes;
import site.respkv.datastructure.RedisType;
import site.respkv.datastructure.RedisZset;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.Resp;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

/**
 * ZINCRBY key increment member
 */
public class Zincrby extends AbstractCommand {

    private double delta;

    public Zincrby(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
        delta = parseDouble(2);
    }

    @Override
    public Resp handle() {
        final RedisDB db = db();
        final RedisBytes key = arg(1);
        final RedisBytes member = arg(3);
        final RedisZset existing = db.get(key, RedisType.ZSET);
        final Double old = existing == null ? null : existing.getScore(member);
        if (Double.isNaN((old == null ? 0 : old) + delta)) {
            throw new CommandException("resulting score is not a number (NaN)");
        }
        final RedisZset zset = existing == null ? new RedisZset() : existing;
        final double next = zset.incrBy(delta, member);
        if (existing == null) {
            db.put(key, zset);
        } else {
            db.touch(key);
        }
        propagateAsIs();
        return BulkString.fromString(formatDouble(next));
    }
}
