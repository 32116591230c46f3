package site.respkv.command.impl.zset;

import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandException;
import site.respkv.command.CommandType;
import site.respkv.datastructure.RedisBytes;
import site.respkv.datastructure.RedisType;
import site.respkv.datastructure.RedisZset;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespArray;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

/**
 * ZRANGEBYSCORE key min max [WITHSCORES]，边界前加 ( 表示不包含
 */
public class Zrangebyscore extends AbstractCommand {

    private double min;

    private boolean minExclusive;

    private double max;

    private boolean maxExclusive;

    private boolean withScores;

    public Zrangebyscore(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
        minExclusive = isExclusive(arg(2));
        maxExclusive = isExclusive(arg(3));
        min = parseBound(arg(2), minExclusive);
        max = parseBound(arg(3), maxExclusive);
        if (args.length == 5) {
            if (!argIs(4, "WITHSCORES")) {
                throw CommandException.syntax();
            }
            withScores = true;
        }
    }

    private static boolean isExclusive(final RedisBytes bound) {
        return bound.length() > 0 && bound.getBytesUnsafe()[0] == '(';
    }

    private static double parseBound(final RedisBytes bound, final boolean exclusive) {
        final RedisBytes text = exclusive
                ? RedisBytes.fromString(bound.getString().substring(1))
                : bound;
        try {
            return parseDouble(text);
        } catch (CommandException e) {
            throw new CommandException("min or max is not a float");
        }
    }

    @Override
    public Resp handle() {
        final RedisZset zset = db().get(arg(1), RedisType.ZSET);
        if (zset == null) {
            return RespArray.EMPTY;
        }
        return Zrange.toReply(zset.rangeByScore(min, minExclusive, max, maxExclusive), withScores);
    }
}
