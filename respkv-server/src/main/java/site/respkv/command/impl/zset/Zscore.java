package site.respkv.command.impl.zset;

import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandType;
import site.respkv.datastructure.RedisType;
import site.respkv.datastructure.RedisZset;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.Resp;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

public class Zscore extends AbstractCommand {

    public Zscore(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
    }

    @Override
    public Resp handle() {
        final RedisZset zset = db().get(arg(1), RedisType.ZSET);
        final Double score = zset == null ? null : zset.getScore(arg(2));
        return score == null ? BulkString.NULL : BulkString.fromString(formatDouble(score));
    }
}
