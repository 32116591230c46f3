package site.respkv.command.impl.zset;

import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandType;
import site.respkv.datastructure.RedisType;
import site.respkv.datastructure.RedisZset;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespInteger;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

public class Zcard extends AbstractCommand {

    public Zcard(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
    }

    @Override
    public Resp handle() {
        final RedisZset zset = db().get(arg(1), RedisType.ZSET);
        return RespInteger.valueOf(zset == null ? 0 : zset.size());
    }
}
