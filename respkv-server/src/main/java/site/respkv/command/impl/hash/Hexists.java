package site.respkv.command.impl.hash;

import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandType;
import site.respkv.datastructure.RedisHash;
import site.respkv.datastructure.RedisType;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespInteger;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

public class Hexists extends AbstractCommand {

    public Hexists(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
    }

    @Override
    public Resp handle() {
        final RedisHash hash = db().get(arg(1), RedisType.HASH);
        return RespInteger.valueOf(hash != null && hash.containsField(arg(2)));
    }
}
