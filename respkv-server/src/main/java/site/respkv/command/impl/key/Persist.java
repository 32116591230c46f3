package site.respkv.command.impl.key;

import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandType;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespInteger;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

public class Persist extends AbstractCommand {

    public Persist(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
    }

    @Override
    public Resp handle() {
        if (!db().persist(arg(1))) {
            return RespInteger.ZERO;
        }
        propagateAsIs();
        return RespInteger.ONE;
    }
}
