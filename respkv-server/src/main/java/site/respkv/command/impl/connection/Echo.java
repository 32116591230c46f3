package site.respkv.command.impl.connection;

import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandType;
import site.respkv.protocol.Resp;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

public class Echo extends AbstractCommand {

    public Echo(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
    }

    @Override
    public Resp handle() {
        return bulk(arg(1));
    }
}
