package site.respkv.command.impl.connection;

import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandType;
import site.respkv.protocol.Resp;
import site.respkv.protocol.SimpleString;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

public class Ping extends AbstractCommand {

    public Ping(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
    }

    @Override
    public Resp handle() {
        return args.length > 1 ? bulk(arg(1)) : SimpleString.PONG;
    }
}
