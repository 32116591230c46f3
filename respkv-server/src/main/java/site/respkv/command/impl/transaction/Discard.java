package site.respkv.command.impl.transaction;

import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandException;
import site.respkv.command.CommandType;
import site.respkv.protocol.Resp;
import site.respkv.protocol.SimpleString;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

public class Discard extends AbstractCommand {

    public Discard(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
    }

    @Override
    public Resp handle() {
        if (!session.isInMulti()) {
            throw CommandException.withoutMulti("DISCARD");
        }
        session.endMulti();
        session.unwatchAll(context.getRedisCore());
        return SimpleString.OK;
    }
}
