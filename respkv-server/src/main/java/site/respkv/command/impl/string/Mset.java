package site.respkv.command.impl.string;

import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandException;
import site.respkv.command.CommandType;
import site.respkv.database.RedisDB;
import site.respkv.datastructure.RedisString;
import site.respkv.protocol.Resp;
import site.respkv.protocol.SimpleString;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

public class Mset extends AbstractCommand {

    public Mset(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
        if (args.length % 2 == 0) {
            throw CommandException.wrongArity(type.getCommandName());
        }
    }

    @Override
    public Resp handle() {
        final RedisDB db = db();
        for (int i = 1; i < args.length; i += 2) {
            db.put(arg(i), new RedisString(arg(i + 1)));
        }
        propagateAsIs();
        return SimpleString.OK;
    }
}
