package site.respkv.command.impl.key;

import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandType;
import site.respkv.datastructure.RedisData;
import site.respkv.protocol.Resp;
import site.respkv.protocol.SimpleString;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

public class Type extends AbstractCommand {

    private static final SimpleString NONE = new SimpleString("none");

    public Type(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
    }

    @Override
    public Resp handle() {
        final RedisData value = db().get(arg(1));
        return value == null ? NONE : new SimpleString(value.type().getDisplayName());
    }
}
