package site.respkv.command.impl.string;

import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandType;
import site.respkv.datastructure.RedisString;
import site.respkv.datastructure.RedisType;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.Resp;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

public class Get extends AbstractCommand {

    public Get(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
    }

    @Override
    public Resp handle() {
        final RedisString value = db().get(arg(1), RedisType.STRING);
        return value == null ? BulkString.NULL : bulk(value.getValue());
    }
}
