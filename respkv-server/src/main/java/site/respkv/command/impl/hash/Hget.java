package site.respkv.command.impl.hash;

import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandType;
import site.respkv.datastructure.RedisBytes;
import site.respkv.datastructure.RedisHash;
import site.respkv.datastructure.RedisType;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.Resp;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

public class Hget extends AbstractCommand {

    public Hget(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
    }

    @Override
    public Resp handle() {
        final RedisHash hash = db().get(arg(1), RedisType.HASH);
        final RedisBytes value = hash == null ? null : hash.get(arg(2));
        return value == null ? BulkString.NULL : bulk(value);
    }
}
