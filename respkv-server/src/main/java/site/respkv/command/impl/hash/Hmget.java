package site.respkv.command.impl.hash;

import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandType;
import site.respkv.datastructure.RedisBytes;
import site.respkv.datastructure.RedisHash;
import site.respkv.datastructure.RedisType;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespArray;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

public class Hmget extends AbstractCommand {

    public Hmget(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
    }

    @Override
    public Resp handle() {
        final RedisHash hash = db().get(arg(1), RedisType.HASH);
        final Resp[] reply = new Resp[args.length - 2];
        for (int i = 2; i < args.length; i++) {
            final RedisBytes value = hash == null ? null : hash.get(arg(i));
            reply[i - 2] = value == null ? BulkString.NULL : bulk(value);
        }
        return new RespArray(reply);
    }
}
