package site.respkv.command.impl.key;

import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandType;
import site.respkv.datastructure.RedisBytes;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespArray;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

import java.util.ArrayList;
import java.util.List;

public class Keys extends AbstractCommand {

    public Keys(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
    }

    @Override
    public Resp handle() {
        final List<RedisBytes> keys = db().keys(arg(1));
        final List<BulkString> reply = new ArrayList<>(keys.size());
        for (final RedisBytes key : keys) {
            reply.add(bulk(key));
        }
        return RespArray.valueOf(reply);
    }
}
