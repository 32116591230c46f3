package site.respkv.command.impl.hash;

import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandType;
import site.respkv.datastructure.RedisBytes;
import site.respkv.datastructure.RedisHash;
import site.respkv.datastructure.RedisType;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespArray;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

import java.util.Map;

/**
 * HGETALL key，字段和值交替排列
 */
public class Hgetall extends AbstractCommand {

    public Hgetall(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
    }

    @Override
    public Resp handle() {
        final RedisHash hash = db().get(arg(1), RedisType.HASH);
        if (hash == null) {
            return RespArray.EMPTY;
        }
        final Resp[] reply = new Resp[hash.size() * 2];
        int i = 0;
        for (final Map.Entry<RedisBytes, RedisBytes> entry : hash.getHash().entrySet()) {
            reply[i++] = bulk(entry.getKey());
            reply[i++] = bulk(entry.getValue());
        }
        return new RespArray(reply);
    }
}
