package site.respkv.command.impl.list;

import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandType;
import site.respkv.datastructure.RedisBytes;
import site.respkv.datastructure.RedisList;
import site.respkv.datastructure.RedisType;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespArray;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

import java.util.List;

public class Lrange extends AbstractCommand {

    private long start;

    private long stop;

    public Lrange(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
        start = parseLong(2);
        stop = parseLong(3);
    }

    @Override
    public Resp handle() {
        final RedisList list = db().get(arg(1), RedisType.LIST);
        if (list == null) {
            return RespArray.EMPTY;
        }
        final List<RedisBytes> range = list.lrange(start, stop);
        final Resp[] reply = new Resp[range.size()];
        for (int i = 0; i < reply.length; i++) {
            reply[i] = bulk(range.get(i));
        }
        return new RespArray(reply);
    }
}
