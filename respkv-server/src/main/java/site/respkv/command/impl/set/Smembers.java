package site.respkv.command.impl.set;

import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandType;
import site.respkv.datastructure.RedisBytes;
import site.respkv.datastructure.RedisSet;
import site.respkv.datastructure.RedisType;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespArray;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

import java.util.ArrayList;
import java.util.List;

public class Smembers extends AbstractCommand {

    public Smembers(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
    }

    @Override
    public Resp handle() {
        final RedisSet set = db().get(arg(1), RedisType.SET);
        if (set == null) {
            return RespArray.EMPTY;
        }
        final List<Resp> reply = new ArrayList<>(set.size());
        for (final RedisBytes member : set.getMembers()) {
            reply.add(bulk(member));
        }
        return RespArray.valueOf(reply);
    }
}
