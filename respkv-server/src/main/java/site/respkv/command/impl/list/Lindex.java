package site.respkv.command.impl.list;

import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandType;
import site.respkv.datastructure.RedisBytes;
import site.respkv.datastructure.RedisList;
import site.respkv.datastructure.RedisType;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.Resp;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

public class Lindex extends AbstractCommand {

    private long index;

    public Lindex(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
        index = parseLong(2);
    }

    @Override
    public Resp handle() {
        final RedisList list = db().get(arg(1), RedisType.LIST);
        if (list == null) {
            return BulkString.NULL;
        }
        final RedisBytes element = list.index(index);
        return element == null ? BulkString.NULL : bulk(element);
    }
}
