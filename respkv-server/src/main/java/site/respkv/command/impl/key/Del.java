package site.respkv.command.impl.key;

import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandType;
import site.respkv.database.RedisDB;
import site.respkv.datastructure.RedisBytes;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespArray;
import site.respkv.protocol.RespInteger;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

import java.util.ArrayList;
import java.util.List;

/**
 * DEL key [key ...]，只传播实际删除的键
 */
public class Del extends AbstractCommand {

    public Del(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
    }

    @Override
    public Resp handle() {
        final RedisDB db = db();
        final List<RedisBytes> deleted = new ArrayList<>();
        deleted.add(RedisBytes.fromString("DEL"));
        for (final RedisBytes key : keys()) {
            if (db.delete(key) != null) {
                deleted.add(key);
            }
        }
        final int count = deleted.size() - 1;
        if (count > 0) {
            propagate(RespArray.command(deleted));
        }
        return RespInteger.valueOf(count);
    }
}
