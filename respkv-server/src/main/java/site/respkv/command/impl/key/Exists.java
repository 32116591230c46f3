package site.respkv.command.impl.key;

import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandType;
import site.respkv.database.RedisDB;
import site.respkv.datastructure.RedisBytes;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespInteger;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

/**
 * EXISTS key [key ...]，重复的键重复计数
 */
public class Exists extends AbstractCommand {

    public Exists(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
    }

    @Override
    public Resp handle() {
        final RedisDB db = db();
        long count = 0;
        for (final RedisBytes key : keys()) {
            if (db.exists(key)) {
                count++;
            }
        }
        return RespInteger.valueOf(count);
    }
}
