package site.respkv.command.impl.string;

import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandType;
import site.respkv.database.RedisDB;
import site.respkv.datastructure.RedisBytes;
import site.respkv.datastructure.RedisString;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespInteger;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

/**
 * SETNX key value，写入成功时传播为 SET
 */
public class Setnx extends AbstractCommand {

    public Setnx(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
    }

    @Override
    public Resp handle() {
        final RedisDB db = db();
        final RedisBytes key = arg(1);
        if (db.exists(key)) {
            return RespInteger.ZERO;
        }
        db.put(key, new RedisString(arg(2)));
        propagate(commandOf("SET", key, arg(2)));
        return RespInteger.ONE;
    }
}
