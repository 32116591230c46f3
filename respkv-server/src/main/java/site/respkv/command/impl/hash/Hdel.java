package site.respkv.command.impl.hash;

import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandType;
import site.respkv.database.RedisDB;
import site.respkv.datastructure.RedisBytes;
import site.respkv.datastructure.RedisHash;
import site.respkv.datastructure.RedisType;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespInteger;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

public class Hdel extends AbstractCommand {

    public Hdel(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
    }

    @Override
    public Resp handle() {
        final RedisDB db = db();
        final RedisBytes key = arg(1);
        final RedisHash hash = db.get(key, RedisType.HASH);
        if (hash == null) {
            return RespInteger.ZERO;
        }
        int removed = 0;
        for (int i = 2; i < args.length; i++) {
            if (hash.delete(arg(i))) {
                removed++;
            }
        }
        if (removed > 0) {
            db.touch(key);
            db.removeIfEmpty(key, hash);
            propagateAsIs();
        }
        return RespInteger.valueOf(removed);
    }
}
