package site.respkv.command.impl.set;

import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandType;
import site.respkv.database.RedisDB;
import site.respkv.datastructure.RedisBytes;
import site.respkv.datastructure.RedisSet;
import site.respkv.datastructure.RedisType;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespInteger;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

public class Sadd extends AbstractCommand {

    public Sadd(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
    }

    @Override
    public Resp handle() {
        final RedisDB db = db();
        final RedisBytes key = arg(1);
        RedisSet set = db.get(key, RedisType.SET);
        final boolean created = set == null;
        if (created) {
            set = new RedisSet();
        }
        int added = 0;
        for (int i = 2; i < args.length; i++) {
            if (set.add(arg(i))) {
                added++;
            }
        }
        if (created) {
            db.put(key, set);
        } else if (added > 0) {
            db.touch(key);
        }
        if (added > 0) {
            propagateAsIs();
        }
        return RespInteger.valueOf(added);
    }
}
