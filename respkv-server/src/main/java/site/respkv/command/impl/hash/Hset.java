package site.respkv.command.impl.hash;

import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandException;
import site.respkv.command.CommandType;
import site.respkv.database.RedisDB;
import site.respkv.datastructure.RedisBytes;
import site.respkv.datastructure.RedisHash;
import site.respkv.datastructure.RedisType;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespInteger;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

/**
 * HSET key field value [field value ...]，返回新增字段数
 */
public class Hset extends AbstractCommand {

    public Hset(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
        if (args.length % 2 != 0) {
            throw CommandException.wrongArity(type.getCommandName());
        }
    }

    @Override
    public Resp handle() {
        final RedisDB db = db();
        final RedisBytes key = arg(1);
        RedisHash hash = db.get(key, RedisType.HASH);
        final boolean created = hash == null;
        if (created) {
            hash = new RedisHash();
        }
        int added = 0;
        for (int i = 2; i < args.length; i += 2) {
            if (hash.put(arg(i), arg(i + 1))) {
                added++;
            }
        }
        if (created) {
            db.put(key, hash);
        } else {
            db.touch(key);
        }
        propagateAsIs();
        return RespInteger.valueOf(added);
    }
}
