package site.respkv.command.impl.transaction;

import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandException;
import site.respkv.command.CommandType;
import site.respkv.database.RedisDB;
import site.respkv.datastructure.RedisBytes;
import site.respkv.protocol.Resp;
import site.respkv.protocol.SimpleString;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

/**
 * WATCH key [key ...]，在共享锁下记录键的当前版本
 */
public class Watch extends AbstractCommand {

    public Watch(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
    }

    @Override
    public Resp handle() {
        if (session.isInMulti()) {
            throw new CommandException("WATCH inside MULTI is not allowed");
        }
        final RedisDB db = db();
        for (final RedisBytes key : keys()) {
            session.watch(context.getRedisCore(), db.getId(), key, db.keyVersion(key));
        }
        return SimpleString.OK;
    }
}
