package site.respkv.command.impl.hash;

import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandException;
import site.respkv.command.CommandType;
import site.respkv.database.RedisDB;
import site.respkv.datastructure.RedisBytes;
import site.respkv.datastructure.RedisHash;
import site.respkv.datastructure.RedisString;
import site.respkv.datastructure.RedisType;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespInteger;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

/**
 * HINCRBY key field increment
 */
public class Hincrby extends AbstractCommand {

    private long delta;

    public Hincrby(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
        delta = parseLong(3);
    }

    @Override
    public Resp handle() {
        final RedisDB db = db();
        final RedisBytes key = arg(1);
        final RedisBytes field = arg(2);
        final RedisHash existing = db.get(key, RedisType.HASH);
        final RedisHash hash = existing == null ? new RedisHash() : existing;

        // 1. 先算出新值，失败时哈希保持原样
        long current = 0;
        final RedisBytes old = hash.get(field);
        if (old != null) {
            try {
                current = RedisString.parseStrictLong(old);
            } catch (NumberFormatException e) {
                throw new CommandException("hash value is not an integer");
            }
        }
        final long next;
        try {
            next = Math.addExact(current, delta);
        } catch (ArithmeticException e) {
            throw CommandException.overflow();
        }

        // 2. 写入
        hash.put(field, RedisBytes.fromLong(next));
        if (existing == null) {
            db.put(key, hash);
        } else {
            db.touch(key);
        }
        propagateAsIs();
        return RespInteger.valueOf(next);
    }
}
