package site.respkv.command.impl.string;

import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandException;
import site.respkv.command.CommandType;
import site.respkv.database.RedisDB;
import site.respkv.datastructure.RedisBytes;
import site.respkv.datastructure.RedisString;
import site.respkv.datastructure.RedisType;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespInteger;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

/**
 * INCR、DECR、INCRBY、DECRBY。不存在的键从0开始，保留原有的过期时间。
 */
public class Incr extends AbstractCommand {

    private RedisBytes key;

    private long delta;

    public Incr(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
        key = arg(1);
        switch (type) {
            case INCR:
                delta = 1;
                break;
            case DECR:
                delta = -1;
                break;
            case INCRBY:
                delta = parseLong(2);
                break;
            default:
                final long amount = parseLong(2);
                if (amount == Long.MIN_VALUE) {
                    throw CommandException.overflow();
                }
                delta = -amount;
                break;
        }
    }

    @Override
    public Resp handle() {
        final RedisDB db = db();
        final RedisString current = db.get(key, RedisType.STRING);
        final long next;
        if (current == null) {
            next = delta;
            db.put(key, new RedisString(RedisBytes.fromLong(next)));
        } else {
            try {
                next = current.incrBy(delta);
            } catch (NumberFormatException e) {
                throw CommandException.notInteger();
            } catch (ArithmeticException e) {
                throw CommandException.overflow();
            }
            db.touch(key);
        }
        propagateAsIs();
        return RespInteger.valueOf(next);
    }
}
