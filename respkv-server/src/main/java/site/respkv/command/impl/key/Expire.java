package site.respkv.command.impl.key;

import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandException;
import site.respkv.command.CommandType;
import site.respkv.datastructure.RedisBytes;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespInteger;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

/**
 * EXPIRE、PEXPIRE、EXPIREAT、PEXPIREAT。
 *
 * <p>四种形式都换算成毫秒级绝对时间戳，传播为 PEXPIREAT，
 * 使从节点与主节点在同一时刻过期；时间已过去时键被删除并传播 DEL。
 */
public class Expire extends AbstractCommand {

    private RedisBytes key;

    private long amount;

    public Expire(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
        key = arg(1);
        amount = parseLong(2);
    }

    @Override
    public Resp handle() {
        final long expireAt = toAbsoluteMillis(System.currentTimeMillis());
        if (!db().expire(key, expireAt)) {
            return RespInteger.ZERO;
        }
        if (expireAt <= System.currentTimeMillis()) {
            propagate(commandOf("DEL", key));
        } else {
            propagate(commandOf("PEXPIREAT", key, expireAt));
        }
        return RespInteger.ONE;
    }

    private long toAbsoluteMillis(final long now) {
        try {
            switch (type) {
                case EXPIRE:
                    return Math.addExact(now, Math.multiplyExact(amount, 1000L));
                case PEXPIRE:
                    return Math.addExact(now, amount);
                case EXPIREAT:
                    return Math.multiplyExact(amount, 1000L);
                default:
                    return amount;
            }
        } catch (ArithmeticException e) {
            throw new CommandException("invalid expire time in '" + type.getCommandName().toLowerCase() + "' command");
        }
    }
}
