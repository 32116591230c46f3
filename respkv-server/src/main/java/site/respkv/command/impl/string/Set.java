package site.respkv.command.impl.string;

import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandException;
import site.respkv.command.CommandType;
import site.respkv.database.RedisDB;
import site.respkv.datastructure.RedisBytes;
import site.respkv.datastructure.RedisData;
import site.respkv.datastructure.RedisString;
import site.respkv.datastructure.RedisType;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.Resp;
import site.respkv.protocol.SimpleString;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

/**
 * SET key value [NX|XX] [EX s|PX ms|EXAT ts|PXAT ts|KEEPTTL] [GET]
 *
 * <p>过期时间统一换算成绝对毫秒时间戳，传播形式为 {@code SET key value [PXAT ts]}；
 * 条件不满足而未写入时不传播。
 */
public class Set extends AbstractCommand {

    private RedisBytes key;

    private RedisBytes value;

    private boolean nx;

    private boolean xx;

    private boolean get;

    private boolean keepTtl;

    /** 过期选项，null表示没有 */
    private String expireUnit;

    private long expireAmount;

    public Set(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
        key = arg(1);
        value = arg(2);
        for (int i = 3; i < args.length; i++) {
            final String option = argString(i).toUpperCase();
            switch (option) {
                case "NX":
                    nx = true;
                    break;
                case "XX":
                    xx = true;
                    break;
                case "GET":
                    get = true;
                    break;
                case "KEEPTTL":
                    if (expireUnit != null) {
                        throw CommandException.syntax();
                    }
                    keepTtl = true;
                    break;
                case "EX":
                case "PX":
                case "EXAT":
                case "PXAT":
                    if (expireUnit != null || keepTtl || i + 1 >= args.length) {
                        throw CommandException.syntax();
                    }
                    expireUnit = option;
                    expireAmount = parseLong(++i);
                    if (expireAmount <= 0) {
                        throw new CommandException("invalid expire time in 'set' command");
                    }
                    break;
                default:
                    throw CommandException.syntax();
            }
        }
        if (nx && xx) {
            throw CommandException.syntax();
        }
    }

    @Override
    public Resp handle() {
        final RedisDB db = db();
        final RedisData existing = db.get(key);
        // 1. GET 选项要求旧值是字符串，先校验再写入
        if (get && existing != null && existing.type() != RedisType.STRING) {
            throw CommandException.wrongType();
        }
        final Resp oldValue = get
                ? (existing == null ? BulkString.NULL : bulk(((RedisString) existing).getValue()))
                : null;

        // 2. 条件判断
        if ((nx && existing != null) || (xx && existing == null)) {
            return get ? oldValue : BulkString.NULL;
        }

        // 3. 计算过期时间
        final long now = System.currentTimeMillis();
        long expireAt = -1;
        if (expireUnit != null) {
            expireAt = toAbsoluteMillis(now);
        } else if (keepTtl && existing != null) {
            expireAt = existing.expireAt();
        }

        // 4. 写入并传播
        if (expireAt >= 0 && expireAt <= now) {
            // 已经过期的写入等价于删除
            if (db.delete(key) != null) {
                propagate(commandOf("DEL", key));
            }
        } else {
            final RedisString string = new RedisString(value);
            string.setExpireAt(expireAt);
            db.put(key, string);
            if (expireAt >= 0) {
                propagate(commandOf("SET", key, value, "PXAT", expireAt));
            } else {
                propagate(commandOf("SET", key, value));
            }
        }
        return get ? oldValue : SimpleString.OK;
    }

    private long toAbsoluteMillis(final long now) {
        try {
            switch (expireUnit) {
                case "EX":
                    return Math.addExact(now, Math.multiplyExact(expireAmount, 1000L));
                case "PX":
                    return Math.addExact(now, expireAmount);
                case "EXAT":
                    return Math.multiplyExact(expireAmount, 1000L);
                default:
                    return expireAmount;
            }
        } catch (ArithmeticException e) {
            throw new CommandException("invalid expire time in 'set' command");
        }
    }
}
