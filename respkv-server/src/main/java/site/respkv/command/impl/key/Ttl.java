package site.respkv.command.impl.key;

import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandType;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespInteger;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

/**
 * TTL、PTTL；-2表示键不存在，-1表示没有过期时间
 */
public class Ttl extends AbstractCommand {

    public Ttl(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
    }

    @Override
    public Resp handle() {
        final long pttl = db().pttl(arg(1));
        if (pttl < 0 || type == CommandType.PTTL) {
            return RespInteger.valueOf(pttl);
        }
        // 四舍五入到秒
        return RespInteger.valueOf((pttl + 500) / 1000);
    }
}
