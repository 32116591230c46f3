package site.respkv.command.impl.key;

import lombok.extern.slf4j.Slf4j;
import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandException;
import site.respkv.command.CommandType;
import site.respkv.protocol.Resp;
import site.respkv.protocol.SimpleString;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

/**
 * FLUSHALL [ASYNC|SYNC]
 */
@Slf4j
public class Flushall extends AbstractCommand {

    public Flushall(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
        if (args.length == 2 && !argIs(1, "ASYNC") && !argIs(1, "SYNC")) {
            throw CommandException.syntax();
        }
    }

    @Override
    public Resp handle() {
        context.getRedisCore().flushAll();
        log.info("所有数据库已清空");
        propagate(commandOf("FLUSHALL"));
        return SimpleString.OK;
    }
}
