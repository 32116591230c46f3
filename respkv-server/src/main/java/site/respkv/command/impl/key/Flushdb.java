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
 * FLUSHDB [ASYNC|SYNC]，两种模式都同步清空
 */
@Slf4j
public class Flushdb extends AbstractCommand {

    public Flushdb(final CommandType type, final RedisContext context, final ClientSession session) {
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
        db().clear();
        log.info("数据库 {} 已清空", session.getDbIndex());
        propagate(commandOf("FLUSHDB"));
        return SimpleString.OK;
    }
}
