package site.respkv.command.impl.connection;

import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandType;
import site.respkv.protocol.Resp;
import site.respkv.protocol.SimpleString;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

/**
 * QUIT，回复 OK 后由连接处理器关闭连接
 */
public class Quit extends AbstractCommand {

    public Quit(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
    }

    @Override
    public Resp handle() {
        session.setCloseRequested(true);
        return SimpleString.OK;
    }
}
