package site.respkv.command.impl.connection;

import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandException;
import site.respkv.command.CommandType;
import site.respkv.protocol.Resp;
import site.respkv.protocol.SimpleString;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

/**
 * SELECT index，切换会话的当前数据库
 */
public class Select extends AbstractCommand {

    private int index;

    public Select(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
        final long value = parseLong(1);
        if (value < 0 || value >= context.getRedisCore().getDBNum()) {
            throw CommandException.outOfRange("DB index");
        }
        index = (int) value;
    }

    public int getIndex() {
        return index;
    }

    @Override
    public Resp handle() {
        session.setDbIndex(index);
        return SimpleString.OK;
    }
}
