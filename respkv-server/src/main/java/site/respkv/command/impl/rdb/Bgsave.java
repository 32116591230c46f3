package site.respkv.command.impl.rdb;

import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandException;
import site.respkv.command.CommandType;
import site.respkv.protocol.Resp;
import site.respkv.protocol.SimpleString;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

/**
 * BGSAVE [SCHEDULE]，在锁内生成内存快照，写文件在后台完成
 */
public class Bgsave extends AbstractCommand {

    private static final SimpleString STARTED = new SimpleString("Background saving started");

    public Bgsave(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
        if (args.length == 2 && !argIs(1, "SCHEDULE")) {
            throw CommandException.syntax();
        }
    }

    @Override
    public Resp handle() {
        if (context.getRdbManager().bgSave() == null) {
            throw new CommandException("Background save already in progress");
        }
        return STARTED;
    }
}
