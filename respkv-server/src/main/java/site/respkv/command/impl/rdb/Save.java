package site.respkv.command.impl.rdb;

import lombok.extern.slf4j.Slf4j;
import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandException;
import site.respkv.command.CommandType;
import site.respkv.protocol.Resp;
import site.respkv.protocol.SimpleString;
import site.respkv.rdb.RdbManager;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

import java.io.IOException;

/**
 * SAVE，同步写快照文件
 */
@Slf4j
public class Save extends AbstractCommand {

    public Save(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
    }

    @Override
    public Resp handle() {
        final RdbManager rdbManager = context.getRdbManager();
        if (rdbManager.isBgSaveInProgress()) {
            throw new CommandException("Background save already in progress");
        }
        try {
            rdbManager.save();
            return SimpleString.OK;
        } catch (IOException e) {
            log.error("SAVE 失败", e);
            throw new CommandException("Failed to save: " + e.getMessage());
        }
    }
}
