package site.respkv.command.impl.transaction;

import lombok.extern.slf4j.Slf4j;
import site.respkv.cluster.replication.PropagatedCommand;
import site.respkv.command.AbstractCommand;
import site.respkv.command.Command;
import site.respkv.command.CommandException;
import site.respkv.command.CommandType;
import site.respkv.command.impl.connection.Select;
import site.respkv.core.KeyLockManager;
import site.respkv.core.RedisCore;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespArray;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * EXEC，在一次加锁内依次执行排队的命令。
 *
 * <p>锁覆盖队列中所有命令的键和被监视的键，因此版本检查与执行之间不会插入其他写入。
 * 排队阶段出错时回复 EXECABORT；被监视的键版本变化时回复空数组，什么也不执行。
 * 单条命令的执行错误作为回复数组中的错误元素，不影响其余命令。
 * 执行产生的传播命令以 MULTI/EXEC 包裹整体传播。
 */
@Slf4j
public class Exec extends AbstractCommand {

    public Exec(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
    }

    @Override
    public void collectLocks(final KeyLockManager.LockRequest request, final int dbIndex) {
        // 1. 每条排队命令按自己的规则加锁，SELECT 改变后续命令的数据库
        int current = dbIndex;
        for (final Command command : session.getQueued()) {
            if (command instanceof Select) {
                current = ((Select) command).getIndex();
                continue;
            }
            command.collectLocks(request, current);
        }

        // 2. 被监视的键
        for (final ClientSession.WatchedKey watched : session.getWatchedKeys().keySet()) {
            request.add(watched.getDbIndex(), watched.getKey(), false);
        }
    }

    @Override
    public Resp handle() {
        if (!session.isInMulti()) {
            throw CommandException.withoutMulti("EXEC");
        }
        final RedisCore core = context.getRedisCore();
        try {
            if (session.isDirty()) {
                throw CommandException.execAbort();
            }
            if (watchedKeyChanged(core)) {
                log.debug("{} 监视的键已被修改，事务放弃", session);
                return RespArray.NULL;
            }
            return execute();
        } finally {
            session.endMulti();
            session.unwatchAll(core);
        }
    }

    private boolean watchedKeyChanged(final RedisCore core) {
        for (final Map.Entry<ClientSession.WatchedKey, Long> entry : session.getWatchedKeys().entrySet()) {
            final ClientSession.WatchedKey watched = entry.getKey();
            if (core.getDB(watched.getDbIndex()).keyVersion(watched.getKey()) != entry.getValue()) {
                return true;
            }
        }
        return false;
    }

    private Resp execute() {
        final List<Command> queued = new ArrayList<>(session.getQueued());
        final Resp[] replies = new Resp[queued.size()];
        final List<PropagatedCommand> propagated = new ArrayList<>();
        session.setExecutingTransaction(true);
        try {
            for (int i = 0; i < replies.length; i++) {
                final Command command = queued.get(i);
                try {
                    final Resp reply = command.handle();
                    replies[i] = reply == null ? RespArray.NULL : reply;
                } catch (RuntimeException e) {
                    replies[i] = CommandException.toReply(e);
                }
                propagated.addAll(command.getPropagated());
            }
        } finally {
            session.setExecutingTransaction(false);
        }
        propagateAll(propagated);
        return new RespArray(replies);
    }
}
