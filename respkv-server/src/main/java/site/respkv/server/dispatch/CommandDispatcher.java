package site.respkv.server.dispatch;

import lombok.extern.slf4j.Slf4j;
import site.respkv.cluster.replication.PropagatedCommand;
import site.respkv.cluster.replication.ReplicationManager;
import site.respkv.command.Command;
import site.respkv.command.CommandException;
import site.respkv.command.CommandFlag;
import site.respkv.command.CommandType;
import site.respkv.core.KeyLockManager;
import site.respkv.database.WrongTypeException;
import site.respkv.datastructure.RedisBytes;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespArray;
import site.respkv.protocol.SimpleString;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

import java.util.List;

/**
 * 命令调度器，所有连接（包括主节点复制流）的请求都从这里进入。
 *
 * <p>处理顺序：
 * <ol>
 *   <li>按命令表查找命令并检查参数个数</li>
 *   <li>从节点拒绝普通客户端的写命令</li>
 *   <li>解析参数</li>
 *   <li>事务中除事务控制命令外一律排队</li>
 *   <li>按命令声明的键加锁，执行</li>
 *   <li>在释放锁之前把传播形式交给复制管理器，保证复制流与执行顺序一致</li>
 * </ol>
 *
 * <p>排队阶段的错误会使事务在 EXEC 时被放弃。
 *
 * @since 1.0.0
 */
@Slf4j
public class CommandDispatcher {

    private final RedisContext context;

    public CommandDispatcher(final RedisContext context) {
        this.context = context;
    }

    /**
     * 执行一个请求
     *
     * @param session 发起请求的会话
     * @param request 命令数组
     * @return 回复；回复已由别处写出或将稍后投递时返回null
     */
    public Resp dispatch(final ClientSession session, final RespArray request) {
        try {
            return doDispatch(session, request);
        } catch (CommandException e) {
            return e.toErrors();
        } catch (RuntimeException e) {
            if (!(e instanceof WrongTypeException)) {
                log.error("{} 执行命令时发生未预期的错误", session, e);
            }
            return CommandException.toReply(e);
        }
    }

    private Resp doDispatch(final ClientSession session, final RespArray request) {
        // 1. 校验请求格式
        final Resp[] array = request.getContent();
        if (array == null || array.length == 0) {
            throw new CommandException("empty command");
        }
        for (final Resp part : array) {
            if (!(part instanceof BulkString) || ((BulkString) part).isNull()) {
                session.markDirty();
                throw new CommandException("Protocol error: expected bulk string");
            }
        }

        // 2. 查找命令
        final RedisBytes name = ((BulkString) array[0]).getContent();
        final CommandType type = CommandType.findByBytes(name);
        if (type == null) {
            session.markDirty();
            throw CommandException.unknownCommand(name.getString(), array);
        }
        if (!type.checkArity(array.length)) {
            session.markDirty();
            throw CommandException.wrongArity(type.getCommandName());
        }

        // 3. 从节点只接受主节点的写入
        if (type.isWrite() && context.isReplica() && !session.isMasterLink()) {
            session.markDirty();
            throw CommandException.readonly();
        }

        // 4. 解析参数
        final Command command = type.createCommand(context, session);
        final boolean queueing = session.isInMulti() && !type.hasFlag(CommandFlag.NO_MULTI);
        try {
            command.setContext(array);
        } catch (CommandException e) {
            if (queueing) {
                session.markDirty();
            }
            throw e;
        }

        // 5. 事务排队
        if (queueing) {
            session.queue(command);
            return SimpleString.QUEUED;
        }

        // 6. 加锁执行
        return execute(session, command);
    }

    private Resp execute(final ClientSession session, final Command command) {
        final KeyLockManager.LockRequest request = context.getRedisCore().getLockManager().request();
        command.collectLocks(request);
        try (KeyLockManager.LockHandle ignored = request.acquire()) {
            final Resp reply = command.handle();
            propagate(command);
            if (log.isDebugEnabled()) {
                log.debug("{} 执行 {}，传播 {} 条", session, command.getType(), command.getPropagated().size());
            }
            return reply;
        }
    }

    private void propagate(final Command command) {
        final List<PropagatedCommand> propagated = command.getPropagated();
        if (propagated.isEmpty()) {
            return;
        }
        final ReplicationManager manager = context.getReplicationManager();
        if (manager == null) {
            return;
        }
        if (command.getType() == CommandType.EXEC) {
            manager.propagateTransaction(propagated);
            return;
        }
        for (final PropagatedCommand entry : propagated) {
            manager.propagate(entry.getDbIndex(), entry.getCommand());
        }
    }
}
