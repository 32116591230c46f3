package site.respkv.command.impl.cluster;

import site.respkv.cluster.replication.ReplicationManager;
import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandException;
import site.respkv.command.CommandType;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespInteger;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

/**
 * WAIT numreplicas timeout
 *
 * <p>目标偏移量取调用时的主节点偏移量。确认数不够时挂起并请求从节点立即回报，
 * 由 ACK 或超时唤醒，回复确认了目标偏移量的从节点数。
 */
public class Wait extends AbstractCommand {

    private int numReplicas;

    private long timeoutMillis;

    public Wait(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
        final long n = parseLong(1);
        numReplicas = (int) Math.max(0, Math.min(n, Integer.MAX_VALUE));
        timeoutMillis = parseLong(2);
        if (timeoutMillis < 0) {
            throw new CommandException("timeout is negative");
        }
    }

    @Override
    public Resp handle() {
        if (context.isReplica()) {
            throw new CommandException("WAIT cannot be used with replica instances.");
        }
        final ReplicationManager manager = context.getReplicationManager();
        if (manager == null || manager.getReplicas().isEmpty()) {
            return RespInteger.ZERO;
        }
        final long target = manager.getMasterOffset();
        final int acked = manager.countAcked(target);
        if (acked >= numReplicas || session.isExecutingTransaction()) {
            return RespInteger.valueOf(acked);
        }
        context.getBlockingCoordinator().waitForReplicas(session, numReplicas, target, timeoutMillis);
        manager.requestAcks();
        return null;
    }
}
