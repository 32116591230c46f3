package site.respkv.command.impl.cluster;

import lombok.extern.slf4j.Slf4j;
import site.respkv.cluster.replication.ReplicationManager;
import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandException;
import site.respkv.command.CommandType;
import site.respkv.protocol.Resp;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

/**
 * PSYNC replid offset
 *
 * <p>回复（FULLRESYNC 加快照，或 CONTINUE 加积压数据）由复制管理器直接写出，
 * 之后本连接成为从节点连接，只接收复制流。
 */
@Slf4j
public class Psync extends AbstractCommand {

    private String replicationId;

    private long offset;

    public Psync(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
        replicationId = argString(1);
        offset = parseLong(2);
    }

    @Override
    public Resp handle() {
        final ReplicationManager manager = context.getReplicationManager();
        if (manager == null) {
            throw new CommandException("PSYNC is not allowed on a replica");
        }
        if (session.getChannel() == null) {
            throw new CommandException("PSYNC requires a client connection");
        }
        session.setReplicaLink(true);
        log.info("收到从节点 {} 的同步请求 (replid={}, offset={})", session, replicationId, offset);
        manager.handlePsync(session.getChannel(), replicationId, offset, session.getListeningPort());
        return null;
    }
}
