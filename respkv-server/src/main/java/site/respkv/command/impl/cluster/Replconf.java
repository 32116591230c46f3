package site.respkv.command.impl.cluster;

import site.respkv.cluster.replication.ReplicationManager;
import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandException;
import site.respkv.command.CommandType;
import site.respkv.protocol.Resp;
import site.respkv.protocol.SimpleString;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

/**
 * REPLCONF，从节点握手和确认偏移量。
 *
 * <p>{@code REPLCONF ACK <offset>} 不回复。
 */
public class Replconf extends AbstractCommand {

    public Replconf(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
        if (args.length % 2 == 0) {
            throw CommandException.syntax();
        }
    }

    @Override
    public Resp handle() {
        for (int i = 1; i < args.length; i += 2) {
            if (argIs(i, "listening-port")) {
                final long port = parseLong(i + 1);
                if (port < 0 || port > 65535) {
                    throw CommandException.outOfRange("port");
                }
                session.setListeningPort((int) port);
            } else if (argIs(i, "ack")) {
                final long offset = parseLong(i + 1);
                final ReplicationManager manager = context.getReplicationManager();
                if (manager != null && session.getChannel() != null) {
                    manager.handleAck(session.getChannel(), offset);
                }
                return null;
            } else if (!argIs(i, "capa") && !argIs(i, "getack")) {
                throw new CommandException("Unrecognized REPLCONF option: " + argString(i));
            }
        }
        return SimpleString.OK;
    }
}
