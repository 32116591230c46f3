package site.respkv.command.impl.server;

import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandException;
import site.respkv.command.CommandType;
import site.respkv.datastructure.RedisBytes;
import site.respkv.internal.GlobMatcher;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespArray;
import site.respkv.server.config.RedisServerConfig;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CONFIG GET pattern [pattern ...]，只读地暴露部分配置项
 */
public class ConfigGet extends AbstractCommand {

    public ConfigGet(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
        if (!argIs(1, "GET")) {
            throw new CommandException("unknown subcommand '" + argString(1) + "'. Try CONFIG GET.");
        }
        if (args.length < 3) {
            throw CommandException.wrongArity("config|get");
        }
    }

    @Override
    public Resp handle() {
        final Map<String, String> params = parameters();
        final List<Resp> reply = new ArrayList<>();
        for (final Map.Entry<String, String> entry : params.entrySet()) {
            final byte[] name = RedisBytes.fromString(entry.getKey()).getBytesUnsafe();
            for (int i = 2; i < args.length; i++) {
                final byte[] pattern = RedisBytes.fromString(argString(i).toLowerCase()).getBytesUnsafe();
                if (GlobMatcher.matches(pattern, name)) {
                    reply.add(BulkString.fromString(entry.getKey()));
                    reply.add(BulkString.fromString(entry.getValue()));
                    break;
                }
            }
        }
        return RespArray.valueOf(reply);
    }

    private Map<String, String> parameters() {
        final RedisServerConfig config = context.getConfig();
        final Map<String, String> params = new LinkedHashMap<>();
        params.put("dir", config.getDir());
        params.put("dbfilename", config.getRdbFileName());
        params.put("port", String.valueOf(context.getServerPort()));
        params.put("bind", config.getHost());
        params.put("databases", String.valueOf(config.getDatabaseCount()));
        params.put("replicaof", config.isReplica()
                ? config.getReplicaOfHost() + " " + config.getReplicaOfPort() : "");
        params.put("repl-backlog-size", String.valueOf(config.getReplBacklogSize()));
        params.put("appendonly", "no");
        return params;
    }
}
