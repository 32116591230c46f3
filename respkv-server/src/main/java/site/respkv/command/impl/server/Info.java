package site.respkv.command.impl.server;

import site.respkv.cluster.replication.ReplicaClient;
import site.respkv.cluster.replication.ReplicaInfo;
import site.respkv.cluster.replication.ReplicationManager;
import site.respkv.command.AbstractCommand;
import site.respkv.command.CommandType;
import site.respkv.database.RedisDB;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.Resp;
import site.respkv.rdb.RdbManager;
import site.respkv.server.context.RedisContext;
import site.respkv.server.session.ClientSession;

import java.lang.management.ManagementFactory;
import java.util.List;

/**
 * INFO [section]，支持 server、memory、persistence、stats、replication、keyspace
 */
public class Info extends AbstractCommand {

    private String section;

    public Info(final CommandType type, final RedisContext context, final ClientSession session) {
        super(type, context, session);
    }

    @Override
    protected void parse() {
        section = args.length > 1 ? argString(1).toLowerCase() : "default";
    }

    @Override
    public Resp handle() {
        final StringBuilder info = new StringBuilder();
        if (wants("server")) {
            appendServer(info);
        }
        if (wants("memory")) {
            appendMemory(info);
        }
        if (wants("persistence")) {
            appendPersistence(info);
        }
        if (wants("stats")) {
            appendStats(info);
        }
        if (wants("replication")) {
            appendReplication(info);
        }
        if (wants("keyspace")) {
            appendKeyspace(info);
        }
        return BulkString.fromString(info.toString());
    }

    private boolean wants(final String name) {
        return "default".equals(section) || "all".equals(section) || "everything".equals(section)
                || name.equals(section);
    }

    private static void header(final StringBuilder info, final String title) {
        if (info.length() > 0) {
            info.append("\r\n");
        }
        info.append("# ").append(title).append("\r\n");
    }

    private static void field(final StringBuilder info, final String name, final Object value) {
        info.append(name).append(':').append(value).append("\r\n");
    }

    private void appendServer(final StringBuilder info) {
        header(info, "Server");
        field(info, "redis_version", "7.0.0");
        field(info, "redis_mode", "standalone");
        field(info, "os", System.getProperty("os.name"));
        field(info, "arch_bits", System.getProperty("os.arch"));
        field(info, "process_id", ManagementFactory.getRuntimeMXBean().getPid());
        field(info, "tcp_port", context.getServerPort());
        field(info, "uptime_in_seconds", (System.currentTimeMillis() - context.getStartTime()) / 1000);
    }

    private void appendMemory(final StringBuilder info) {
        header(info, "Memory");
        final Runtime runtime = Runtime.getRuntime();
        final long used = runtime.totalMemory() - runtime.freeMemory();
        field(info, "used_memory", used);
        field(info, "used_memory_human", formatBytes(used));
        field(info, "maxmemory", runtime.maxMemory());
        field(info, "maxmemory_human", formatBytes(runtime.maxMemory()));
    }

    private void appendPersistence(final StringBuilder info) {
        header(info, "Persistence");
        final RdbManager rdbManager = context.getRdbManager();
        field(info, "loading", 0);
        field(info, "rdb_enabled", context.getConfig().isRdbEnabled() ? 1 : 0);
        field(info, "rdb_bgsave_in_progress", rdbManager.isBgSaveInProgress() ? 1 : 0);
        field(info, "rdb_last_save_time", rdbManager.getLastSaveTime());
        field(info, "aof_enabled", 0);
    }

    private void appendStats(final StringBuilder info) {
        header(info, "Stats");
        final ReplicationManager manager = context.getReplicaClient() == null ? context.getReplicationManager() : null;
        field(info, "sync_full", manager == null ? 0 : manager.getSyncFull());
        field(info, "sync_partial_ok", manager == null ? 0 : manager.getSyncPartialOk());
        field(info, "sync_partial_err", manager == null ? 0 : manager.getSyncPartialErr());
    }

    private void appendReplication(final StringBuilder info) {
        header(info, "Replication");
        final ReplicaClient replicaClient = context.getReplicaClient();
        if (replicaClient != null) {
            field(info, "role", "slave");
            field(info, "master_host", replicaClient.getMasterHost());
            field(info, "master_port", replicaClient.getMasterPort());
            field(info, "master_link_status", replicaClient.isLinkUp() ? "up" : "down");
            field(info, "master_replid", replicaClient.getMasterReplId());
            field(info, "slave_repl_offset", replicaClient.getProcessedOffset());
            field(info, "connected_slaves", 0);
            return;
        }
        field(info, "role", "master");
        final ReplicationManager manager = context.getReplicationManager();
        if (manager == null) {
            field(info, "connected_slaves", 0);
            return;
        }
        final List<ReplicaInfo> replicas = manager.getReplicas();
        field(info, "connected_slaves", replicas.size());
        for (int i = 0; i < replicas.size(); i++) {
            final ReplicaInfo replica = replicas.get(i);
            field(info, "slave" + i, "ip=" + replica.getIp() + ",port=" + replica.getListeningPort()
                    + ",state=online,offset=" + replica.getAckOffset()
                    + ",lag=" + (System.currentTimeMillis() - replica.getLastAckTime()) / 1000);
        }
        field(info, "master_replid", manager.getReplicationId());
        field(info, "master_repl_offset", manager.getMasterOffset());
        field(info, "repl_backlog_active", 1);
        field(info, "repl_backlog_size", manager.getBacklog().getBufferSize());
        field(info, "repl_backlog_first_byte_offset", manager.getBacklog().getStartOffset());
    }

    private void appendKeyspace(final StringBuilder info) {
        header(info, "Keyspace");
        final RedisDB[] dataBases = context.getRedisCore().getDataBases();
        for (int i = 0; i < dataBases.length; i++) {
            final int keys = dataBases[i].size();
            if (keys > 0) {
                field(info, "db" + i, "keys=" + keys);
            }
        }
    }

    private static String formatBytes(final long bytes) {
        final String[] units = {"B", "K", "M", "G", "T"};
        int unitIndex = 0;
        double size = bytes;
        while (size >= 1024 && unitIndex < units.length - 1) {
            size /= 1024;
            unitIndex++;
        }
        return String.format("%.2f%s", size, units[unitIndex]);
    }
}
