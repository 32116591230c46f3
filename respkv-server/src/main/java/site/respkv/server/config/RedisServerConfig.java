package site.respkv.server.config;

import lombok.Builder;
import lombok.Data;

/**
 * 服务器配置
 *
 * @since 1.0.0
 */
@Data
@Builder
public class RedisServerConfig {

    // ========== 网络配置 ==========

    @Builder.Default
    private String host = "0.0.0.0";

    /** 0表示由系统分配 */
    @Builder.Default
    private int port = 6379;

    @Builder.Default
    private int backlogSize = 1024;

    @Builder.Default
    private int receiveBufferSize = 32 * 1024;

    @Builder.Default
    private int sendBufferSize = 32 * 1024;

    // ========== 线程配置 ==========

    @Builder.Default
    private int bossThreadCount = 1;

    @Builder.Default
    private int workerThreadCount = Runtime.getRuntime().availableProcessors() * 2;

    @Builder.Default
    private int commandExecutorThreadCount = Runtime.getRuntime().availableProcessors();

    // ========== 数据库配置 ==========

    @Builder.Default
    private int databaseCount = 16;

    @Builder.Default
    private int lockStripes = 1024;

    @Builder.Default
    private long activeExpireIntervalMillis = 100;

    @Builder.Default
    private int activeExpireSampleSize = 20;

    // ========== 持久化配置 ==========

    @Builder.Default
    private boolean rdbEnabled = true;

    @Builder.Default
    private String dir = ".";

    @Builder.Default
    private String rdbFileName = "dump.rdb";

    // ========== 复制配置 ==========

    /** 主节点地址，为null时本节点是主节点 */
    private String replicaOfHost;

    private int replicaOfPort;

    @Builder.Default
    private int replBacklogSize = 1024 * 1024;

    @Builder.Default
    private int replPingPeriodSeconds = 10;

    @Builder.Default
    private long replicaAckPeriodMillis = 1000;

    // ========== 工厂方法 ==========

    public static RedisServerConfig defaultConfig() {
        return RedisServerConfig.builder().build();
    }

    public boolean isReplica() {
        return replicaOfHost != null;
    }

    /**
     * 解析命令行参数
     *
     * <p>支持 --host、--port/-p、--databases、--dir、--dbfilename、
     * --replicaof "host port"、--repl-backlog-size，以及 --no-rdb 关闭快照文件。
     *
     * @param args 命令行参数
     * @return 配置
     * @throws IllegalArgumentException 参数无法识别或取值不合法
     */
    public static RedisServerConfig fromArgs(final String[] args) {
        final RedisServerConfig config = defaultConfig();
        for (int i = 0; i < args.length; i++) {
            final String flag = args[i];
            switch (flag) {
                case "--host":
                    config.setHost(value(args, ++i, flag));
                    break;
                case "--port":
                case "-p":
                    config.setPort(intValue(args, ++i, flag));
                    break;
                case "--databases":
                    config.setDatabaseCount(intValue(args, ++i, flag));
                    break;
                case "--dir":
                    config.setDir(value(args, ++i, flag));
                    break;
                case "--dbfilename":
                    config.setRdbFileName(value(args, ++i, flag));
                    break;
                case "--no-rdb":
                    config.setRdbEnabled(false);
                    break;
                case "--repl-backlog-size":
                    config.setReplBacklogSize(intValue(args, ++i, flag));
                    break;
                case "--replicaof":
                    parseReplicaOf(config, args, ++i);
                    // "host port" 也可以拆成两个参数
                    if (config.getReplicaOfPort() == 0) {
                        config.setReplicaOfPort(intValue(args, ++i, flag));
                    }
                    break;
                default:
                    throw new IllegalArgumentException("未知参数: " + flag);
            }
        }
        config.validate();
        return config;
    }

    private static void parseReplicaOf(final RedisServerConfig config, final String[] args, final int index) {
        final String[] parts = value(args, index, "--replicaof").trim().split("\\s+");
        config.setReplicaOfHost(parts[0]);
        if (parts.length > 1) {
            config.setReplicaOfPort(parsePort(parts[1], "--replicaof"));
        }
    }

    private static String value(final String[] args, final int index, final String flag) {
        if (index >= args.length) {
            throw new IllegalArgumentException("参数 " + flag + " 缺少取值");
        }
        return args[index];
    }

    private static int intValue(final String[] args, final int index, final String flag) {
        return parsePort(value(args, index, flag), flag);
    }

    private static int parsePort(final String text, final String flag) {
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("参数 " + flag + " 需要整数: " + text, e);
        }
    }

    /**
     * 检查配置取值范围
     *
     * @throws IllegalArgumentException 取值不合法
     */
    public void validate() {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("端口号必须在0-65535范围内");
        }
        if (databaseCount <= 0) {
            throw new IllegalArgumentException("数据库数量必须大于0");
        }
        if (bossThreadCount <= 0 || workerThreadCount <= 0 || commandExecutorThreadCount <= 0) {
            throw new IllegalArgumentException("线程数量必须大于0");
        }
        if (backlogSize <= 0 || receiveBufferSize <= 0 || sendBufferSize <= 0) {
            throw new IllegalArgumentException("缓冲区大小必须大于0");
        }
        if (lockStripes <= 0) {
            throw new IllegalArgumentException("锁分段数必须大于0");
        }
        if (replBacklogSize <= 0) {
            throw new IllegalArgumentException("复制积压缓冲区大小必须大于0");
        }
        if (replPingPeriodSeconds <= 0 || replicaAckPeriodMillis <= 0 || activeExpireIntervalMillis <= 0) {
            throw new IllegalArgumentException("周期必须大于0");
        }
        if (rdbEnabled && (rdbFileName == null || rdbFileName.trim().isEmpty())) {
            throw new IllegalArgumentException("启用RDB时必须指定RDB文件名");
        }
        if (replicaOfHost != null && (replicaOfPort <= 0 || replicaOfPort > 65535)) {
            throw new IllegalArgumentException("主节点端口必须在1-65535范围内");
        }
    }
}
