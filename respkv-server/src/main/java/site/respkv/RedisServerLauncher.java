package site.respkv;

import lombok.extern.slf4j.Slf4j;
import site.respkv.server.RedisMiniServer;
import site.respkv.server.RedisServer;
import site.respkv.server.config.RedisServerConfig;

@Slf4j
public class RedisServerLauncher {

    public static void main(final String[] args) {
        final RedisServerConfig config;
        try {
            config = RedisServerConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            log.error("参数错误: {}", e.getMessage());
            System.err.println("用法: --host <host> --port <port> --databases <n> --dir <dir> --dbfilename <file> "
                    + "[--no-rdb] [--replicaof \"<host> <port>\"] [--repl-backlog-size <bytes>]");
            System.exit(1);
            return;
        }

        final RedisServer redisServer = new RedisMiniServer(config);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("正在关闭服务器...");
            try {
                redisServer.stop();
                log.info("服务器已安全关闭");
            } catch (RuntimeException e) {
                log.error("关闭服务器时发生错误", e);
            }
        }, "shutdown-hook"));

        redisServer.start();
    }
}
