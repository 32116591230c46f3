package site.respkv.server;

import site.respkv.core.RedisCore;
import site.respkv.rdb.RdbManager;
import site.respkv.server.context.RedisContext;

/**
 * Redis服务器核心接口，定义了服务器的生命周期和主要组件的访问方式。
 *
 * @since 1.0.0
 */
public interface RedisServer {

    /**
     * 启动服务器：加载快照文件、绑定端口、按配置确定主从角色并启动后台任务。
     *
     * @throws IllegalStateException 快照文件损坏或端口绑定失败
     */
    void start();

    /**
     * 优雅停止服务器：停止接受连接、断开复制链路、停止后台任务，
     * 启用持久化时最后保存一次快照。重复调用没有效果。
     */
    void stop();

    /**
     * @return 实际监听的端口，启动前为配置的端口
     */
    int getPort();

    RdbManager getRdbManager();

    RedisCore getRedisCore();

    RedisContext getRedisContext();
}
