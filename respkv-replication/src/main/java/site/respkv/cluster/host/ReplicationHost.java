package site.respkv.cluster.host;

import site.respkv.protocol.RespArray;

import java.io.IOException;
import java.util.function.Supplier;

/**
 * 复制模块对所在服务器的回调接口
 *
 * <p>复制模块不直接依赖键空间，快照、加载和命令重放都通过这里完成。
 *
 * @since 1.0.0
 */
public interface ReplicationHost {

    /**
     * 在暂停所有写入的情况下执行操作（持有全部分段的共享锁），
     * 全量同步在其中确定快照对应的复制偏移量
     *
     * @param action 要执行的操作
     * @param <T> 返回值类型
     * @return 操作的返回值
     */
    <T> T withWritesPaused(Supplier<T> action);

    /**
     * 生成全量快照，调用方已暂停写入
     *
     * @return 快照字节
     */
    byte[] generateSnapshot();

    /**
     * 从节点收到全量快照后替换本地数据，并重置主节点连接的会话状态
     *
     * @param snapshot 快照字节
     * @throws IOException 快照不合法
     */
    void loadSnapshot(byte[] snapshot) throws IOException;

    /**
     * 从节点按接收顺序重放主节点传播的命令
     *
     * @param command 命令
     */
    void applyReplicatedCommand(RespArray command);
}
