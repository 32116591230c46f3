package site.respkv.command;

import site.respkv.cluster.replication.PropagatedCommand;
import site.respkv.core.KeyLockManager;
import site.respkv.datastructure.RedisBytes;
import site.respkv.protocol.Resp;

import java.util.List;

/**
 * Redis命令接口，定义了所有命令的基本行为。
 *
 * <p>一次执行分三步：{@link #setContext} 解析并校验参数，不触碰数据；
 * 调度器根据 {@link #collectLocks} 加锁；{@link #handle} 在锁内执行，
 * 执行过程中产生的传播形式通过 {@link #getPropagated()} 取出。
 *
 * @since 1.0.0
 */
public interface Command {

    /**
     * 获取命令类型
     *
     * @return 命令类型枚举值
     */
    CommandType getType();

    /**
     * 解析参数
     *
     * @param array RESP协议格式的参数数组，第一个元素是命令名
     * @throws CommandException 参数不合法
     */
    void setContext(Resp[] array);

    /**
     * 命令涉及的键，按参数顺序
     *
     * @return 键列表
     */
    List<RedisBytes> keys();

    /**
     * 把执行需要的锁加入请求
     *
     * @param request 加锁请求
     */
    void collectLocks(KeyLockManager.LockRequest request);

    /**
     * 按指定的数据库收集锁，事务执行时队列中的 SELECT 会改变后续命令的数据库
     *
     * @param request 加锁请求
     * @param dbIndex 命令执行时所在的数据库
     */
    void collectLocks(KeyLockManager.LockRequest request, int dbIndex);

    /**
     * 执行命令并返回结果。
     *
     * @return RESP协议格式的执行结果；回复已由别处写出或将在稍后写出时返回null
     * @throws CommandException 执行失败，数据未被修改
     */
    Resp handle();

    /**
     * @return 本次执行需要传播给从节点的命令，按执行顺序
     */
    List<PropagatedCommand> getPropagated();

    default boolean isWriteCommand() {
        return getType().isWrite();
    }
}
