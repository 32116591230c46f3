package site.respkv.command;

/**
 * 命令标志
 *
 * @since 1.0.0
 */
public enum CommandFlag {
    /** 修改数据，成功后传播给从节点，从节点上拒绝执行 */
    WRITE,
    /** 只读 */
    READONLY,
    /** 可能挂起连接 */
    BLOCKING,
    /** 事务中不排队，立即执行 */
    NO_MULTI,
    /** 需要锁定全部分段 */
    GLOBAL,
    /** 管理命令 */
    ADMIN
}
