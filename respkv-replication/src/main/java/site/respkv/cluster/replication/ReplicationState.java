package site.respkv.cluster.replication;

/**
 * 从节点与主节点之间连接的状态
 *
 * @since 1.0.0
 */
public enum ReplicationState {
    /** 未连接或等待重连 */
    DISCONNECTED,
    /** TCP连接建立中 */
    CONNECTING,
    /** 已发送 PING，等待 PONG */
    HANDSHAKE_PING,
    /** 已发送 REPLCONF listening-port */
    HANDSHAKE_PORT,
    /** 已发送 REPLCONF capa */
    HANDSHAKE_CAPA,
    /** 已发送 PSYNC，等待 FULLRESYNC 或 CONTINUE */
    WAIT_PSYNC,
    /** 正在接收快照 */
    TRANSFER,
    /** 正在接收命令流 */
    STREAMING
}
