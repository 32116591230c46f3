package site.respkv.cluster.replication;

/**
 * 从节点确认偏移量变化时的回调，WAIT 依赖它被唤醒
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface AckListener {

    void onAck(long ackOffset);
}
