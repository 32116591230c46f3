package site.respkv.server.blocking;

import lombok.Getter;
import site.respkv.server.session.ClientSession;

/**
 * WAIT 的等待记录
 *
 * @since 1.0.0
 */
@Getter
public class ReplicaWaiter extends Waiter {

    private final int numReplicas;

    /** 需要从节点确认到的偏移量 */
    private final long targetOffset;

    ReplicaWaiter(final ClientSession session, final long sequence, final int numReplicas,
                  final long targetOffset) {
        super(session, sequence);
        this.numReplicas = numReplicas;
        this.targetOffset = targetOffset;
    }
}
