package site.respkv.cluster.replication;

import lombok.Getter;

/**
 * 全量同步时收到的快照内容
 *
 * @since 1.0.0
 */
@Getter
public class SnapshotPayload {

    private final byte[] data;

    public SnapshotPayload(final byte[] data) {
        this.data = data;
    }
}
