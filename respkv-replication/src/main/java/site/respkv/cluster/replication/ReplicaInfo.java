package site.respkv.cluster.replication;

import io.netty.channel.Channel;
import lombok.Getter;
import lombok.Setter;

import java.net.InetSocketAddress;

/**
 * 主节点视角下的一个从节点连接
 *
 * @since 1.0.0
 */
@Getter
public class ReplicaInfo {

    private final Channel channel;

    /** 从节点通过 REPLCONF listening-port 报告的端口 */
    private final int listeningPort;

    /** 最近一次 ACK 报告的偏移量 */
    @Setter
    private volatile long ackOffset;

    @Setter
    private volatile long lastAckTime;

    public ReplicaInfo(final Channel channel, final int listeningPort, final long initialOffset) {
        this.channel = channel;
        this.listeningPort = listeningPort;
        this.ackOffset = initialOffset;
        this.lastAckTime = System.currentTimeMillis();
    }

    public String getIp() {
        if (channel.remoteAddress() instanceof InetSocketAddress) {
            return ((InetSocketAddress) channel.remoteAddress()).getAddress().getHostAddress();
        }
        return String.valueOf(channel.remoteAddress());
    }
}
