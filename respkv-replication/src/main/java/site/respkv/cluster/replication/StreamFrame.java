package site.respkv.cluster.replication;

import lombok.Getter;
import site.respkv.protocol.Resp;

/**
 * 复制连接上解码出的一个 RESP 帧及其在流中占用的字节数
 *
 * @since 1.0.0
 */
@Getter
public class StreamFrame {

    private final Resp resp;

    /** 编码后的字节数，用于推进复制偏移量 */
    private final int size;

    public StreamFrame(final Resp resp, final int size) {
        this.resp = resp;
        this.size = size;
    }
}
