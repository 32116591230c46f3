package site.respkv.cluster.replication;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import lombok.extern.slf4j.Slf4j;
import site.respkv.protocol.ProtocolException;
import site.respkv.protocol.Resp;
import site.respkv.protocol.SimpleString;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * 从节点侧复制连接的解码器
 *
 * <p>平时按 RESP 解码并记录每帧的字节数；解码到 "+FULLRESYNC" 后切换到快照模式，
 * 读取 "$长度\r\n" 和随后的内容（末尾没有CRLF），输出 {@link SnapshotPayload} 后切回。
 *
 * @since 1.0.0
 */
@Slf4j
public class ReplicationStreamDecoder extends ByteToMessageDecoder {

    /** 快照最大长度 */
    private static final long MAX_SNAPSHOT_LENGTH = Integer.MAX_VALUE - 8;

    private boolean expectSnapshot;

    /** 快照长度，-1表示还没读到长度行 */
    private long snapshotLength = -1;

    @Override
    protected void decode(final ChannelHandlerContext ctx, final ByteBuf in, final List<Object> out) {
        if (expectSnapshot) {
            decodeSnapshot(in, out);
            return;
        }
        final int start = in.readerIndex();
        final Resp resp = Resp.decode(in);
        if (resp == null) {
            return;
        }
        out.add(new StreamFrame(resp, in.readerIndex() - start));
        if (resp instanceof SimpleString && ((SimpleString) resp).getContent().startsWith("FULLRESYNC")) {
            expectSnapshot = true;
        }
    }

    private void decodeSnapshot(final ByteBuf in, final List<Object> out) {
        // 1. 读取长度行，跳过主节点在生成快照期间发送的换行保活
        if (snapshotLength < 0) {
            while (in.isReadable() && in.getByte(in.readerIndex()) == '\n') {
                in.skipBytes(1);
            }
            if (!in.isReadable()) {
                return;
            }
            final int lineEnd = in.indexOf(in.readerIndex(), in.writerIndex(), (byte) '\n');
            if (lineEnd < 0) {
                return;
            }
            final String line = in.toString(in.readerIndex(), lineEnd - in.readerIndex(), StandardCharsets.US_ASCII)
                    .trim();
            in.readerIndex(lineEnd + 1);
            if (!line.startsWith("$")) {
                throw new ProtocolException("bad snapshot header: " + line);
            }
            try {
                snapshotLength = Long.parseLong(line.substring(1));
            } catch (NumberFormatException e) {
                throw new ProtocolException("bad snapshot length: " + line);
            }
            if (snapshotLength < 0 || snapshotLength > MAX_SNAPSHOT_LENGTH) {
                throw new ProtocolException("bad snapshot length: " + line);
            }
            log.info("开始接收快照，长度 {} 字节", snapshotLength);
        }

        // 2. 等待全部内容到达
        if (in.readableBytes() < snapshotLength) {
            return;
        }
        final byte[] data = new byte[(int) snapshotLength];
        in.readBytes(data);
        snapshotLength = -1;
        expectSnapshot = false;
        out.add(new SnapshotPayload(data));
    }
}
