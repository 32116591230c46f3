package site.respkv.protocol.handler;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import lombok.extern.slf4j.Slf4j;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespArray;

/**
 * RESP协议编码器
 *
 * <p>只处理 {@link Resp} 消息；复制流中直接写出的 ByteBuf 原样透传。
 * 编码前按帧类型预估大小，减少 ByteBuf 扩容。
 *
 * @since 1.0.0
 */
@Slf4j
public class RespEncoder extends MessageToByteEncoder<Resp> {

    @Override
    protected void encode(final ChannelHandlerContext ctx, final Resp msg, final ByteBuf out) {
        out.ensureWritable(estimateMessageSize(msg));
        msg.encode(msg, out);
    }

    /**
     * 估算RESP消息编码后的大小
     *
     * @param msg RESP消息对象
     * @return 估算的编码大小（字节数）
     */
    static int estimateMessageSize(final Resp msg) {
        if (msg instanceof BulkString) {
            final BulkString bulkString = (BulkString) msg;
            return bulkString.getContent() != null ? bulkString.getContent().length() + 20 : 5;
        }
        if (msg instanceof RespArray) {
            final Resp[] content = ((RespArray) msg).getContent();
            if (content == null) {
                return 5;
            }
            int totalSize = 16;
            for (final Resp element : content) {
                totalSize += estimateMessageSize(element);
            }
            return totalSize;
        }
        return 64;
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        log.error("RespEncoder异常: {}", cause.getMessage(), cause);
        ctx.close();
    }
}
