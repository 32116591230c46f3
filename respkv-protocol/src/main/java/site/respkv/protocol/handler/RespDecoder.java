package site.respkv.protocol.handler;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import lombok.extern.slf4j.Slf4j;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.ErrorKind;
import site.respkv.protocol.Errors;
import site.respkv.protocol.ProtocolException;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespArray;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * RESP协议解码器
 *
 * <p>同时接受标准 RESP 帧和 INLINE 命令（如 "PING\r\n"）。
 * 数据不完整时保留已读字节等待下一次读取。
 *
 * <p>帧格式错误不可恢复：解码器回复
 * "-ERR Protocol error: ..." 后关闭连接，并丢弃后续所有输入。
 *
 * @since 1.0.0
 */
@Slf4j
public class RespDecoder extends ByteToMessageDecoder {

    /** 最大内联命令长度 */
    private static final int MAX_INLINE_LENGTH = 64 * 1024;

    /** 出现协议错误后置位，之后的字节一律丢弃 */
    private boolean broken;

    @Override
    protected void decode(final ChannelHandlerContext ctx, final ByteBuf in, final List<Object> out) {
        if (broken) {
            in.skipBytes(in.readableBytes());
            return;
        }
        try {
            // 1. 跳过前导的换行符
            while (in.isReadable()) {
                final byte b = in.getByte(in.readerIndex());
                if (b != '\n' && b != '\r') {
                    break;
                }
                in.skipBytes(1);
            }
            if (!in.isReadable()) {
                return;
            }

            // 2. 判断是RESP格式还是INLINE格式
            final byte firstByte = in.getByte(in.readerIndex());
            final Resp resp = isValidRespType(firstByte) ? Resp.decode(in) : decodeInlineCommand(in);
            if (resp != null) {
                out.add(resp);
            }
        } catch (ProtocolException e) {
            onProtocolError(ctx, in, e);
        }
    }

    private void onProtocolError(final ChannelHandlerContext ctx, final ByteBuf in, final ProtocolException e) {
        log.warn("客户端 {} 协议错误，关闭连接: {}", ctx.channel().remoteAddress(), e.getMessage());
        broken = true;
        in.skipBytes(in.readableBytes());
        // 从管道尾部写出，保证经过编码器
        ctx.channel().writeAndFlush(new Errors(ErrorKind.ERR, "Protocol error: " + e.getMessage()))
                .addListener(ChannelFutureListener.CLOSE);
    }

    /**
     * 解码INLINE格式命令
     *
     * @param in 输入缓冲区
     * @return 命令数组，数据不完整或空行时返回null
     */
    private Resp decodeInlineCommand(final ByteBuf in) {
        final int startIndex = in.readerIndex();
        final int lineEnd = in.indexOf(startIndex, in.writerIndex(), (byte) '\n');
        if (lineEnd < 0) {
            if (in.readableBytes() > MAX_INLINE_LENGTH) {
                throw new ProtocolException("too big inline request");
            }
            return null;
        }

        // 1. 去掉行尾的 \r
        int contentEnd = lineEnd;
        if (contentEnd > startIndex && in.getByte(contentEnd - 1) == '\r') {
            contentEnd--;
        }
        final byte[] line = new byte[contentEnd - startIndex];
        in.getBytes(startIndex, line);
        in.readerIndex(lineEnd + 1);

        // 2. 按空白拆分参数，支持双引号包裹
        final List<byte[]> parts = splitInline(line);
        if (parts.isEmpty()) {
            return null;
        }
        final BulkString[] bulkStrings = new BulkString[parts.size()];
        for (int i = 0; i < bulkStrings.length; i++) {
            bulkStrings[i] = BulkString.wrapTrusted(parts.get(i));
        }
        return new RespArray(bulkStrings);
    }

    private static List<byte[]> splitInline(final byte[] line) {
        final List<byte[]> parts = new ArrayList<>(8);
        int i = 0;
        while (i < line.length) {
            while (i < line.length && isBlank(line[i])) {
                i++;
            }
            if (i >= line.length) {
                break;
            }
            if (line[i] == '"') {
                // 引号参数：读取到下一个未转义的引号
                final ByteArrayOutputStream token = new ByteArrayOutputStream();
                i++;
                boolean closed = false;
                while (i < line.length) {
                    final byte b = line[i++];
                    if (b == '\\' && i < line.length) {
                        token.write(line[i++]);
                    } else if (b == '"') {
                        closed = true;
                        break;
                    } else {
                        token.write(b);
                    }
                }
                if (!closed) {
                    throw new ProtocolException("unbalanced quotes in request");
                }
                parts.add(token.toByteArray());
            } else {
                final int start = i;
                while (i < line.length && !isBlank(line[i])) {
                    i++;
                }
                final byte[] token = new byte[i - start];
                System.arraycopy(line, start, token, 0, token.length);
                parts.add(token);
            }
        }
        return parts;
    }

    private static boolean isBlank(final byte b) {
        return b == ' ' || b == '\t';
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        log.error("RespDecoder异常: {}", cause.getMessage(), cause);
        ctx.close();
    }

    /**
     * 检查是否为有效的RESP类型标识符
     */
    private static boolean isValidRespType(final byte b) {
        return b == '+' || b == '-' || b == ':' || b == '$' || b == '*' || b == '_' || b == '#';
    }
}
