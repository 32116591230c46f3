package site.respkv.server;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * 测试用的同步RESP客户端。
 *
 * <p>回复映射为：简单字符串和批量字符串为 String，整数为 Long，数组为 List，
 * 空批量和空数组为 null，错误为 {@link ErrorReply}。
 */
public class RespTestClient implements Closeable {

    private final Socket socket;

    private final InputStream in;

    private final OutputStream out;

    public RespTestClient(final int port) throws IOException {
        this.socket = new Socket();
        socket.connect(new InetSocketAddress("127.0.0.1", port), 3000);
        socket.setSoTimeout(10_000);
        this.in = new BufferedInputStream(socket.getInputStream());
        this.out = socket.getOutputStream();
    }

    public Object call(final String... parts) throws IOException {
        send(parts);
        return read();
    }

    public void send(final String... parts) throws IOException {
        final ByteArrayOutputStream buf = new ByteArrayOutputStream();
        writeLine(buf, "*" + parts.length);
        for (final String part : parts) {
            final byte[] bytes = part.getBytes(StandardCharsets.UTF_8);
            writeLine(buf, "$" + bytes.length);
            buf.write(bytes);
            buf.write('\r');
            buf.write('\n');
        }
        out.write(buf.toByteArray());
        out.flush();
    }

    public void sendRaw(final String raw) throws IOException {
        out.write(raw.getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    private static void writeLine(final ByteArrayOutputStream buf, final String line) {
        final byte[] bytes = line.getBytes(StandardCharsets.UTF_8);
        buf.write(bytes, 0, bytes.length);
        buf.write('\r');
        buf.write('\n');
    }

    public Object read() throws IOException {
        final int type = in.read();
        if (type < 0) {
            throw new IOException("连接已关闭");
        }
        final String line = readLine();
        switch (type) {
            case '+':
                return line;
            case '-':
                return new ErrorReply(line);
            case ':':
                return Long.parseLong(line);
            case '$': {
                final int length = Integer.parseInt(line);
                if (length < 0) {
                    return null;
                }
                final byte[] data = in.readNBytes(length);
                in.readNBytes(2);
                return new String(data, StandardCharsets.UTF_8);
            }
            case '*': {
                final int count = Integer.parseInt(line);
                if (count < 0) {
                    return null;
                }
                final List<Object> items = new ArrayList<>(count);
                for (int i = 0; i < count; i++) {
                    items.add(read());
                }
                return items;
            }
            default:
                throw new IOException("未知的回复类型: " + (char) type);
        }
    }

    private String readLine() throws IOException {
        final ByteArrayOutputStream buf = new ByteArrayOutputStream();
        int b;
        while ((b = in.read()) != '\r') {
            if (b < 0) {
                throw new IOException("连接已关闭");
            }
            buf.write(b);
        }
        in.read();
        return buf.toString(StandardCharsets.UTF_8);
    }

    public boolean isClosedByPeer() throws IOException {
        return in.read() < 0;
    }

    @Override
    public void close() throws IOException {
        socket.close();
    }

    /**
     * 错误回复
     */
    public static final class ErrorReply {

        private final String message;

        public ErrorReply(final String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public String toString() {
            return "-" + message;
        }
    }
}
