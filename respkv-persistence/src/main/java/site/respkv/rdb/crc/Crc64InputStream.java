package site.respkv.rdb.crc;

import java.io.EOFException;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * 边读边计算CRC64的输入流
 *
 * <p>{@link #readCrc64Checksum()} 直接从底层流读取，校验和本身不计入计算。
 * 不支持 mark/reset，skip 也会计入校验和。
 *
 * @since 1.0.0
 */
public class Crc64InputStream extends FilterInputStream {

    /** 当前计算的CRC64校验和值 */
    private long crc64 = Crc64.INITIAL_CRC;

    public Crc64InputStream(final InputStream inputStream) {
        super(inputStream);
    }

    public long getCrc64() {
        return crc64;
    }

    @Override
    public int read() throws IOException {
        final int b = in.read();
        if (b >= 0) {
            crc64 = Crc64.update(crc64, b);
        }
        return b;
    }

    @Override
    public int read(final byte[] b, final int off, final int len) throws IOException {
        final int bytesRead = in.read(b, off, len);
        if (bytesRead > 0) {
            crc64 = Crc64.crc64(crc64, b, off, bytesRead);
        }
        return bytesRead;
    }

    @Override
    public long skip(final long n) throws IOException {
        final byte[] buffer = new byte[(int) Math.min(n, 4096)];
        long remaining = n;
        while (remaining > 0) {
            final int read = read(buffer, 0, (int) Math.min(remaining, buffer.length));
            if (read < 0) {
                break;
            }
            remaining -= read;
        }
        return n - remaining;
    }

    @Override
    public boolean markSupported() {
        return false;
    }

    /**
     * 读取CRC64校验和（小端序，8字节）
     *
     * @return 读取的CRC64校验和
     * @throws EOFException 文件意外结束
     */
    public long readCrc64Checksum() throws IOException {
        long checksum = 0L;
        for (int i = 0; i < 8; i++) {
            final int b = in.read();
            if (b < 0) {
                throw new EOFException("文件意外结束，无法读取完整的CRC64校验和");
            }
            checksum |= ((long) (b & 0xFF)) << (i * 8);
        }
        return checksum;
    }
}
