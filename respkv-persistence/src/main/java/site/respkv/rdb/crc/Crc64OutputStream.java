package site.respkv.rdb.crc;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;

/**
 * 边写边计算CRC64的输出流
 *
 * <p>{@link #writeCrc64Checksum()} 直接写入底层流，校验和本身不计入计算。
 *
 * @since 1.0.0
 */
public class Crc64OutputStream extends FilterOutputStream {

    /** 当前计算的CRC64校验和值 */
    private long crc64 = Crc64.INITIAL_CRC;

    public Crc64OutputStream(final OutputStream outputStream) {
        super(outputStream);
    }

    public long getCrc64() {
        return crc64;
    }

    @Override
    public void write(final int b) throws IOException {
        crc64 = Crc64.update(crc64, b);
        out.write(b);
    }

    @Override
    public void write(final byte[] b, final int off, final int len) throws IOException {
        crc64 = Crc64.crc64(crc64, b, off, len);
        out.write(b, off, len);
    }

    /**
     * 写入CRC64校验和（小端序，8字节）
     */
    public void writeCrc64Checksum() throws IOException {
        for (int i = 0; i < 8; i++) {
            out.write((int) (crc64 >>> (i * 8)) & 0xFF);
        }
    }
}
