package site.respkv.rdb.crc;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CRC64单元测试")
class Crc64Test {

    private static final byte[] CHECK = "123456789".getBytes(StandardCharsets.US_ASCII);

    @Test
    @DisplayName("与Redis的crc64检验值一致")
    void testRedisCheckValue() {
        assertEquals(0xe9c6d914c4b8d9caL, Crc64.crc64(CHECK));
    }

    @Test
    @DisplayName("增量计算与一次计算结果相同")
    void testIncremental() {
        long crc = Crc64.crc64(Crc64.INITIAL_CRC, CHECK, 0, 4);
        crc = Crc64.crc64(crc, CHECK, 4, 5);
        assertEquals(Crc64.crc64(CHECK), crc);
        assertThrows(IllegalArgumentException.class, () -> Crc64.crc64(0, CHECK, 5, 5));
    }

    @Test
    @DisplayName("输出流写入的校验和能被输入流读回")
    void testStreamsAgree() throws Exception {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        Crc64OutputStream out = new Crc64OutputStream(buffer);
        out.write(CHECK, 0, 3);
        out.write(CHECK[3]);
        out.write(CHECK, 4, 5);
        out.writeCrc64Checksum();
        assertEquals(Crc64.crc64(CHECK), out.getCrc64());
        assertEquals(CHECK.length + 8, buffer.size());

        Crc64InputStream in = new Crc64InputStream(new ByteArrayInputStream(buffer.toByteArray()));
        byte[] data = new byte[CHECK.length];
        assertEquals(1, in.read(data, 0, 1));
        data[1] = (byte) in.read();
        int off = 2;
        while (off < data.length) {
            off += in.read(data, off, data.length - off);
        }
        assertArrayEquals(CHECK, data);
        assertEquals(in.getCrc64(), in.readCrc64Checksum());
    }
}
