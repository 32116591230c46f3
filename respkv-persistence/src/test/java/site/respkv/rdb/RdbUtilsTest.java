package site.respkv.rdb;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RdbUtils单元测试")
class RdbUtilsTest {

    private static byte[] encodeLength(final int length) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        RdbUtils.writeLength(new DataOutputStream(buffer), length);
        return buffer.toByteArray();
    }

    private static int decodeLength(final byte[] bytes) throws IOException {
        return RdbUtils.readLength(new DataInputStream(new ByteArrayInputStream(bytes)));
    }

    @Test
    @DisplayName("长度编码按区间使用1、2、5字节")
    void testLengthEncodingWidths() throws IOException {
        assertArrayEquals(new byte[]{0x3F}, encodeLength(63));
        assertArrayEquals(new byte[]{0x40, 0x40}, encodeLength(64));
        assertArrayEquals(new byte[]{0x7F, (byte) 0xFF}, encodeLength(16383));
        assertEquals(5, encodeLength(16384).length);
        assertEquals((byte) 0x80, encodeLength(16384)[0]);
    }

    @Test
    void testLengthBoundaries() throws IOException {
        for (int length : new int[]{0, 1, 63, 64, 300, 16383, 16384, 1 << 20, Integer.MAX_VALUE}) {
            assertEquals(length, decodeLength(encodeLength(length)), "length " + length);
        }
    }

    @Test
    @DisplayName("未知长度编码类型报格式错误")
    void testUnsupportedEncoding() {
        assertThrows(RdbFormatException.class, () -> decodeLength(new byte[]{(byte) 0xC0}));
    }

    @Test
    @DisplayName("错误的文件头报格式错误")
    void testBadHeader() {
        byte[] junk = "NOTREDIS0".getBytes();
        assertThrows(RdbFormatException.class,
                () -> RdbUtils.checkRdbHeader(new DataInputStream(new ByteArrayInputStream(junk))));
    }
}
