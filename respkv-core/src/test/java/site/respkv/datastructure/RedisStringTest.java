package site.respkv.datastructure;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RedisString单元测试")
class RedisStringTest {

    @Test
    @DisplayName("整数自增")
    void testIncrBy() {
        RedisString value = new RedisString(RedisBytes.fromString("10"));
        assertEquals(15, value.incrBy(5));
        assertEquals(-1, value.incrBy(-16));
        assertEquals("-1", value.getValue().getString());
    }

    @Test
    @DisplayName("非整数或溢出时值保持不变")
    void testIncrByRejectsInvalid() {
        RedisString text = new RedisString(RedisBytes.fromString("abc"));
        assertThrows(NumberFormatException.class, () -> text.incrBy(1));
        assertEquals("abc", text.getValue().getString());

        RedisString max = new RedisString(RedisBytes.fromLong(Long.MAX_VALUE));
        assertThrows(ArithmeticException.class, () -> max.incrBy(1));
        assertEquals(String.valueOf(Long.MAX_VALUE), max.getValue().getString());
    }

    @Test
    void testParseStrictLong() {
        assertEquals(0, RedisString.parseStrictLong(RedisBytes.fromString("0")));
        assertEquals(-7, RedisString.parseStrictLong(RedisBytes.fromString("-7")));
        assertThrows(NumberFormatException.class, () -> RedisString.parseStrictLong(RedisBytes.fromString("007")));
        assertThrows(NumberFormatException.class, () -> RedisString.parseStrictLong(RedisBytes.fromString("+1")));
        assertThrows(NumberFormatException.class, () -> RedisString.parseStrictLong(RedisBytes.fromString(" 1")));
        assertThrows(NumberFormatException.class, () -> RedisString.parseStrictLong(RedisBytes.fromString("-0")));
        assertThrows(NumberFormatException.class, () -> RedisString.parseStrictLong(RedisBytes.EMPTY));
    }

    @Test
    void testAppend() {
        RedisString value = new RedisString(RedisBytes.fromString("foo"));
        assertEquals(6, value.append(RedisBytes.fromString("bar")));
        assertEquals("foobar", value.getValue().getString());
    }
}
