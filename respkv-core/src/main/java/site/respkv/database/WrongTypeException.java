package site.respkv.database;

import lombok.Getter;
import site.respkv.datastructure.RedisType;

/**
 * 键持有的值类型与操作要求的类型不一致。
 *
 * @since 1.0.0
 */
@Getter
public class WrongTypeException extends RuntimeException {

    private final RedisType expected;

    private final RedisType actual;

    public WrongTypeException(final RedisType expected, final RedisType actual) {
        super("WRONGTYPE Operation against a key holding the wrong kind of value");
        this.expected = expected;
        this.actual = actual;
    }
}
