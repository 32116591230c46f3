package site.respkv.rdb;

import java.io.IOException;

/**
 * 快照内容不合法：文件头错误、未知操作码或校验和不一致。
 *
 * @since 1.0.0
 */
public class RdbFormatException extends IOException {

    public RdbFormatException(final String message) {
        super(message);
    }
}
