package site.respkv.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * 错误回复，如 "-WRONGTYPE Operation against a key holding the wrong kind of value"。
 *
 * <p>第一个单词是错误类别，其余部分是可读的说明。
 *
 * @since 1.0.0
 */
@Getter
public class Errors extends Resp {
    /** 错误类别，如 ERR、WRONGTYPE */
    private final String kind;

    /** 错误说明 */
    private final String message;

    /**
     * 从完整的错误行构造，按第一个空格拆分类别与说明。
     *
     * @param content 完整错误行，不含前导 '-'
     */
    public Errors(final String content) {
        final int space = content.indexOf(' ');
        if (space < 0) {
            this.kind = content;
            this.message = "";
        } else {
            this.kind = content.substring(0, space);
            this.message = content.substring(space + 1);
        }
    }

    public Errors(final ErrorKind kind, final String message) {
        this.kind = kind.name();
        this.message = message;
    }

    /**
     * @return 完整错误行
     */
    public String getContent() {
        return message.isEmpty() ? kind : kind + " " + message;
    }

    /**
     * @return 已知类别，未知时返回null
     */
    public ErrorKind getErrorKind() {
        return ErrorKind.parse(kind);
    }

    @Override
    public void encode(final Resp resp, final ByteBuf byteBuf) {
        byteBuf.writeByte('-');
        byteBuf.writeBytes(((Errors) resp).getContent().getBytes(StandardCharsets.UTF_8));
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public String toString() {
        return "-" + getContent();
    }
}
