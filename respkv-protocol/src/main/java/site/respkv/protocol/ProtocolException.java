package site.respkv.protocol;

/**
 * 字节流不符合 RESP 帧格式时抛出。
 *
 * <p>帧边界已经无法确定，连接在回复错误后必须关闭。
 *
 * @since 1.0.0
 */
public class ProtocolException extends RuntimeException {

    public ProtocolException(final String message) {
        super(message);
    }
}
