package site.respkv.server.handler;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.respkv.protocol.ErrorKind;
import site.respkv.protocol.Errors;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespArray;
import site.respkv.server.context.RedisContext;
import site.respkv.server.dispatch.CommandDispatcher;
import site.respkv.server.session.ClientSession;

/**
 * 客户端连接的命令处理器，每个连接一个实例。
 *
 * <p>运行在命令执行线程上。连接阻塞期间收到的请求先放入会话的待处理队列，
 * 阻塞命令的回复投递后再按顺序处理，保证回复顺序与请求顺序一致。
 *
 * @since 1.0.0
 */
@Slf4j
public class RespCommandHandler extends SimpleChannelInboundHandler<Resp> {

    private static final Errors NOT_AN_ARRAY = new Errors(ErrorKind.ERR, "Protocol error: expected array of bulk strings");

    private final RedisContext context;

    private final CommandDispatcher dispatcher;

    @Getter
    private ClientSession session;

    public RespCommandHandler(final RedisContext context, final CommandDispatcher dispatcher) {
        this.context = context;
        this.dispatcher = dispatcher;
    }

    @Override
    public void channelActive(final ChannelHandlerContext ctx) throws Exception {
        session = new ClientSession(ctx.channel(), ctx.executor());
        session.setResumeHandler(reply -> onResume(ctx, reply));
        log.debug("新连接: {}", session);
        super.channelActive(ctx);
    }

    @Override
    protected void channelRead0(final ChannelHandlerContext ctx, final Resp msg) {
        if (session.isBlocked()) {
            session.getPendingInput().addLast(msg);
            return;
        }
        process(ctx, msg);
    }

    private void process(final ChannelHandlerContext ctx, final Resp msg) {
        if (!(msg instanceof RespArray)) {
            ctx.writeAndFlush(NOT_AN_ARRAY);
            return;
        }
        final Resp reply = dispatcher.dispatch(session, (RespArray) msg);
        if (reply == null) {
            return;
        }
        if (session.isCloseRequested()) {
            ctx.writeAndFlush(reply).addListener(ChannelFutureListener.CLOSE);
            return;
        }
        ctx.writeAndFlush(reply);
    }

    /**
     * 阻塞命令的回复到达，写出后继续处理积压的请求
     */
    private void onResume(final ChannelHandlerContext ctx, final Resp reply) {
        session.setBlocked(false);
        if (!ctx.channel().isActive()) {
            return;
        }
        ctx.writeAndFlush(reply);
        Resp next;
        while (!session.isBlocked() && !session.isCloseRequested()
                && (next = session.getPendingInput().pollFirst()) != null) {
            process(ctx, next);
        }
    }

    @Override
    public void channelInactive(final ChannelHandlerContext ctx) throws Exception {
        if (session != null) {
            context.getBlockingCoordinator().cancel(session);
            session.unwatchAll(context.getRedisCore());
            session.endMulti();
            session.getPendingInput().clear();
            log.debug("连接关闭: {}", session);
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        log.error("连接 {} 异常: {}", ctx.channel().remoteAddress(), cause.getMessage(), cause);
        ctx.close();
    }
}
