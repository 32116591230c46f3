package site.respkv.server.blocking;

import lombok.Getter;
import site.respkv.server.session.ClientSession;

import java.util.concurrent.ScheduledFuture;

/**
 * 一个挂起的阻塞命令。状态只在 {@link BlockingCoordinator} 的监视器下修改。
 *
 * @since 1.0.0
 */
@Getter
public abstract class Waiter {

    private final ClientSession session;

    /** 登记顺序 */
    private final long sequence;

    private boolean done;

    private ScheduledFuture<?> timeoutTask;

    protected Waiter(final ClientSession session, final long sequence) {
        this.session = session;
        this.sequence = sequence;
    }

    void setTimeoutTask(final ScheduledFuture<?> timeoutTask) {
        this.timeoutTask = timeoutTask;
    }

    /**
     * 标记完成并取消超时任务
     *
     * @return 之前未完成返回true
     */
    boolean finish() {
        if (done) {
            return false;
        }
        done = true;
        if (timeoutTask != null) {
            timeoutTask.cancel(false);
        }
        return true;
    }
}
