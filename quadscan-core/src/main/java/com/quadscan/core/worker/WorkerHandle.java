package com.quadscan.core.worker;

import java.util.function.Consumer;

import com.quadscan.core.channel.FrameChannel;
import lombok.extern.slf4j.Slf4j;

/**
 * Worker 线程句柄。线程结束时（无论正常还是异常）回调 exitListener，
 * Supervisor 借此在 Worker 死亡的同一时刻中止对应 Channel。
 */
@Slf4j
public class WorkerHandle {

    private final QuadrantWorker worker;
    private final Thread thread;
    private volatile boolean forciblyTerminated = false;

    public WorkerHandle(QuadrantWorker worker, Consumer<WorkerHandle> exitListener) {
        this.worker = worker;
        this.thread = new Thread(() -> {
            try {
                worker.run();
            } finally {
                exitListener.accept(this);
            }
        }, "quadscan-worker-" + worker.getName());
        // 强制终止失败时不阻止 JVM 退出
        this.thread.setDaemon(true);
        this.thread.setUncaughtExceptionHandler(
                (t, ex) -> log.error("Worker 线程 {} 发生未捕获异常", t.getName(), ex));
    }

    public void start() {
        thread.start();
    }

    public boolean isAlive() {
        return thread.isAlive();
    }

    /**
     * 等待 Worker 退出
     *
     * @return 在超时前退出返回 true
     */
    public boolean join(long millis) throws InterruptedException {
        if (millis > 0) {
            thread.join(millis);
        }
        return !thread.isAlive();
    }

    /**
     * 强制终止：中断线程并中止 Channel
     */
    public void terminate() {
        forciblyTerminated = true;
        worker.getChannel().abort();
        thread.interrupt();
    }

    public int getChannelId() {
        return worker.getChannel().getId();
    }

    public FrameChannel getChannel() {
        return worker.getChannel();
    }

    public String getName() {
        return worker.getName();
    }

    public WorkerOutcome getOutcome() {
        return worker.getOutcome();
    }

    public Throwable getFailure() {
        return worker.getFailure();
    }

    public long getFramesConsumed() {
        return worker.getFramesConsumed();
    }

    public boolean isForciblyTerminated() {
        return forciblyTerminated;
    }

    @Override
    public String toString() {
        return "WorkerHandle{" + worker.getName() + ", alive=" + isAlive() + ", outcome=" + getOutcome() + "}";
    }
}
