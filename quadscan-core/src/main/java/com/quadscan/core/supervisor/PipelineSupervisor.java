package com.quadscan.core.supervisor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import com.quadscan.core.channel.FrameChannel;
import com.quadscan.core.config.PipelineConfig;
import com.quadscan.core.fork.FrameFork;
import com.quadscan.core.frame.Frame;
import com.quadscan.core.frame.FrameSource;
import com.quadscan.core.frame.FrameSources;
import com.quadscan.core.frame.RegionSpec;
import com.quadscan.core.frame.RegionTransform;
import com.quadscan.core.frame.SourceReadException;
import com.quadscan.core.metrics.PipelineMetrics;
import com.quadscan.core.worker.AnalyzerFactory;
import com.quadscan.core.worker.QuadrantWorker;
import com.quadscan.core.worker.WorkerHandle;
import com.quadscan.core.worker.WorkerOutcome;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.agrona.concurrent.BackoffIdleStrategy;
import org.agrona.concurrent.IdleStrategy;
import org.agrona.concurrent.ManyToOneConcurrentArrayQueue;

/**
 * 管道监督者：持有 Fork 和全部 Channel，驱动分发循环并监控 Worker 存活。
 *
 * 状态机：STARTING -> RUNNING -> DRAINING -> STOPPED
 * <ul>
 * <li>STARTING：解析区域、注册 Channel、启动 Worker</li>
 * <li>RUNNING：循环调用 Fork.step()，每轮检查 Worker 存活；至少一个 Worker 存活时继续</li>
 * <li>DRAINING：帧源结束时关闭 Channel，中断或失败时中止 Channel；
 * 等待 Worker 退出，超过宽限期后强制终止</li>
 * <li>STOPPED：关闭 Fork 和帧源</li>
 * </ul>
 *
 * Worker 退出时，其线程会立刻中止对应 Channel 并把退出事件放入队列，
 * 这样即使 Fork 正阻塞在该 Channel 的 push 上也能马上继续；
 * 运行循环每轮还会再轮询一次存活状态作为兜底。
 */
@Slf4j
public class PipelineSupervisor {

    private static final int EXIT_QUEUE_CAPACITY = 64;

    private final PipelineConfig config;
    private final FrameSource source;
    private final RegionTransform transform;
    private final AnalyzerFactory analyzerFactory;
    @Getter
    private final PipelineMetrics metrics;

    private final List<WorkerHandle> workers = new CopyOnWriteArrayList<>();
    private final List<SupervisorListener> listeners = new CopyOnWriteArrayList<>();
    private final List<SupervisorState> transitions = Collections.synchronizedList(new ArrayList<>());
    private final ManyToOneConcurrentArrayQueue<WorkerHandle> exitEvents;
    private final AtomicBoolean runInvoked = new AtomicBoolean(false);
    private final AtomicBoolean interruptClaimed = new AtomicBoolean(false);
    private final CountDownLatch stopped = new CountDownLatch(1);

    private final FrameFork fork;
    private volatile SupervisorState state = SupervisorState.STARTING;
    private volatile boolean interruptRequested = false;
    private int forcedTerminations = 0;
    private Throwable failure;

    public PipelineSupervisor(PipelineConfig config, FrameSource source, RegionTransform transform,
            AnalyzerFactory analyzerFactory) {
        this.config = config.validate();
        this.source = source;
        this.transform = transform;
        this.analyzerFactory = analyzerFactory;
        this.metrics = new PipelineMetrics(config.getName());
        this.fork = new FrameFork(source, config.isSynchronizedFork(), config.getChannelCapacity(), metrics);
        // 每个 Worker 至多产生一个退出事件
        this.exitEvents = new ManyToOneConcurrentArrayQueue<>(
                Math.max(EXIT_QUEUE_CAPACITY, config.getRegions().size() * 2));
        transitions.add(state);
    }

    public void addListener(SupervisorListener listener) {
        listeners.add(listener);
    }

    /**
     * 在当前线程上运行整个管道，直到 STOPPED。只能调用一次。
     */
    public PipelineReport run() {
        if (!runInvoked.compareAndSet(false, true)) {
            throw new IllegalStateException("pipeline '%s' has already been run".formatted(config.getName()));
        }
        log.info("PipelineSupervisor {}: 启动，regions={}, capacity={}, synchronized={}",
                config.getName(), config.getRegions().size(), config.getChannelCapacity(),
                config.isSynchronizedFork());
        EndReason reason;
        try {
            reason = startWorkers();
            if (reason == null) {
                transition(SupervisorState.RUNNING);
                reason = runLoop();
            }
        } catch (RuntimeException e) {
            // 不让意外异常留下孤儿 Worker
            log.error("PipelineSupervisor {}: 运行异常", config.getName(), e);
            failure = e;
            reason = EndReason.STARTUP_FAILURE;
        }

        // Supervisor 线程自身的中断已转换为 OPERATOR_INTERRUPT，先清除以便在 DRAINING 中等待 Worker
        boolean threadInterrupted = Thread.interrupted();
        try {
            drain(reason);
        } finally {
            shutdown();
            if (threadInterrupted) {
                Thread.currentThread().interrupt();
            }
        }
        return buildReport(reason);
    }

    /**
     * 操作员中断。线程安全，可在任意线程（例如 JVM shutdown hook）上调用。
     * 立即中止所有 Channel，阻塞中的 Fork 和 Worker 都会被唤醒。
     *
     * 先中止 Channel 再发布 isInterruptRequested()：一旦观察到中断标志，
     * 所有已注册的 Channel 都已是 ABORTED，Fork 不会再完成任何 push。
     */
    public void interrupt() {
        if (!interruptClaimed.compareAndSet(false, true)) {
            return;
        }
        log.warn("PipelineSupervisor {}: 收到中断请求，state={}", config.getName(), state);
        int aborted = fork.abortAll();
        interruptRequested = true;
        log.info("PipelineSupervisor {}: 已中止 {} 个 Channel", config.getName(), aborted);
    }

    /**
     * 等待管道进入 STOPPED
     *
     * @return 超时前已停止返回 true
     */
    public boolean awaitStopped(long timeout, TimeUnit unit) throws InterruptedException {
        return stopped.await(timeout, unit);
    }

    public SupervisorState getState() {
        return state;
    }

    public boolean isInterruptRequested() {
        return interruptRequested;
    }

    public List<WorkerHandle> getWorkers() {
        return Collections.unmodifiableList(workers);
    }

    public List<FrameChannel> getChannels() {
        return fork.getChannels();
    }

    // ---------------------------------------------------------------- STARTING

    /**
     * @return 无法进入 RUNNING 时返回结束原因，否则返回 null
     */
    private EndReason startWorkers() {
        List<RegionSpec> regions;
        try {
            regions = resolveRegions();
        } catch (SourceReadException e) {
            log.error("PipelineSupervisor {}: 预读帧源失败", config.getName(), e);
            failure = e;
            return EndReason.SOURCE_FAILURE;
        }
        if (regions == null) {
            return EndReason.END_OF_STREAM;
        }

        Map<String, Object> parameters = Collections.unmodifiableMap(new LinkedHashMap<>(config.getParameters()));
        for (RegionSpec region : regions) {
            FrameChannel channel = fork.register(region, config.getChannelCapacity());
            QuadrantWorker worker = new QuadrantWorker(channel, transform, analyzerFactory.create(region, parameters));
            WorkerHandle handle = new WorkerHandle(worker, this::onWorkerThreadExit);
            workers.add(handle);
            handle.start();
            log.info("PipelineSupervisor {}: Worker {} 已启动 (channel {})",
                    config.getName(), handle.getName(), handle.getChannelId());
        }
        return null;
    }

    /**
     * 预读第一帧获取尺寸并解析区域。帧源为空时返回 null。
     */
    private List<RegionSpec> resolveRegions() {
        Optional<Frame> first = FrameSources.peek(source);
        if (first.isEmpty()) {
            log.warn("PipelineSupervisor {}: 帧源为空，没有可分发的帧", config.getName());
            return null;
        }
        Frame frame = first.get();
        log.info("PipelineSupervisor {}: 帧尺寸 {}，通道数 {}", config.getName(),
                frame.getResolution(), frame.getChannelCount());
        return config.resolveRegions(frame.getWidth(), frame.getHeight(), frame.getChannelCount());
    }

    // ----------------------------------------------------------------- RUNNING

    private EndReason runLoop() {
        long pollNanos = TimeUnit.MILLISECONDS.toNanos(config.getPollIntervalMillis());
        // 自旋 -> yield -> park，最长停顿为轮询间隔
        IdleStrategy idleStrategy = new BackoffIdleStrategy(1, 1, Math.min(TimeUnit.MICROSECONDS.toNanos(50), pollNanos),
                pollNanos);

        while (true) {
            if (interruptRequested || Thread.currentThread().isInterrupted()) {
                return EndReason.OPERATOR_INTERRUPT;
            }

            int workDone = 0;
            try {
                if (fork.step()) {
                    workDone++;
                } else if (fork.isSourceExhausted()) {
                    return EndReason.END_OF_STREAM;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return EndReason.OPERATOR_INTERRUPT;
            } catch (SourceReadException e) {
                log.error("PipelineSupervisor {}: 帧源读取失败，position={}", config.getName(), e.getPosition(), e);
                failure = e;
                return EndReason.SOURCE_FAILURE;
            }

            workDone += checkWorkers();
            if (interruptRequested) {
                return EndReason.OPERATOR_INTERRUPT;
            }
            if (!isAnyWorkerAlive()) {
                if (interruptClaimed.get()) {
                    // 中断正在进行，Worker 是因 Channel 被中止而退出
                    return EndReason.OPERATOR_INTERRUPT;
                }
                log.warn("PipelineSupervisor {}: 所有 Worker 都已退出", config.getName());
                return EndReason.ALL_WORKERS_EXITED;
            }
            idleStrategy.idle(workDone);
        }
    }

    /**
     * Worker 线程退出时在该线程上调用
     */
    private void onWorkerThreadExit(WorkerHandle handle) {
        FrameChannel channel = handle.getChannel();
        if (channel.abort()) {
            metrics.markChannelAborted();
        }
        if (!exitEvents.offer(handle)) {
            // 兜底轮询仍会发现该 Worker 已退出
            log.warn("PipelineSupervisor {}: 退出事件队列已满，Worker {}", config.getName(), handle.getName());
        }
    }

    /**
     * 处理退出事件并轮询存活状态，存活状态为 false 的 Worker 对应的 Channel 会被中止
     *
     * @return 处理的事件数
     */
    private int checkWorkers() {
        int handled = exitEvents.drain(this::handleWorkerExit);
        for (WorkerHandle handle : workers) {
            FrameChannel channel = handle.getChannel();
            if (!handle.isAlive() && channel.isRunning()) {
                log.warn("PipelineSupervisor {}: Worker {} 已失去存活状态，中止 Channel {}",
                        config.getName(), handle.getName(), channel.getId());
                if (channel.abort()) {
                    metrics.markChannelAborted();
                }
                handled++;
            }
        }
        return handled;
    }

    private void handleWorkerExit(WorkerHandle handle) {
        boolean failed = handle.getOutcome() == WorkerOutcome.FAILED;
        metrics.markWorkerExited(failed);
        if (failed) {
            log.warn("PipelineSupervisor {}: Worker {} 异常退出，仅中止其 Channel {}",
                    config.getName(), handle.getName(), handle.getChannelId());
        } else {
            log.info("PipelineSupervisor {}: Worker {} 已退出", config.getName(), handle.getName());
        }
        for (SupervisorListener listener : listeners) {
            try {
                listener.onWorkerExited(handle);
            } catch (RuntimeException e) {
                log.error("PipelineSupervisor {}: listener 处理 Worker 退出事件失败", config.getName(), e);
            }
        }
    }

    private boolean isAnyWorkerAlive() {
        for (WorkerHandle handle : workers) {
            if (handle.isAlive()) {
                return true;
            }
        }
        return false;
    }

    // ---------------------------------------------------------------- DRAINING

    private void drain(EndReason reason) {
        transition(SupervisorState.DRAINING);
        log.info("PipelineSupervisor {}: 进入 DRAINING, reason={}", config.getName(), reason);

        if (reason.abortsChannels()) {
            int aborted = fork.abortAll();
            log.info("PipelineSupervisor {}: 中止 {} 个 Channel", config.getName(), aborted);
        } else {
            fork.closeChannels();
        }

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(config.getGracePeriodMillis());
        try {
            for (WorkerHandle handle : workers) {
                long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                handle.join(Math.max(remainingMillis, 0));
            }
        } catch (InterruptedException e) {
            // 等待期间再次被中断：不再等待，直接强制终止
            log.warn("PipelineSupervisor {}: 等待 Worker 退出时被中断", config.getName());
            interruptClaimed.set(true);
            interruptRequested = true;
            Thread.currentThread().interrupt();
        }

        for (WorkerHandle handle : workers) {
            if (handle.isAlive()) {
                log.warn("PipelineSupervisor {}: Worker {} 在宽限期 {}ms 内未退出，强制终止",
                        config.getName(), handle.getName(), config.getGracePeriodMillis());
                handle.terminate();
                forcedTerminations++;
                metrics.markForcedTermination();
            }
        }
        if (forcedTerminations > 0) {
            awaitTerminated();
        }
        exitEvents.drain(this::handleWorkerExit);
    }

    private void awaitTerminated() {
        boolean interrupted = Thread.interrupted();
        try {
            for (WorkerHandle handle : workers) {
                if (handle.isForciblyTerminated() && !handle.join(config.getForceJoinMillis())) {
                    log.error("PipelineSupervisor {}: Worker {} 强制终止后仍未退出", config.getName(), handle.getName());
                }
            }
        } catch (InterruptedException e) {
            interrupted = true;
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    // ----------------------------------------------------------------- STOPPED

    private void shutdown() {
        try {
            fork.close();
        } finally {
            transition(SupervisorState.STOPPED);
            stopped.countDown();
            log.info("PipelineSupervisor {}: 已停止，分发 {} 帧，强制终止 {} 个 Worker，push 平均耗时 {}ms",
                    config.getName(), fork.getFramesRead(), forcedTerminations,
                    String.format("%.3f", metrics.getMeanPushMillis()));
        }
    }

    private PipelineReport buildReport(EndReason reason) {
        PipelineReport.PipelineReportBuilder report = PipelineReport.builder()
                .finalState(state)
                .endReason(reason)
                .framesRead(fork.getFramesRead())
                .forcedTerminations(forcedTerminations)
                .transitions(new ArrayList<>(transitions))
                .failure(failure);
        for (WorkerHandle handle : workers) {
            report.framesConsumed(handle.getName(), handle.getFramesConsumed());
            if (handle.getOutcome() == WorkerOutcome.FAILED) {
                report.failedWorker(handle.getName());
            }
        }
        return report.build();
    }

    private void transition(SupervisorState next) {
        SupervisorState previous = state;
        if (previous == next) {
            return;
        }
        state = next;
        transitions.add(next);
        log.info("PipelineSupervisor {}: {} -> {}", config.getName(), previous, next);
        for (SupervisorListener listener : listeners) {
            try {
                listener.onStateChanged(previous, next);
            } catch (RuntimeException e) {
                log.error("PipelineSupervisor {}: listener 处理状态变化失败", config.getName(), e);
            }
        }
    }
}
