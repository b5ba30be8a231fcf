package com.quadscan.core.fork;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import com.codahale.metrics.Timer;
import com.quadscan.core.channel.ChannelClosedException;
import com.quadscan.core.channel.ChannelState;
import com.quadscan.core.channel.FrameChannel;
import com.quadscan.core.frame.Frame;
import com.quadscan.core.frame.FrameSource;
import com.quadscan.core.frame.FrameSources;
import com.quadscan.core.frame.RegionSpec;
import com.quadscan.core.frame.SourceReadException;
import com.quadscan.core.metrics.PipelineMetrics;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 单生产者/多消费者的帧分发器。
 * 独占帧源，每次 step() 只读一帧，并推送给所有已注册的 Channel。
 *
 * 同步模式下按注册顺序逐个 push，全部 Channel 接收第 k 帧之后 step() 才返回，
 * 因此第 k+1 帧不可能先于第 k 帧到达任何 Channel（屏障语义）。
 * 已中止的 Channel 视为已满足，不参与屏障。
 *
 * step() 只能在同一个线程上调用。
 */
@Slf4j
public class FrameFork implements Closeable {

    private final FrameSource source;
    @Getter
    private final boolean synchronizedMode;
    private final int defaultCapacity;
    private final PipelineMetrics metrics;
    private final List<FrameChannel> channels = new CopyOnWriteArrayList<>();
    private final AtomicInteger nextChannelId = new AtomicInteger();

    private ExecutorService pushExecutor; // 仅非同步模式使用
    private volatile boolean started = false;
    private volatile boolean sourceExhausted = false;
    private volatile boolean closed = false;
    @Getter
    private volatile long framesRead = 0;
    @Getter
    private volatile long lastSequenceId = -1;

    public FrameFork(FrameSource source, boolean synchronizedMode) {
        this(source, synchronizedMode, FrameChannel.DEFAULT_CAPACITY, new PipelineMetrics("fork"));
    }

    public FrameFork(FrameSource source, boolean synchronizedMode, int defaultCapacity, PipelineMetrics metrics) {
        if (source == null) {
            throw new IllegalArgumentException("source must not be null");
        }
        if (defaultCapacity < 1) {
            throw new IllegalArgumentException("channel capacity must be >= 1, got " + defaultCapacity);
        }
        this.source = source;
        this.synchronizedMode = synchronizedMode;
        this.defaultCapacity = defaultCapacity;
        this.metrics = metrics;
    }

    public FrameChannel register(RegionSpec regionSpec) {
        return register(regionSpec, defaultCapacity);
    }

    /**
     * 注册一个新的 Channel。必须在第一次 step() 之前调用。
     */
    public synchronized FrameChannel register(RegionSpec regionSpec, int capacity) {
        if (started) {
            throw new IllegalStateException("cannot register region '%s' after the fork has started"
                    .formatted(regionSpec.getName()));
        }
        for (FrameChannel existing : channels) {
            if (existing.getName().equals(regionSpec.getName())) {
                throw new IllegalArgumentException("region '%s' already registered".formatted(regionSpec.getName()));
            }
        }
        FrameChannel channel = new FrameChannel(nextChannelId.getAndIncrement(), regionSpec, capacity);
        channels.add(channel);
        log.info("FrameFork: 注册 Channel {} -> region {} {}, capacity={}",
                channel.getId(), regionSpec.getName(), regionSpec.getRectangle(), capacity);
        return channel;
    }

    /**
     * 读取一帧并推送到所有未中止的 Channel。
     *
     * @return 成功分发返回 true；帧源结束或所有 Channel 都已中止时返回 false
     * @throws SourceReadException  帧源读取失败
     * @throws InterruptedException 分发过程中线程被中断
     */
    public boolean step() throws InterruptedException {
        if (closed) {
            throw new IllegalStateException("fork already closed");
        }
        if (!started) {
            synchronized (this) {
                if (channels.isEmpty()) {
                    throw new IllegalStateException("no channels registered");
                }
                started = true;
            }
        }
        if (isAllChannelsAborted()) {
            log.debug("FrameFork: 所有 Channel 都已中止，不再读取帧源");
            return false;
        }
        if (sourceExhausted) {
            return false;
        }

        Frame frame = readFrame();
        if (frame == null) {
            sourceExhausted = true;
            log.info("FrameFork: 帧源已结束，共读取 {} 帧", framesRead);
            return false;
        }
        framesRead++;
        lastSequenceId = frame.getSequenceId();
        metrics.markFrameRead();

        if (synchronizedMode) {
            for (FrameChannel channel : channels) {
                deliver(channel, frame);
            }
        } else {
            deliverConcurrently(frame);
        }
        log.debug("FrameFork: 第 {} 帧已分发到 {} 个 Channel", frame.getSequenceId(), channels.size());
        return true;
    }

    private Frame readFrame() {
        long position = FrameSources.position(source);
        Optional<Frame> next;
        try {
            next = source.nextFrame();
        } catch (SourceReadException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SourceReadException("failed to read frame at position " + position, position, e);
        }
        if (next == null || next.isEmpty()) {
            return null;
        }
        Frame frame = next.get();
        if (frame.getSequenceId() <= lastSequenceId) {
            throw new SourceReadException("source produced frame %d after frame %d"
                    .formatted(frame.getSequenceId(), lastSequenceId), position);
        }
        return frame;
    }

    private void deliver(FrameChannel channel, Frame frame) throws InterruptedException {
        if (channel.getState() != ChannelState.RUNNING) {
            return;
        }
        Timer.Context timer = metrics.timePush();
        try {
            channel.push(frame);
            metrics.markDelivered(channel.getName());
        } catch (ChannelClosedException e) {
            // 推送期间被中止，视为已满足
            log.debug("FrameFork: Channel {}({}) 已不可用 ({}), 跳过第 {} 帧",
                    channel.getId(), channel.getName(), e.getState(), frame.getSequenceId());
        } finally {
            timer.stop();
        }
    }

    private void deliverConcurrently(Frame frame) throws InterruptedException {
        if (pushExecutor == null) {
            AtomicInteger threadIndex = new AtomicInteger();
            pushExecutor = Executors.newFixedThreadPool(channels.size(), runnable -> {
                Thread t = new Thread(runnable, "quadscan-fork-push-" + threadIndex.getAndIncrement());
                t.setDaemon(true);
                return t;
            });
        }
        List<Future<?>> pending = new ArrayList<>(channels.size());
        for (FrameChannel channel : channels) {
            pending.add(pushExecutor.submit(() -> {
                deliver(channel, frame);
                return null;
            }));
        }
        try {
            for (Future<?> future : pending) {
                future.get();
            }
        } catch (InterruptedException e) {
            pending.forEach(future -> future.cancel(true));
            throw e;
        } catch (ExecutionException e) {
            pending.forEach(future -> future.cancel(true));
            throw new IllegalStateException("concurrent push of frame " + frame.getSequenceId() + " failed",
                    e.getCause());
        }
    }

    /**
     * 帧源结束后关闭所有 Channel，Worker 仍可取完已缓冲的帧
     */
    public void closeChannels() {
        for (FrameChannel channel : channels) {
            channel.close();
        }
    }

    /**
     * 中止所有 Channel，可从任意线程调用
     *
     * @return 本次被中止的 Channel 数
     */
    public int abortAll() {
        int aborted = 0;
        for (FrameChannel channel : channels) {
            if (channel.abort()) {
                metrics.markChannelAborted();
                aborted++;
            }
        }
        return aborted;
    }

    public boolean isAllChannelsAborted() {
        if (channels.isEmpty()) {
            return false;
        }
        for (FrameChannel channel : channels) {
            if (channel.getState() != ChannelState.ABORTED) {
                return false;
            }
        }
        return true;
    }

    public boolean isSourceExhausted() {
        return sourceExhausted;
    }

    public List<FrameChannel> getChannels() {
        return Collections.unmodifiableList(channels);
    }

    /**
     * 释放推送线程池并关闭帧源
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (pushExecutor != null) {
            pushExecutor.shutdownNow();
        }
        try {
            source.close();
        } catch (RuntimeException e) {
            log.warn("FrameFork: 关闭帧源失败", e);
        }
        log.info("FrameFork: 已关闭，共读取 {} 帧", framesRead);
    }
}
