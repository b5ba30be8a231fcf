package com.quadscan.core.worker;

import com.quadscan.core.channel.ChannelEndedException;
import com.quadscan.core.channel.FrameChannel;
import com.quadscan.core.frame.RegionTransform;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 单个象限的 Worker：从 Channel 取帧，做区域变换后交给分析器。
 * Worker 从不主动中止 Channel，只观察 Channel 状态；
 * 分析器崩溃只会让 Worker 退出，由 Supervisor 通过存活状态感知。
 */
@Slf4j
public class QuadrantWorker implements Runnable {

    @Getter
    private final FrameChannel channel;
    private final RegionTransform transform;
    private final FrameAnalyzer analyzer;

    @Getter
    private volatile WorkerOutcome outcome = WorkerOutcome.RUNNING;
    @Getter
    private volatile Throwable failure;
    private volatile QuadrantFrameStream stream;

    public QuadrantWorker(FrameChannel channel, RegionTransform transform, FrameAnalyzer analyzer) {
        this.channel = channel;
        this.transform = transform;
        this.analyzer = analyzer;
    }

    @Override
    public void run() {
        String name = channel.getName();
        stream = new QuadrantFrameStream(channel, transform);
        log.info("Worker {}: 开始分析象限 {}", name, channel.getRegionSpec().getRectangle());
        try {
            analyzer.analyze(stream, name);
            outcome = WorkerOutcome.COMPLETED;
        } catch (ChannelEndedException e) {
            outcome = WorkerOutcome.COMPLETED;
            log.debug("Worker {}: Channel 已结束 ({})", name, e.getState());
        } catch (Exception | Error e) {
            failure = e;
            outcome = WorkerOutcome.FAILED;
            log.error("Worker {}: 分析过程中发生异常，Worker 退出", name, e);
        } finally {
            log.info("Worker {}: 退出，outcome={}, 共处理 {} 帧", name, outcome, stream.getFramesConsumed());
        }
    }

    public String getName() {
        return channel.getName();
    }

    public long getFramesConsumed() {
        QuadrantFrameStream current = stream;
        return current != null ? current.getFramesConsumed() : 0L;
    }
}
