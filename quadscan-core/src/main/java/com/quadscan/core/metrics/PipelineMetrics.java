package com.quadscan.core.metrics;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

/**
 * 管道运行指标
 * 记录读帧速率、各 Channel 的投递数、push 阻塞时间以及中止/强制终止次数
 */
public class PipelineMetrics {

    private final String pipelineName;
    private final MetricRegistry metricsRegistry;
    private final Map<String, Counter> deliveredByChannel = new ConcurrentHashMap<>();

    private final Meter framesRead;
    private final Timer pushTimer;
    private final Counter channelAborts;
    private final Counter workerExits;
    private final Counter workerFailures;
    private final Counter forcedTerminations;

    public PipelineMetrics(String pipelineName) {
        this(pipelineName, new MetricRegistry());
    }

    public PipelineMetrics(String pipelineName, MetricRegistry metricsRegistry) {
        this.pipelineName = pipelineName;
        this.metricsRegistry = metricsRegistry;

        framesRead = metricsRegistry.meter(MetricRegistry.name(pipelineName, "fork", "frames", "read"));
        pushTimer = metricsRegistry.timer(MetricRegistry.name(pipelineName, "fork", "push", "duration"));

        channelAborts = metricsRegistry.counter(MetricRegistry.name(pipelineName, "channels", "aborted"));
        workerExits = metricsRegistry.counter(MetricRegistry.name(pipelineName, "workers", "exited"));
        workerFailures = metricsRegistry.counter(MetricRegistry.name(pipelineName, "workers", "failed"));
        forcedTerminations = metricsRegistry
                .counter(MetricRegistry.name(pipelineName, "workers", "forcedTerminations"));
    }

    public void markFrameRead() {
        framesRead.mark();
    }

    /**
     * 开始计时一次 push，调用方负责 stop()
     */
    public Timer.Context timePush() {
        return pushTimer.time();
    }

    public void markDelivered(String channelName) {
        deliveredByChannel.computeIfAbsent(channelName,
                name -> metricsRegistry.counter(MetricRegistry.name(pipelineName, "channels", name, "delivered")))
                .inc();
    }

    public void markChannelAborted() {
        channelAborts.inc();
    }

    public void markWorkerExited(boolean failed) {
        workerExits.inc();
        if (failed) {
            workerFailures.inc();
        }
    }

    public void markForcedTermination() {
        forcedTerminations.inc();
    }

    public long getFramesRead() {
        return framesRead.getCount();
    }

    public long getDelivered(String channelName) {
        Counter counter = deliveredByChannel.get(channelName);
        return counter != null ? counter.getCount() : 0L;
    }

    public long getChannelAborts() {
        return channelAborts.getCount();
    }

    public long getWorkerFailures() {
        return workerFailures.getCount();
    }

    public long getForcedTerminations() {
        return forcedTerminations.getCount();
    }

    /**
     * push 的平均耗时（毫秒），反映背压程度
     */
    public double getMeanPushMillis() {
        return pushTimer.getSnapshot().getMean() / 1_000_000.0;
    }

    public MetricRegistry getMetricsRegistry() {
        return metricsRegistry;
    }
}
