package com.quadscan.core.worker;

/**
 * 象限分析器。每个 Worker 持有一个实例，在 Worker 线程上运行。
 * 通过反复调用 {@link QuadrantFrameStream#next()} 消费帧，流结束时抛出 ChannelEndedException。
 * 抛出其他异常会终止所在的 Worker。
 */
@FunctionalInterface
public interface FrameAnalyzer {

    void analyze(QuadrantFrameStream stream, String quadrantName) throws Exception;
}
