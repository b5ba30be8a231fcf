package com.quadscan.agent;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

import com.quadscan.core.config.PipelineConfig;
import com.quadscan.core.config.PipelineConfigLoader;
import com.quadscan.core.frame.CropTransform;
import com.quadscan.core.supervisor.PipelineReport;
import com.quadscan.core.supervisor.PipelineSupervisor;
import com.quadscan.core.supervisor.SupervisorState;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class Main {

    public static void main(String[] args) throws Exception {
        AgentOptions options = AgentOptions.parse(args);

        // 1. 加载配置
        PipelineConfig config = options.getConfigPath() != null
                ? PipelineConfigLoader.fromFile(options.getConfigPath())
                : PipelineConfigLoader.fromClasspath(PipelineConfigLoader.DEFAULT_RESOURCE);

        // 2. 组装帧源和每个象限的分析器
        SyntheticFrameSource source = new SyntheticFrameSource(options.getWidth(), options.getHeight(),
                options.getChannels(), options.getFrames());
        Map<String, MeanIntensityAnalyzer> analyzers = new ConcurrentHashMap<>();
        PipelineSupervisor supervisor = new PipelineSupervisor(config, source, new CropTransform(),
                (region, parameters) -> analyzers.computeIfAbsent(region.getName(),
                        name -> MeanIntensityAnalyzer.fromParameters(parameters)));

        // 3. Ctrl+C / SIGTERM 映射为操作员中断，等待管道排空
        long stopTimeoutMillis = config.getGracePeriodMillis() + config.getForceJoinMillis() + 1_000;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            if (supervisor.getState() == SupervisorState.STOPPED) {
                return;
            }
            log.info("收到关闭信号，中断管道 {}", config.getName());
            supervisor.interrupt();
            try {
                if (!supervisor.awaitStopped(stopTimeoutMillis, TimeUnit.MILLISECONDS)) {
                    log.warn("管道 {} 在 {}ms 内未停止", config.getName(), stopTimeoutMillis);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("等待管道停止时被中断");
            }
        }, "quadscan-shutdown"));

        // 4. 在主线程上运行直到结束
        PipelineReport report = supervisor.run();
        analyzers.forEach((name, analyzer) -> log.info("象限 {}: 分析 {} 帧，平均亮度 {}", name,
                analyzer.getSamples().size(), String.format("%.2f", analyzer.getOverallMean())));
        log.info("管道 {} 结束: reason={}, frames={}, forced={}, failed={}", config.getName(),
                report.getEndReason(), report.getFramesRead(), report.getForcedTerminations(),
                report.getFailedWorkers());

        if (!report.isClean() && !supervisor.isInterruptRequested()) {
            System.exit(1);
        }
    }
}
