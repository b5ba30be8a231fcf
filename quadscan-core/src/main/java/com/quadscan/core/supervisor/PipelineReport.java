package com.quadscan.core.supervisor;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * 一次管道运行的结果
 */
@Value
@Builder
public class PipelineReport {

    SupervisorState finalState;
    EndReason endReason;
    long framesRead;
    int forcedTerminations;
    @Singular
    List<SupervisorState> transitions;
    @Singular("failedWorker")
    List<String> failedWorkers;
    /** 每个象限实际处理的帧数 */
    @Singular("framesConsumed")
    Map<String, Long> framesConsumedByWorker;
    Throwable failure;

    public boolean isClean() {
        return forcedTerminations == 0 && failedWorkers.isEmpty() && failure == null;
    }
}
