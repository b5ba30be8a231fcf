package com.quadscan.core.worker;

public enum WorkerOutcome {
    RUNNING,
    /** 分析器正常返回，或 Channel 结束 */
    COMPLETED,
    /** 分析器或区域变换抛出异常 */
    FAILED
}
