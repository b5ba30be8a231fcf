package com.quadscan.core.supervisor;

/**
 * 管道进入 DRAINING 的原因
 */
public enum EndReason {
    /** 帧源正常结束 */
    END_OF_STREAM,
    /** 所有 Worker 都已退出 */
    ALL_WORKERS_EXITED,
    /** 操作员中断 */
    OPERATOR_INTERRUPT,
    /** 帧源读取失败 */
    SOURCE_FAILURE,
    /** 启动阶段失败（区域解析、分析器创建等） */
    STARTUP_FAILURE;

    /**
     * 是否需要中止所有 Channel（否则关闭 Channel，让 Worker 取完缓冲）
     */
    public boolean abortsChannels() {
        return this != END_OF_STREAM && this != ALL_WORKERS_EXITED;
    }
}
