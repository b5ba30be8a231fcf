package com.quadscan.core.channel;

/**
 * Channel 生命周期状态
 */
public enum ChannelState {
    /** 正常收发 */
    RUNNING,
    /** 生产端已结束，消费端仍可取完缓冲中的帧 */
    DRAINING,
    /** 已中止，缓冲被丢弃，收发两端立即结束 */
    ABORTED,
    /** 缓冲已取完，正常结束 */
    CLOSED;

    public boolean isTerminal() {
        return this == ABORTED || this == CLOSED;
    }
}
