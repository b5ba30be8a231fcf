package com.quadscan.core.channel;

import lombok.Getter;

/**
 * Channel 已结束（中止，或关闭且缓冲为空），通知消费端的 Worker 退出。
 */
@Getter
public class ChannelEndedException extends Exception {

    private final int channelId;
    private final ChannelState state;

    public ChannelEndedException(int channelId, ChannelState state) {
        super("channel %d ended (%s)".formatted(channelId, state));
        this.channelId = channelId;
        this.state = state;
    }
}
