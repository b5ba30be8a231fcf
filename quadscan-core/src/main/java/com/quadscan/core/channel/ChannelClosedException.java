package com.quadscan.core.channel;

import lombok.Getter;

/**
 * 向已中止/已关闭的 Channel 推送帧时抛出，生产端据此认为该 Channel 不再可用。
 */
@Getter
public class ChannelClosedException extends Exception {

    private final int channelId;
    private final ChannelState state;

    public ChannelClosedException(int channelId, ChannelState state) {
        super("channel %d no longer accepts frames (%s)".formatted(channelId, state));
        this.channelId = channelId;
        this.state = state;
    }
}
