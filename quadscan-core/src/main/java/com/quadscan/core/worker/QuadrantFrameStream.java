package com.quadscan.core.worker;

import java.util.function.Consumer;

import com.quadscan.core.channel.ChannelEndedException;
import com.quadscan.core.channel.FrameChannel;
import com.quadscan.core.frame.Frame;
import com.quadscan.core.frame.RegionSpec;
import com.quadscan.core.frame.RegionTransform;

/**
 * 分析器看到的帧流：从 Channel 取帧并应用区域变换。
 * 只在所属 Worker 线程上使用。
 */
public class QuadrantFrameStream {

    private final FrameChannel channel;
    private final RegionTransform transform;
    private long framesConsumed = 0;

    public QuadrantFrameStream(FrameChannel channel, RegionTransform transform) {
        this.channel = channel;
        this.transform = transform;
    }

    /**
     * 阻塞获取下一帧（已变换为本象限的子帧）
     *
     * @throws ChannelEndedException 流已结束
     */
    public Frame next() throws ChannelEndedException {
        Frame frame = channel.pop();
        Frame region = transform.apply(frame, channel.getRegionSpec());
        framesConsumed++;
        return region;
    }

    /**
     * 依次处理剩余的每一帧，直到流结束
     */
    public void forEachRemaining(Consumer<Frame> action) {
        while (true) {
            Frame frame;
            try {
                frame = next();
            } catch (ChannelEndedException e) {
                return;
            }
            action.accept(frame);
        }
    }

    public RegionSpec getRegion() {
        return channel.getRegionSpec();
    }

    public long getFramesConsumed() {
        return framesConsumed;
    }
}
