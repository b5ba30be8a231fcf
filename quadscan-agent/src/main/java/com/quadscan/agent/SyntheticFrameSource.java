package com.quadscan.agent;

import java.util.Optional;

import com.quadscan.core.frame.Frame;
import com.quadscan.core.frame.FrameSource;
import com.quadscan.core.frame.SourceReadException;
import lombok.extern.slf4j.Slf4j;

/**
 * 合成帧源，用于在没有视频解码器时驱动管道。
 * 每帧是一个随帧序号平移的斜向渐变，第 c 个颜色通道额外偏移 c * 85，
 * 因此不同象限、不同通道的平均亮度各不相同。
 */
@Slf4j
public class SyntheticFrameSource implements FrameSource {

    private final int width;
    private final int height;
    private final int channelCount;
    private final long frameCount;

    private long position = 0;
    private volatile boolean closed = false;

    public SyntheticFrameSource(int width, int height, int channelCount, long frameCount) {
        Frame.byteSize(width, height, channelCount);
        if (frameCount < 0) {
            throw new IllegalArgumentException("frame count must be >= 0, got " + frameCount);
        }
        this.width = width;
        this.height = height;
        this.channelCount = channelCount;
        this.frameCount = frameCount;
    }

    @Override
    public Optional<Frame> nextFrame() {
        if (closed) {
            throw new SourceReadException("synthetic source already closed", position);
        }
        if (position >= frameCount) {
            return Optional.empty();
        }
        long sequenceId = position++;
        return Optional.of(Frame.of(sequenceId, render(sequenceId), width, height, channelCount));
    }

    private byte[] render(long sequenceId) {
        byte[] pixels = new byte[Frame.byteSize(width, height, channelCount)];
        int shift = (int) (sequenceId % 256);
        int i = 0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int base = (x + y + shift) & 0xFF;
                for (int c = 0; c < channelCount; c++) {
                    pixels[i++] = (byte) (base + c * 85);
                }
            }
        }
        return pixels;
    }

    @Override
    public long currentPosition() {
        return position;
    }

    @Override
    public void seek(long position) {
        if (position < 0 || position > frameCount) {
            throw new IllegalArgumentException("seek position %d outside [0, %d]".formatted(position, frameCount));
        }
        this.position = position;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            log.debug("SyntheticFrameSource: 已关闭，position={}", position);
        }
    }

    public long getFrameCount() {
        return frameCount;
    }
}
