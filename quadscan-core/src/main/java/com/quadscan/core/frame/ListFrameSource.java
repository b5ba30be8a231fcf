package com.quadscan.core.frame;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 基于内存列表的帧源，支持 seek。
 */
public class ListFrameSource implements FrameSource {

    private final List<Frame> frames;
    private int position;
    private volatile boolean closed;

    public ListFrameSource(List<Frame> frames) {
        this.frames = new ArrayList<>(frames);
    }

    /**
     * 生成 count 帧尺寸一致的帧，像素值由帧序号决定
     */
    public static ListFrameSource generate(int count, int width, int height, int channelCount) {
        List<Frame> frames = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            byte[] pixels = new byte[Frame.byteSize(width, height, channelCount)];
            for (int p = 0; p < pixels.length; p++) {
                pixels[p] = (byte) (i + p);
            }
            frames.add(Frame.of(i, pixels, width, height, channelCount));
        }
        return new ListFrameSource(frames);
    }

    @Override
    public Optional<Frame> nextFrame() {
        if (closed) {
            throw new SourceReadException("source already closed", position);
        }
        if (position >= frames.size()) {
            return Optional.empty();
        }
        return Optional.of(frames.get(position++));
    }

    @Override
    public long currentPosition() {
        return position;
    }

    @Override
    public void seek(long position) {
        if (position < 0 || position > frames.size()) {
            throw new IllegalArgumentException("seek position %d outside [0, %d]".formatted(position, frames.size()));
        }
        this.position = (int) position;
    }

    @Override
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    public int size() {
        return frames.size();
    }
}
