package com.quadscan.core.frame;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import lombok.Getter;

/**
 * 视频帧
 * 管道中流动的不可变数据单元：像素缓冲 + 序号。
 * 像素按行优先、通道交错存放，共 width * height * channelCount 字节。
 * 同一个 Frame 会被 Fork 共享给所有 Channel，只读。
 */
@Getter
public final class Frame {

    private final long sequenceId;
    private final int width;
    private final int height;
    private final int channelCount;

    private final ByteBuf data; // 只读视图

    private Frame(long sequenceId, ByteBuf data, int width, int height, int channelCount) {
        this.sequenceId = sequenceId;
        this.data = data;
        this.width = width;
        this.height = height;
        this.channelCount = channelCount;
    }

    /**
     * 从字节数组创建视频帧，数组会被拷贝。
     */
    public static Frame of(long sequenceId, byte[] pixels, int width, int height, int channelCount) {
        if (sequenceId < 0) {
            throw new IllegalArgumentException("sequenceId must not be negative: " + sequenceId);
        }
        int expected = byteSize(width, height, channelCount);
        if (pixels == null || pixels.length != expected) {
            throw new IllegalArgumentException("pixel buffer size mismatch, expected %d bytes, got %s"
                    .formatted(expected, pixels == null ? "null" : pixels.length));
        }
        return wrap(sequenceId, pixels.clone(), width, height, channelCount);
    }

    /**
     * 计算像素缓冲的字节数
     *
     * @throws IllegalArgumentException 尺寸非正，或字节数超出单个数组的上限
     */
    public static int byteSize(int width, int height, int channelCount) {
        if (width <= 0 || height <= 0 || channelCount <= 0) {
            throw new IllegalArgumentException(
                    "invalid frame geometry: %dx%d, channels=%d".formatted(width, height, channelCount));
        }
        try {
            return Math.multiplyExact(Math.multiplyExact(width, height), channelCount);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(
                    "frame %dx%d, channels=%d exceeds %d bytes".formatted(width, height, channelCount,
                            Integer.MAX_VALUE), e);
        }
    }

    /**
     * 直接包装数组，不做拷贝。调用方保证之后不再修改该数组。
     */
    static Frame wrap(long sequenceId, byte[] pixels, int width, int height, int channelCount) {
        return new Frame(sequenceId, Unpooled.wrappedBuffer(pixels).asReadOnly(), width, height, channelCount);
    }

    /**
     * 创建全 0 的黑色帧
     */
    public static Frame black(long sequenceId, int width, int height, int channelCount) {
        return of(sequenceId, new byte[byteSize(width, height, channelCount)], width, height, channelCount);
    }

    /**
     * 返回像素数据的只读视图。
     * 每次调用都是独立的 duplicate，读写索引互不影响，可以在多个线程里同时读取。
     */
    public ByteBuf getData() {
        return data.duplicate();
    }

    /**
     * 读取单个像素分量（0..255）
     */
    public int getPixel(int x, int y, int channel) {
        if (x < 0 || x >= width || y < 0 || y >= height || channel < 0 || channel >= channelCount) {
            throw new IndexOutOfBoundsException(
                    "pixel (%d,%d,%d) outside %s".formatted(x, y, channel, getResolution()));
        }
        return data.getUnsignedByte((y * width + x) * channelCount + channel);
    }

    /**
     * 获取像素数据的字节数组拷贝
     */
    public byte[] getDataBytes() {
        byte[] bytes = new byte[data.readableBytes()];
        data.getBytes(data.readerIndex(), bytes);
        return bytes;
    }

    public int getDataSize() {
        return data.readableBytes();
    }

    public String getResolution() {
        return width + "x" + height;
    }

    @Override
    public String toString() {
        return "Frame{seq=" + sequenceId + ", " + getResolution() + "x" + channelCount + "}";
    }
}
