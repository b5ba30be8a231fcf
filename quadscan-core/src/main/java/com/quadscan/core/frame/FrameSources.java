package com.quadscan.core.frame;

import java.util.Optional;

/**
 * FrameSource 辅助方法
 */
public final class FrameSources {

    private FrameSources() {
    }

    /**
     * 非破坏性预读：读取下一帧后把读位置恢复原样。
     * 常用于在管道启动前获取帧尺寸。
     */
    public static Optional<Frame> peek(FrameSource source) {
        long position = position(source);
        try {
            return source.nextFrame();
        } catch (SourceReadException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SourceReadException("failed to peek frame at position " + position, position, e);
        } finally {
            rewind(source, position);
        }
    }

    /**
     * 读取当前位置，帧源的运行时异常包装为 SourceReadException
     */
    public static long position(FrameSource source) {
        try {
            return source.currentPosition();
        } catch (SourceReadException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SourceReadException("failed to query source position", -1, e);
        }
    }

    private static void rewind(FrameSource source, long position) {
        try {
            source.seek(position);
        } catch (SourceReadException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SourceReadException("failed to seek back to position " + position, position, e);
        }
    }
}
