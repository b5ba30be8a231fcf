package com.quadscan.core.frame;

import java.io.Closeable;
import java.util.Optional;

/**
 * 视频帧源。只允许一个线程（Fork）读取。
 * 解码、文件格式等不在本模块范围内，由实现方处理。
 */
public interface FrameSource extends Closeable {

    /**
     * 读取下一帧。
     *
     * @return 下一帧；流结束时返回 Optional.empty()
     * @throws SourceReadException 读取失败（致命，不重试）
     */
    Optional<Frame> nextFrame();

    /**
     * 当前读位置，即下一次 nextFrame() 将返回的帧的位置
     */
    long currentPosition();

    /**
     * 跳转到指定位置，用于非破坏性的预读
     */
    void seek(long position);

    @Override
    default void close() {
    }
}
