package com.quadscan.core.frame;

/**
 * 区域变换：把整帧映射为某个象限的子帧。
 * 实现必须是纯函数，不得修改输入帧，结果必须使用新的缓冲区。
 */
@FunctionalInterface
public interface RegionTransform {

    Frame apply(Frame frame, RegionSpec region);

    /**
     * 原样返回输入帧
     */
    static RegionTransform identity() {
        return (frame, region) -> frame;
    }
}
