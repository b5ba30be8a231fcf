package com.quadscan.agent;

import lombok.Value;

/**
 * 单帧单象限的亮度统计
 */
@Value
public class IntensitySample {

    long sequenceId;
    double mean;
    int min;
    int max;
    /** 亮度不低于阈值的像素比例 */
    double brightFraction;
}
