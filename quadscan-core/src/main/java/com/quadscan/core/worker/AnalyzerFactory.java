package com.quadscan.core.worker;

import java.util.Map;

import com.quadscan.core.frame.RegionSpec;

/**
 * 为每个象限创建独立的分析器实例
 */
@FunctionalInterface
public interface AnalyzerFactory {

    /**
     * @param region     象限区域
     * @param parameters 配置文件中的分析参数，所有象限共享同一份只读视图
     */
    FrameAnalyzer create(RegionSpec region, Map<String, Object> parameters);
}
