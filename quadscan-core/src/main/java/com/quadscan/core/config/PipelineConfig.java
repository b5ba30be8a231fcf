package com.quadscan.core.config;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.quadscan.core.channel.FrameChannel;
import com.quadscan.core.frame.Quadrant;
import com.quadscan.core.frame.RegionSpec;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * 管道配置
 *
 * 对应配置文件（默认 classpath:quadscan.json）的顶层对象：
 * 区域列表、Channel 容量、是否同步分发、轮询间隔和关闭宽限期。
 */
@Data
@NoArgsConstructor
@Accessors(chain = true)
@Slf4j
public class PipelineConfig {

    public static final long DEFAULT_POLL_INTERVAL_MILLIS = 1;
    public static final long DEFAULT_GRACE_PERIOD_MILLIS = 5_000;
    public static final long DEFAULT_FORCE_JOIN_MILLIS = 1_000;

    @JsonProperty("name")
    private String name = "quadscan";

    @JsonProperty("channel_capacity")
    private int channelCapacity = FrameChannel.DEFAULT_CAPACITY;

    /**
     * 同步模式：第 k 帧被所有存活 Channel 接收后才分发第 k+1 帧
     */
    @JsonProperty("synchronized")
    private boolean synchronizedFork = true;

    /**
     * Supervisor 空闲时的最长停顿（毫秒）
     */
    @JsonProperty("poll_interval_ms")
    private long pollIntervalMillis = DEFAULT_POLL_INTERVAL_MILLIS;

    /**
     * 进入 DRAINING 后等待 Worker 自行退出的时间（毫秒），超时后强制终止
     */
    @JsonProperty("grace_period_ms")
    private long gracePeriodMillis = DEFAULT_GRACE_PERIOD_MILLIS;

    /**
     * 强制终止后再等待 Worker 线程结束的时间（毫秒）
     */
    @JsonProperty("force_join_ms")
    private long forceJoinMillis = DEFAULT_FORCE_JOIN_MILLIS;

    @JsonProperty("regions")
    private List<RegionConfig> regions = new ArrayList<>();

    /**
     * 分析参数，原样转交给每个象限的分析器
     */
    @JsonProperty("parameters")
    private Map<String, Object> parameters = new LinkedHashMap<>();

    /**
     * 四象限（UL, DL, UR, DR）的默认配置
     */
    public static PipelineConfig quadrants(Integer colorChannel) {
        PipelineConfig config = new PipelineConfig();
        for (Quadrant quadrant : Quadrant.values()) {
            config.getRegions().add(RegionConfig.ofQuadrant(quadrant, colorChannel));
        }
        return config;
    }

    /**
     * 校验配置，非法时抛出 IllegalArgumentException
     */
    public PipelineConfig validate() {
        if (StringUtils.isBlank(name)) {
            fail("pipeline name must not be blank");
        }
        if (channelCapacity < 1) {
            fail("channel_capacity must be >= 1, got " + channelCapacity);
        }
        if (pollIntervalMillis <= 0) {
            fail("poll_interval_ms must be > 0, got " + pollIntervalMillis);
        }
        if (gracePeriodMillis < 0) {
            fail("grace_period_ms must be >= 0, got " + gracePeriodMillis);
        }
        if (forceJoinMillis < 0) {
            fail("force_join_ms must be >= 0, got " + forceJoinMillis);
        }
        if (parameters == null) {
            parameters = new LinkedHashMap<>();
        }
        if (regions == null || regions.isEmpty()) {
            fail("at least one region is required");
        }
        Set<String> names = new HashSet<>();
        for (RegionConfig region : regions) {
            if (region.getRectangle() == null && StringUtils.isBlank(region.getQuadrant())) {
                fail("region '%s' needs either a rectangle or a quadrant".formatted(region.getName()));
            }
            String regionName = region.getName() != null ? region.getName() : region.getQuadrant();
            if (StringUtils.isBlank(regionName)) {
                fail("region name must not be blank");
            }
            if (!names.add(regionName)) {
                fail("duplicate region name '%s'".formatted(regionName));
            }
        }
        log.debug("PipelineConfig 校验通过: name={}, regions={}, capacity={}, synchronized={}",
                name, names, channelCapacity, synchronizedFork);
        return this;
    }

    /**
     * 按帧尺寸解析全部区域，检查区域互不重叠，且选择的颜色通道存在于帧中
     */
    public List<RegionSpec> resolveRegions(int frameWidth, int frameHeight, int channelCount) {
        List<RegionSpec> resolved = new ArrayList<>(regions.size());
        for (RegionConfig region : regions) {
            RegionSpec spec = region.resolve(frameWidth, frameHeight);
            if (spec.hasColorChannel() && spec.getColorChannel() >= channelCount) {
                fail("region '%s' selects color_channel %d but frames have %d channel(s)"
                        .formatted(spec.getName(), spec.getColorChannel(), channelCount));
            }
            for (RegionSpec other : resolved) {
                if (other.getRectangle().intersects(spec.getRectangle())) {
                    fail("regions '%s' and '%s' overlap".formatted(other.getName(), spec.getName()));
                }
            }
            resolved.add(spec);
        }
        return resolved;
    }

    private static void fail(String message) {
        log.error("PipelineConfig 无效 - {}", message);
        throw new IllegalArgumentException(message);
    }
}
