package com.quadscan.agent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.quadscan.core.channel.ChannelEndedException;
import com.quadscan.core.frame.Frame;
import com.quadscan.core.worker.FrameAnalyzer;
import com.quadscan.core.worker.QuadrantFrameStream;
import io.netty.buffer.ByteBuf;
import lombok.extern.slf4j.Slf4j;

/**
 * 示例分析器：逐帧计算象限的平均、最小、最大亮度，以及亮像素比例。
 * 每个象限使用独立实例。
 *
 * 支持的分析参数：
 * <ul>
 * <li>bright_threshold：亮像素阈值（0..255），默认 128</li>
 * </ul>
 */
@Slf4j
public class MeanIntensityAnalyzer implements FrameAnalyzer {

    public static final String BRIGHT_THRESHOLD = "bright_threshold";
    public static final int DEFAULT_BRIGHT_THRESHOLD = 128;

    private final List<IntensitySample> samples = Collections.synchronizedList(new ArrayList<>());
    private final int brightThreshold;

    public MeanIntensityAnalyzer() {
        this(DEFAULT_BRIGHT_THRESHOLD);
    }

    public MeanIntensityAnalyzer(int brightThreshold) {
        if (brightThreshold < 0 || brightThreshold > 255) {
            throw new IllegalArgumentException(BRIGHT_THRESHOLD + " must be within [0, 255], got " + brightThreshold);
        }
        this.brightThreshold = brightThreshold;
    }

    /**
     * 按配置中的分析参数创建
     */
    public static MeanIntensityAnalyzer fromParameters(Map<String, Object> parameters) {
        Object value = parameters.get(BRIGHT_THRESHOLD);
        if (value == null) {
            return new MeanIntensityAnalyzer();
        }
        if (value instanceof Number) {
            return new MeanIntensityAnalyzer(((Number) value).intValue());
        }
        try {
            return new MeanIntensityAnalyzer(Integer.parseInt(value.toString().trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(BRIGHT_THRESHOLD + " is not an integer: " + value, e);
        }
    }

    @Override
    public void analyze(QuadrantFrameStream stream, String quadrantName) throws ChannelEndedException {
        log.info("MeanIntensityAnalyzer {}: 开始分析，region={}, bright_threshold={}", quadrantName,
                stream.getRegion().getRectangle(), brightThreshold);
        while (true) {
            Frame frame = stream.next();
            IntensitySample sample = measure(frame, brightThreshold);
            samples.add(sample);
            log.debug("MeanIntensityAnalyzer {}: frame={} mean={} min={} max={} bright={}", quadrantName,
                    sample.getSequenceId(), String.format("%.2f", sample.getMean()), sample.getMin(), sample.getMax(),
                    String.format("%.3f", sample.getBrightFraction()));
        }
    }

    static IntensitySample measure(Frame frame, int brightThreshold) {
        ByteBuf data = frame.getData();
        int size = data.readableBytes();
        if (size == 0) {
            return new IntensitySample(frame.getSequenceId(), 0.0, 0, 0, 0.0);
        }
        long sum = 0;
        int min = 255;
        int max = 0;
        int bright = 0;
        for (int i = data.readerIndex(); i < data.writerIndex(); i++) {
            int value = data.getUnsignedByte(i);
            sum += value;
            min = Math.min(min, value);
            max = Math.max(max, value);
            if (value >= brightThreshold) {
                bright++;
            }
        }
        return new IntensitySample(frame.getSequenceId(), (double) sum / size, min, max, (double) bright / size);
    }

    public int getBrightThreshold() {
        return brightThreshold;
    }

    public List<IntensitySample> getSamples() {
        synchronized (samples) {
            return new ArrayList<>(samples);
        }
    }

    /**
     * 所有已分析帧的平均亮度
     */
    public double getOverallMean() {
        List<IntensitySample> snapshot = getSamples();
        return snapshot.stream().mapToDouble(IntensitySample::getMean).average().orElse(0.0);
    }
}
