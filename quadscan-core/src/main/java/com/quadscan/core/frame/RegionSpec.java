package com.quadscan.core.frame;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

/**
 * 一个象限的区域配置：名称、裁剪矩形、可选的颜色通道。
 * colorChannel 为 null 表示保留全部通道。
 */
@Value
public class RegionSpec {

    @JsonProperty("name")
    String name;

    @JsonProperty("rectangle")
    Rectangle rectangle;

    @JsonProperty("color_channel")
    Integer colorChannel;

    @JsonCreator
    public RegionSpec(@JsonProperty("name") String name,
            @JsonProperty("rectangle") Rectangle rectangle,
            @JsonProperty("color_channel") Integer colorChannel) {
        if (StringUtils.isBlank(name)) {
            throw new IllegalArgumentException("region name must not be blank");
        }
        if (rectangle == null) {
            throw new IllegalArgumentException("region '%s' has no rectangle".formatted(name));
        }
        if (colorChannel != null && colorChannel < 0) {
            throw new IllegalArgumentException(
                    "region '%s' has negative color channel %d".formatted(name, colorChannel));
        }
        this.name = name;
        this.rectangle = rectangle;
        this.colorChannel = colorChannel;
    }

    public boolean hasColorChannel() {
        return colorChannel != null;
    }
}
