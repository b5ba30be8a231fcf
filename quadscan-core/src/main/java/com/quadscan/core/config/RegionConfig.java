package com.quadscan.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.quadscan.core.frame.Quadrant;
import com.quadscan.core.frame.Rectangle;
import com.quadscan.core.frame.RegionSpec;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

/**
 * 配置文件中的单个区域。
 * 可以直接给出像素矩形，也可以只给出象限名（UL / "upper left"），在拿到帧尺寸后再解析。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true)
public class RegionConfig {

    @JsonProperty("name")
    private String name;

    @JsonProperty("quadrant")
    private String quadrant;

    @JsonProperty("rectangle")
    private Rectangle rectangle;

    @JsonProperty("color_channel")
    private Integer colorChannel;

    public static RegionConfig ofQuadrant(Quadrant quadrant, Integer colorChannel) {
        return new RegionConfig(quadrant.name(), quadrant.name(), null, colorChannel);
    }

    public RegionSpec resolve(int frameWidth, int frameHeight) {
        Rectangle rect = rectangle;
        String regionName = name;
        if (rect == null) {
            if (quadrant == null) {
                throw new IllegalArgumentException("region '%s' needs either a rectangle or a quadrant".formatted(name));
            }
            Quadrant q = Quadrant.fromString(quadrant);
            rect = q.rectangleFor(frameWidth, frameHeight);
            if (regionName == null) {
                regionName = q.name();
            }
        }
        if (!rect.fitsWithin(frameWidth, frameHeight)) {
            throw new IllegalArgumentException("region '%s' %s does not fit frame %dx%d"
                    .formatted(regionName, rect, frameWidth, frameHeight));
        }
        return new RegionSpec(regionName, rect, colorChannel);
    }
}
