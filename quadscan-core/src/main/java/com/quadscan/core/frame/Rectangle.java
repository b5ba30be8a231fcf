package com.quadscan.core.frame;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * 帧内的矩形区域，单位为像素，(x, y) 为左上角。
 */
@Value
public class Rectangle {

    @JsonProperty("x")
    int x;

    @JsonProperty("y")
    int y;

    @JsonProperty("w")
    int width;

    @JsonProperty("h")
    int height;

    @JsonCreator
    public Rectangle(@JsonProperty("x") int x,
            @JsonProperty("y") int y,
            @JsonProperty("w") int width,
            @JsonProperty("h") int height) {
        if (x < 0 || y < 0 || width <= 0 || height <= 0) {
            throw new IllegalArgumentException("invalid rectangle (%d, %d, %d, %d)".formatted(x, y, width, height));
        }
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    /**
     * 矩形是否完整落在给定尺寸的帧内
     */
    public boolean fitsWithin(int frameWidth, int frameHeight) {
        return x + width <= frameWidth && y + height <= frameHeight;
    }

    public boolean intersects(Rectangle other) {
        return x < other.x + other.width && other.x < x + width
                && y < other.y + other.height && other.y < y + height;
    }
}
