package com.quadscan.core.frame;

import java.util.ArrayList;
import java.util.List;

/**
 * 四个标准象限。每个象限占帧的一半宽、一半高，互不重叠。
 * 奇数尺寸时最后一行/列归右侧、下侧象限。
 */
public enum Quadrant {

    UL("upper left", false, false),
    DL("lower left", false, true),
    UR("upper right", true, false),
    DR("lower right", true, true);

    private final String description;
    private final boolean right;
    private final boolean lower;

    Quadrant(String description, boolean right, boolean lower) {
        this.description = description;
        this.right = right;
        this.lower = lower;
    }

    public String getDescription() {
        return description;
    }

    /**
     * 计算该象限在给定帧尺寸下的矩形
     */
    public Rectangle rectangleFor(int frameWidth, int frameHeight) {
        if (frameWidth < 2 || frameHeight < 2) {
            throw new IllegalArgumentException(
                    "frame %dx%d too small to split into quadrants".formatted(frameWidth, frameHeight));
        }
        int halfWidth = frameWidth / 2;
        int halfHeight = frameHeight / 2;
        int x = right ? halfWidth : 0;
        int y = lower ? halfHeight : 0;
        int w = right ? frameWidth - halfWidth : halfWidth;
        int h = lower ? frameHeight - halfHeight : halfHeight;
        return new Rectangle(x, y, w, h);
    }

    public RegionSpec toRegionSpec(int frameWidth, int frameHeight, Integer colorChannel) {
        return new RegionSpec(name(), rectangleFor(frameWidth, frameHeight), colorChannel);
    }

    /**
     * 按 UL, DL, UR, DR 顺序生成全部四个象限的区域配置
     */
    public static List<RegionSpec> allRegions(int frameWidth, int frameHeight, Integer colorChannel) {
        List<RegionSpec> regions = new ArrayList<>(values().length);
        for (Quadrant quadrant : values()) {
            regions.add(quadrant.toRegionSpec(frameWidth, frameHeight, colorChannel));
        }
        return regions;
    }

    /**
     * 按名称（UL）或描述（upper left）查找象限，不区分大小写
     */
    public static Quadrant fromString(String value) {
        for (Quadrant quadrant : values()) {
            if (quadrant.name().equalsIgnoreCase(value) || quadrant.description.equalsIgnoreCase(value)) {
                return quadrant;
            }
        }
        throw new IllegalArgumentException("unknown quadrant: " + value);
    }
}
