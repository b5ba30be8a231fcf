package com.quadscan.core.frame;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CropTransformTest {

    private final CropTransform transform = new CropTransform();

    /**
     * 4x2 帧，3 通道，像素值 = x*10 + y*100 + c
     */
    private static Frame gradientFrame() {
        int width = 4;
        int height = 2;
        byte[] pixels = new byte[width * height * 3];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                for (int c = 0; c < 3; c++) {
                    pixels[(y * width + x) * 3 + c] = (byte) (x * 10 + y * 100 + c);
                }
            }
        }
        return Frame.of(5, pixels, width, height, 3);
    }

    @Test
    @DisplayName("测试裁剪保留全部通道")
    void testCropAllChannels() {
        Frame source = gradientFrame();
        RegionSpec region = new RegionSpec("UR", new Rectangle(2, 0, 2, 1), null);

        Frame cropped = transform.apply(source, region);

        assertEquals(5, cropped.getSequenceId());
        assertEquals(2, cropped.getWidth());
        assertEquals(1, cropped.getHeight());
        assertEquals(3, cropped.getChannelCount());
        assertEquals(20, cropped.getPixel(0, 0, 0));
        assertEquals(32, cropped.getPixel(1, 0, 2));
    }

    @Test
    @DisplayName("测试裁剪并提取单个颜色通道")
    void testCropSingleChannel() {
        Frame source = gradientFrame();
        RegionSpec region = new RegionSpec("DL", new Rectangle(0, 1, 2, 1), 1);

        Frame cropped = transform.apply(source, region);

        assertEquals(1, cropped.getChannelCount());
        assertEquals(101, cropped.getPixel(0, 0, 0));
        assertEquals(111, cropped.getPixel(1, 0, 0));
    }

    @Test
    @DisplayName("测试裁剪不修改源帧")
    void testSourceUntouched() {
        Frame source = gradientFrame();
        byte[] before = source.getDataBytes();

        Frame cropped = transform.apply(source, new RegionSpec("all", new Rectangle(0, 0, 4, 2), null));

        assertNotSame(source, cropped);
        assertArrayEquals(before, source.getDataBytes());
        assertArrayEquals(before, cropped.getDataBytes());
    }

    @Test
    @DisplayName("测试区域越界或通道不存在")
    void testInvalidRegion() {
        Frame source = gradientFrame();
        assertThrows(IllegalArgumentException.class,
                () -> transform.apply(source, new RegionSpec("big", new Rectangle(3, 0, 2, 1), null)));
        assertThrows(IllegalArgumentException.class,
                () -> transform.apply(source, new RegionSpec("alpha", new Rectangle(0, 0, 1, 1), 3)));
    }
}
