package com.quadscan.core.frame;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class QuadrantTest {

    @Test
    @DisplayName("测试四个象限互不重叠且覆盖整帧")
    void testQuadrantsPartitionFrame() {
        int width = 7;
        int height = 5;
        List<RegionSpec> regions = Quadrant.allRegions(width, height, null);

        assertEquals(List.of("UL", "DL", "UR", "DR"), regions.stream().map(RegionSpec::getName).toList());

        int covered = 0;
        for (int i = 0; i < regions.size(); i++) {
            Rectangle rect = regions.get(i).getRectangle();
            assertTrue(rect.fitsWithin(width, height));
            covered += rect.getWidth() * rect.getHeight();
            for (int j = i + 1; j < regions.size(); j++) {
                assertFalse(rect.intersects(regions.get(j).getRectangle()));
            }
        }
        assertEquals(width * height, covered);
    }

    @Test
    @DisplayName("测试象限矩形")
    void testRectangles() {
        assertEquals(new Rectangle(0, 0, 4, 3), Quadrant.UL.rectangleFor(8, 6));
        assertEquals(new Rectangle(0, 3, 4, 3), Quadrant.DL.rectangleFor(8, 6));
        assertEquals(new Rectangle(4, 0, 4, 3), Quadrant.UR.rectangleFor(8, 6));
        assertEquals(new Rectangle(4, 3, 4, 3), Quadrant.DR.rectangleFor(8, 6));
        assertThrows(IllegalArgumentException.class, () -> Quadrant.UL.rectangleFor(1, 6));
    }

    @Test
    @DisplayName("测试按名称或描述查找象限")
    void testFromString() {
        assertEquals(Quadrant.DR, Quadrant.fromString("dr"));
        assertEquals(Quadrant.DL, Quadrant.fromString("lower left"));
        assertEquals("upper right", Quadrant.UR.getDescription());
        assertThrows(IllegalArgumentException.class, () -> Quadrant.fromString("middle"));
    }
}
