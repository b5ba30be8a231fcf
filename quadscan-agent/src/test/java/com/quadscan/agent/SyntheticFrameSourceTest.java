package com.quadscan.agent;

import java.util.Optional;

import com.quadscan.core.frame.Frame;
import com.quadscan.core.frame.FrameSources;
import com.quadscan.core.frame.SourceReadException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SyntheticFrameSourceTest {

    @Test
    @DisplayName("测试按顺序生成指定数量的帧")
    void testGeneratesFramesInOrder() {
        SyntheticFrameSource source = new SyntheticFrameSource(4, 2, 3, 3);

        for (long expected = 0; expected < 3; expected++) {
            assertEquals(expected, source.currentPosition());
            Frame frame = source.nextFrame().orElseThrow();
            assertEquals(expected, frame.getSequenceId());
            assertEquals("4x2", frame.getResolution());
            assertEquals(3, frame.getChannelCount());
        }
        assertEquals(Optional.empty(), source.nextFrame());
        assertEquals(3, source.currentPosition());
    }

    @Test
    @DisplayName("测试渐变像素值随帧序号平移")
    void testPixelPattern() {
        SyntheticFrameSource source = new SyntheticFrameSource(4, 2, 3, 2);
        Frame first = source.nextFrame().orElseThrow();
        Frame second = source.nextFrame().orElseThrow();

        assertEquals(0, first.getPixel(0, 0, 0));
        assertEquals(86, first.getPixel(1, 0, 1));
        assertEquals(2 + 170, first.getPixel(1, 1, 2));
        assertEquals(1, second.getPixel(0, 0, 0));
    }

    @Test
    @DisplayName("测试seek和peek")
    void testSeekAndPeek() {
        SyntheticFrameSource source = new SyntheticFrameSource(2, 2, 1, 5);
        source.seek(3);
        assertEquals(3, FrameSources.peek(source).orElseThrow().getSequenceId());
        assertEquals(3, source.currentPosition());
        assertThrows(IllegalArgumentException.class, () -> source.seek(6));
    }

    @Test
    @DisplayName("测试关闭后读取失败")
    void testReadAfterClose() {
        SyntheticFrameSource source = new SyntheticFrameSource(2, 2, 1, 5);
        source.close();
        assertThrows(SourceReadException.class, source::nextFrame);
        assertThrows(IllegalArgumentException.class, () -> new SyntheticFrameSource(0, 2, 1, 5));
    }
}
