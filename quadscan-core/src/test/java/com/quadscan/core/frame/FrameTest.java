package com.quadscan.core.frame;

import java.nio.ReadOnlyBufferException;

import io.netty.buffer.ByteBuf;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FrameTest {

    @Test
    @DisplayName("测试Frame创建和像素访问")
    void testCreationAndPixelAccess() {
        byte[] pixels = new byte[2 * 2 * 3];
        for (int i = 0; i < pixels.length; i++) {
            pixels[i] = (byte) (i * 20);
        }
        Frame frame = Frame.of(7, pixels, 2, 2, 3);

        assertEquals(7, frame.getSequenceId());
        assertEquals("2x2", frame.getResolution());
        assertEquals(12, frame.getDataSize());
        // (x=1, y=1, c=2) -> index (1*2+1)*3+2 = 11
        assertEquals(220, frame.getPixel(1, 1, 2));
        assertThrows(IndexOutOfBoundsException.class, () -> frame.getPixel(2, 0, 0));
    }

    @Test
    @DisplayName("测试Frame不可变：修改原数组和拷贝都不影响帧数据")
    void testImmutability() {
        byte[] pixels = new byte[] { 1, 2, 3, 4 };
        Frame frame = Frame.of(0, pixels, 2, 2, 1);

        pixels[0] = 99;
        assertEquals(1, frame.getPixel(0, 0, 0));

        byte[] copy = frame.getDataBytes();
        copy[1] = 99;
        assertEquals(2, frame.getPixel(1, 0, 0));

        ByteBuf view = frame.getData();
        assertTrue(view.isReadOnly());
        assertThrows(ReadOnlyBufferException.class, () -> view.setByte(0, 42));
    }

    @Test
    @DisplayName("测试getData返回相互独立的读索引")
    void testIndependentViews() {
        Frame frame = Frame.of(0, new byte[] { 1, 2, 3, 4 }, 2, 2, 1);
        ByteBuf first = frame.getData();
        first.readByte();
        ByteBuf second = frame.getData();

        assertEquals(3, first.readableBytes());
        assertEquals(4, second.readableBytes());
    }

    @Test
    @DisplayName("测试非法参数")
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> Frame.of(0, new byte[3], 2, 2, 1));
        assertThrows(IllegalArgumentException.class, () -> Frame.of(-1, new byte[4], 2, 2, 1));
        assertThrows(IllegalArgumentException.class, () -> Frame.of(0, new byte[0], 0, 2, 1));
        assertThrows(IllegalArgumentException.class, () -> Frame.of(0, null, 2, 2, 1));
    }

    @Test
    @DisplayName("测试帧尺寸溢出int时被拒绝")
    void testByteSizeOverflow() {
        assertEquals(24, Frame.byteSize(4, 2, 3));
        // 65536 * 65536 溢出为 0，不能让空数组通过校验
        IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class,
                () -> Frame.of(0, new byte[0], 65536, 65536, 1));
        assertInstanceOf(ArithmeticException.class, thrown.getCause());
        assertThrows(IllegalArgumentException.class, () -> Frame.byteSize(46341, 46341, 1));
        assertThrows(IllegalArgumentException.class, () -> Frame.byteSize(1 << 20, 1 << 10, 3));
    }
}
