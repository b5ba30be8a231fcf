package com.quadscan.core.frame;

import io.netty.buffer.ByteBuf;

/**
 * 裁剪变换：按 RegionSpec 的矩形裁剪，指定 colorChannel 时只保留该通道。
 * 输出帧沿用输入帧的序号。
 */
public class CropTransform implements RegionTransform {

    @Override
    public Frame apply(Frame frame, RegionSpec region) {
        Rectangle rect = region.getRectangle();
        if (!rect.fitsWithin(frame.getWidth(), frame.getHeight())) {
            throw new IllegalArgumentException("region %s %s does not fit frame %s"
                    .formatted(region.getName(), rect, frame.getResolution()));
        }
        int inChannels = frame.getChannelCount();
        Integer colorChannel = region.getColorChannel();
        if (colorChannel != null && colorChannel >= inChannels) {
            throw new IllegalArgumentException("region %s selects color channel %d but frame has %d"
                    .formatted(region.getName(), colorChannel, inChannels));
        }

        int outChannels = colorChannel != null ? 1 : inChannels;
        byte[] out = new byte[Frame.byteSize(rect.getWidth(), rect.getHeight(), outChannels)];
        ByteBuf src = frame.getData();
        int base = src.readerIndex();
        int rowStride = frame.getWidth() * inChannels;

        int o = 0;
        for (int row = 0; row < rect.getHeight(); row++) {
            int rowStart = base + (rect.getY() + row) * rowStride + rect.getX() * inChannels;
            if (colorChannel == null) {
                int len = rect.getWidth() * inChannels;
                src.getBytes(rowStart, out, o, len);
                o += len;
            } else {
                for (int col = 0; col < rect.getWidth(); col++) {
                    out[o++] = src.getByte(rowStart + col * inChannels + colorChannel);
                }
            }
        }
        return Frame.wrap(frame.getSequenceId(), out, rect.getWidth(), rect.getHeight(), outChannels);
    }
}
