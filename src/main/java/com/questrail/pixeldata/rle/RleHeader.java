package com.questrail.pixeldata.rle;

import com.questrail.pixeldata.MalformedContainerException;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The 64-byte header that opens every RLE frame: a little-endian segment
 * count followed by 15 segment offsets, unused entries zero.
 */
record RleHeader(List<Long> segmentOffsets)
{
    static final int LENGTH = 64;
    static final int MAX_SEGMENTS = 15;

    RleHeader {
        segmentOffsets = List.copyOf(Objects.requireNonNull(segmentOffsets, "segmentOffsets"));
        if (segmentOffsets.size() > MAX_SEGMENTS) {
            throw new IllegalArgumentException("An RLE frame holds at most " + MAX_SEGMENTS
                    + " segments (was " + segmentOffsets.size() + ")");
        }
    }

    int segmentCount()
    {
        return segmentOffsets.size();
    }

    /**
     * Reads the header from the start of an RLE frame.
     *
     * @throws MalformedContainerException if the frame is shorter than the
     *         header or the segment count exceeds 15
     */
    static RleHeader parse(byte[] frame)
    {
        Objects.requireNonNull(frame, "frame");
        if (frame.length < LENGTH) {
            throw new MalformedContainerException("The RLE header must be " + LENGTH
                    + " bytes long but the frame is only " + frame.length + " bytes", 0);
        }

        final ByteBuf header = Unpooled.wrappedBuffer(frame, 0, LENGTH);
        final long count = header.readUnsignedIntLE();
        if (count > MAX_SEGMENTS) {
            throw new MalformedContainerException(
                    "The RLE header specifies an invalid number of segments (" + count + ")", 0);
        }

        final List<Long> offsets = new ArrayList<>((int) count);
        for (int i = 0; i < count; i++) {
            offsets.add(header.readUnsignedIntLE());
        }
        return new RleHeader(offsets);
    }

    /**
     * Header for segments of the given encoded lengths, laid out back to back
     * after the header.
     */
    static RleHeader forSegmentLengths(List<Integer> segmentLengths)
    {
        final List<Long> offsets = new ArrayList<>(segmentLengths.size());
        long offset = LENGTH;
        for (int length : segmentLengths) {
            offsets.add(offset);
            offset += length;
        }
        return new RleHeader(offsets);
    }

    byte[] encode()
    {
        final byte[] raw = new byte[LENGTH];
        final ByteBuf out = Unpooled.wrappedBuffer(raw);
        out.writerIndex(0);
        out.writeIntLE(segmentOffsets.size());
        for (long offset : segmentOffsets) {
            out.writeIntLE((int) offset);
        }
        return raw;
    }
}
