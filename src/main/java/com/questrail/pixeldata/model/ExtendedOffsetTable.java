package com.questrail.pixeldata.model;

import com.questrail.pixeldata.MalformedContainerException;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;

import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Extended Offset Table: per-frame 64-bit offsets and lengths.
 *
 * <p>The table lives in two elements outside the container (Extended Offset
 * Table and Extended Offset Table Lengths). Each offset is measured like a
 * Basic Offset Table entry, from the first byte after the Basic Offset Table
 * item to the item tag of the frame's fragment. Each length is the value
 * length of that fragment; only one fragment per frame is permitted.</p>
 */
public record ExtendedOffsetTable(List<Long> offsets, List<Long> lengths)
{
    private static final int ENTRY_LENGTH = 8;

    public ExtendedOffsetTable {
        offsets = List.copyOf(Objects.requireNonNull(offsets, "offsets"));
        lengths = List.copyOf(Objects.requireNonNull(lengths, "lengths"));
        if (offsets.size() != lengths.size()) {
            throw new IllegalArgumentException("Extended Offset Table has " + offsets.size()
                    + " offsets but " + lengths.size() + " lengths");
        }
        for (int i = 0; i < offsets.size(); i++) {
            if (offsets.get(i) < 0 || lengths.get(i) < 0) {
                throw new IllegalArgumentException("Extended Offset Table entry " + i + " is negative");
            }
        }
    }

    /**
     * Decodes the raw values of the two Extended Offset Table elements.
     *
     * @throws MalformedContainerException if an entry does not fit in a signed
     *         64-bit value; the offset is the entry's position within its element
     */
    public static ExtendedOffsetTable fromBytes(byte[] offsets, byte[] lengths, ByteOrder order) {
        Objects.requireNonNull(offsets, "offsets");
        Objects.requireNonNull(lengths, "lengths");
        Objects.requireNonNull(order, "order");
        return new ExtendedOffsetTable(unpack(offsets, order), unpack(lengths, order));
    }

    public static ExtendedOffsetTable fromBytes(byte[] offsets, byte[] lengths) {
        return fromBytes(offsets, lengths, ByteOrder.LITTLE_ENDIAN);
    }

    public int frameCount() {
        return offsets.size();
    }

    /** Little-endian encoded value of the Extended Offset Table element. */
    public byte[] offsetsBytes() {
        return pack(offsets);
    }

    /** Little-endian encoded value of the Extended Offset Table Lengths element. */
    public byte[] lengthsBytes() {
        return pack(lengths);
    }

    private static List<Long> unpack(byte[] raw, ByteOrder order) {
        if (raw.length % ENTRY_LENGTH != 0) {
            throw new IllegalArgumentException("Extended Offset Table value length " + raw.length
                    + " is not a multiple of 8");
        }
        final boolean littleEndian = order == ByteOrder.LITTLE_ENDIAN;
        final ByteBuf in = Unpooled.wrappedBuffer(raw);
        final List<Long> values = new ArrayList<>(raw.length / ENTRY_LENGTH);
        while (in.isReadable()) {
            final int position = in.readerIndex();
            final long value = littleEndian ? in.readLongLE() : in.readLong();
            if (value < 0) {
                throw new MalformedContainerException(String.format(
                        "Extended Offset Table entry %d (0x%016X) exceeds the supported range",
                        position / ENTRY_LENGTH, value), position);
            }
            values.add(value);
        }
        return values;
    }

    private static byte[] pack(List<Long> values) {
        final ByteBuf out = Unpooled.buffer(values.size() * ENTRY_LENGTH);
        try {
            values.forEach(out::writeLongLE);
            return ByteBufUtil.getBytes(out);
        }
        finally {
            out.release();
        }
    }
}
