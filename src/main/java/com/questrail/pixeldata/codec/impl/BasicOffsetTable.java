package com.questrail.pixeldata.codec.impl;

import com.questrail.pixeldata.MalformedContainerException;
import com.questrail.pixeldata.io.ByteBufSource;
import com.questrail.pixeldata.io.ByteSource;
import com.questrail.pixeldata.observability.PixelDataObservabilitySink;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * BasicOffsetTable
 * -----------------------------------------------------------------------------
 * Parses and builds the Basic Offset Table, the item that always opens an
 * encapsulated container.
 *
 * <p>A non-empty table holds one unsigned 32-bit offset per frame. Each offset
 * is measured from the first byte after the table item to the item tag of the
 * frame's first fragment, so the first offset is always 0. An empty table
 * (zero length) means the offsets are unknown.</p>
 */
final class BasicOffsetTable
{
    private static final long MAX_OFFSET = 0xFFFFFFFFL;

    private BasicOffsetTable() {}

    /**
     * Reads the Basic Offset Table item at the current position of {@code source}.
     *
     * <p>On return {@code source} is positioned at the item tag of the first
     * fragment.</p>
     *
     * @return the frame offsets, or an empty list if the table is empty
     * @throws MalformedContainerException if the first item is missing, its
     *         length is not a multiple of 4, or the offsets are not strictly
     *         increasing from 0
     */
    static List<Long> parse(ByteSource source, PixelDataObservabilitySink sink)
    {
        final ItemCodec.Item item = ItemCodec.readItem(source, sink);
        if (!item.isValue()) {
            throw new MalformedContainerException(
                    "Expected the Basic Offset Table item at offset " + item.offset()
                            + " but found " + item.kind(), item.offset());
        }

        final byte[] value = item.value();
        if (value.length % 4 != 0) {
            throw new MalformedContainerException(
                    "The length of the Basic Offset Table item is not a multiple of 4 (" + value.length + ")",
                    item.offset());
        }
        if (value.length == 0) {
            return Collections.emptyList();
        }

        final ByteSource entries = ByteBufSource.wrap(value, source.order());
        final List<Long> offsets = new ArrayList<>(value.length / 4);
        for (int i = 0; i < value.length / 4; i++) {
            offsets.add(entries.readUnsignedInt());
        }

        if (offsets.get(0) != 0) {
            throw new MalformedContainerException(
                    "The first Basic Offset Table entry must be 0 (was " + offsets.get(0) + ")", item.offset());
        }
        for (int i = 1; i < offsets.size(); i++) {
            if (offsets.get(i) <= offsets.get(i - 1)) {
                throw new MalformedContainerException(String.format(
                        "Basic Offset Table entries must be strictly increasing (entry %d is %d after %d)",
                        i, offsets.get(i), offsets.get(i - 1)), item.offset());
            }
        }
        return Collections.unmodifiableList(offsets);
    }

    /**
     * Computes the frame offsets for frames made of fragments with the given
     * (already padded) value lengths.
     *
     * <p>Each frame's offset is the sum of {@code 8 + fragmentLength} over every
     * fragment of every preceding frame; 8 accounts for the fragment's own tag
     * and length.</p>
     */
    static List<Long> build(List<List<Integer>> fragmentLengthsPerFrame)
    {
        Objects.requireNonNull(fragmentLengthsPerFrame, "fragmentLengthsPerFrame");

        final List<Long> offsets = new ArrayList<>(fragmentLengthsPerFrame.size());
        long offset = 0;
        for (List<Integer> frame : fragmentLengthsPerFrame) {
            offsets.add(offset);
            for (int fragmentLength : frame) {
                offset += ItemCodec.HEADER_LENGTH + fragmentLength;
            }
        }
        return offsets;
    }

    /**
     * Appends the Basic Offset Table item to {@code out}. An empty list writes
     * a zero-length item.
     *
     * @throws IllegalArgumentException if an offset does not fit in 32 bits
     */
    static void write(ByteBuf out, List<Long> offsets)
    {
        for (long offset : offsets) {
            if (offset < 0 || offset > MAX_OFFSET) {
                throw new IllegalArgumentException("The frame offset " + offset
                        + " is greater than the maximum allowed by the Basic Offset Table ("
                        + MAX_OFFSET + "), use the Extended Offset Table instead");
            }
        }

        final byte[] value = new byte[offsets.size() * 4];
        final ByteBuf entries = Unpooled.wrappedBuffer(value);
        entries.writerIndex(0);
        for (long offset : offsets) {
            entries.writeIntLE((int) offset);
        }
        ItemCodec.writeItem(out, value);
    }
}
