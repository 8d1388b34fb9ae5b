package com.questrail.pixeldata.rle;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;

import java.util.Objects;

/**
 * RleSegmentCodec
 * -----------------------------------------------------------------------------
 * PackBits-style run-length coding of one RLE segment (DICOM PS3.5 Annex G.3).
 *
 * <p>Each run starts with a header byte {@code h}:</p>
 * <pre>
 *   0..127    literal run: copy the next h + 1 bytes
 *   129..255  replicate run: repeat the next byte 257 - h times
 *   128       no operation
 * </pre>
 *
 * <p>Runs truncated by the end of the segment contribute the bytes that are
 * present. Producers pad odd-length segments with a trailing {@code 0x00},
 * which decodes as a literal run with nothing to copy.</p>
 */
public final class RleSegmentCodec
{
    static final int MAX_RUN = 128;

    private static final int NO_OP = 128;

    private RleSegmentCodec() {}

    public static byte[] decode(byte[] segment)
    {
        Objects.requireNonNull(segment, "segment");
        return decode(segment, 0, segment.length);
    }

    /**
     * Decodes {@code length} bytes of {@code data} starting at {@code offset}.
     *
     * <p>The output is sized by a first pass over the run headers, then filled
     * by a second pass.</p>
     */
    public static byte[] decode(byte[] data, int offset, int length)
    {
        Objects.requireNonNull(data, "data");
        Objects.checkFromIndexSize(offset, length, data.length);

        final int end = offset + length;
        final byte[] out = new byte[decodedLength(data, offset, end)];

        int pos = offset;
        int w = 0;
        while (pos < end) {
            final int h = data[pos++] & 0xFF;
            if (h < NO_OP) {
                final int n = Math.min(h + 1, end - pos);
                System.arraycopy(data, pos, out, w, n);
                pos += n;
                w += n;
            }
            else if (h > NO_OP) {
                if (pos >= end) {
                    break;
                }
                final int n = 257 - h;
                final byte value = data[pos++];
                for (int i = 0; i < n; i++) {
                    out[w++] = value;
                }
            }
        }
        return out;
    }

    private static int decodedLength(byte[] data, int pos, int end)
    {
        int size = 0;
        while (pos < end) {
            final int h = data[pos++] & 0xFF;
            if (h < NO_OP) {
                final int n = Math.min(h + 1, end - pos);
                size = Math.addExact(size, n);
                pos += n;
            }
            else if (h > NO_OP) {
                if (pos >= end) {
                    break;
                }
                size = Math.addExact(size, 257 - h);
                pos++;
            }
        }
        return size;
    }

    /**
     * Encodes {@code data} as a single run sequence.
     *
     * <p>Repeats of two or more bytes become replicate runs and everything
     * else is gathered into literal runs of at most 128 bytes. The result is
     * not padded.</p>
     */
    public static byte[] encode(byte[] data)
    {
        Objects.requireNonNull(data, "data");

        final ByteBuf out = Unpooled.buffer(data.length + data.length / MAX_RUN + 2);
        try {
            encodeRow(data, 0, data.length, out);
            return ByteBufUtil.getBytes(out);
        }
        finally {
            out.release();
        }
    }

    /**
     * Encodes {@code data} one row of {@code columns} bytes at a time, so no
     * run crosses a row boundary, and pads the result to an even length.
     *
     * @throws IllegalArgumentException if {@code data} is not a whole number of rows
     */
    public static byte[] encodeRows(byte[] data, int columns)
    {
        Objects.requireNonNull(data, "data");
        if (columns < 1) {
            throw new IllegalArgumentException("columns must be positive (was " + columns + ")");
        }
        if (data.length % columns != 0) {
            throw new IllegalArgumentException(String.format(
                    "The segment length %d is not a multiple of the row length %d", data.length, columns));
        }

        final ByteBuf out = Unpooled.buffer(data.length + data.length / MAX_RUN + 2);
        try {
            for (int row = 0; row < data.length; row += columns) {
                encodeRow(data, row, row + columns, out);
            }
            if (out.readableBytes() % 2 != 0) {
                out.writeByte(0);
            }
            return ByteBufUtil.getBytes(out);
        }
        finally {
            out.release();
        }
    }

    private static void encodeRow(byte[] data, int start, int end, ByteBuf out)
    {
        int literalStart = start;
        int pos = start;

        while (pos < end) {
            int runEnd = pos + 1;
            while (runEnd < end && data[runEnd] == data[pos]) {
                runEnd++;
            }
            final int runLength = runEnd - pos;

            if (runLength > 1) {
                writeLiteral(data, literalStart, pos, out);
                writeReplicate(data[pos], runLength, out);
                literalStart = runEnd;
            }
            pos = runEnd;
        }
        writeLiteral(data, literalStart, end, out);
    }

    private static void writeLiteral(byte[] data, int from, int to, ByteBuf out)
    {
        for (int i = from; i < to; i += MAX_RUN) {
            final int n = Math.min(MAX_RUN, to - i);
            out.writeByte(n - 1);
            out.writeBytes(data, i, n);
        }
    }

    private static void writeReplicate(byte value, int count, ByteBuf out)
    {
        for (int i = 0; i < count / MAX_RUN; i++) {
            out.writeByte(257 - MAX_RUN);
            out.writeByte(value);
        }
        final int partial = count % MAX_RUN;
        if (partial > 1) {
            out.writeByte(257 - partial);
            out.writeByte(value);
        }
        else if (partial == 1) {
            // a lone leftover byte is a one-byte literal
            out.writeByte(0);
            out.writeByte(value);
        }
    }
}
