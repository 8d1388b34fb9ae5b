package com.questrail.pixeldata.io;

import java.nio.ByteOrder;

/**
 * ByteSource
 * -----------------------------------------------------------------------------
 * Minimal read/seek capability over encapsulated pixel data.
 *
 * <p>The container parser reads bytes, asks for its position and seeks.
 * Implementations may be backed by an in-memory buffer ({@link ByteBufSource})
 * or a seekable channel ({@link ChannelByteSource}).</p>
 *
 * <p>A source carries the byte order used for its integer reads. It is a
 * single-consumer cursor and is not thread-safe; independent sources over the
 * same read-only data are.</p>
 */
public interface ByteSource
{
    /**
     * Reads up to {@code n} bytes and advances the position by the number read.
     *
     * @return the bytes read; shorter than {@code n} only when the end of the
     *         data has been reached
     */
    byte[] read(int n);

    /**
     * Current position, in bytes from the start of the data.
     */
    long tell();

    /**
     * Moves to an absolute position.
     *
     * @throws IllegalArgumentException if {@code position} is outside {@code [0, size()]}
     */
    void seek(long position);

    /**
     * Total number of bytes in the data.
     */
    long size();

    /**
     * Byte order used by {@link #readUnsignedShort()} and {@link #readUnsignedInt()}.
     */
    ByteOrder order();

    default long remaining() {
        return size() - tell();
    }

    /**
     * Reads an unsigned 16-bit value in {@link #order()}.
     *
     * @throws IndexOutOfBoundsException if fewer than 2 bytes remain
     */
    default int readUnsignedShort() {
        byte[] b = readFully(2);
        return (order() == ByteOrder.LITTLE_ENDIAN)
                ? (b[0] & 0xFF) | (b[1] & 0xFF) << 8
                : (b[0] & 0xFF) << 8 | (b[1] & 0xFF);
    }

    /**
     * Reads an unsigned 32-bit value in {@link #order()}.
     *
     * @throws IndexOutOfBoundsException if fewer than 4 bytes remain
     */
    default long readUnsignedInt() {
        byte[] b = readFully(4);
        long value = 0;
        for (int i = 0; i < 4; i++) {
            int shift = (order() == ByteOrder.LITTLE_ENDIAN) ? 8 * i : 8 * (3 - i);
            value |= (long) (b[i] & 0xFF) << shift;
        }
        return value;
    }

    private byte[] readFully(int n) {
        long position = tell();
        byte[] b = read(n);
        if (b.length != n) {
            seek(position);
            throw new IndexOutOfBoundsException("Expected " + n + " bytes at offset " + position
                    + " but only " + b.length + " remain");
        }
        return b;
    }
}
