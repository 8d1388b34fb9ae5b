package com.questrail.pixeldata.io;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.nio.ByteOrder;
import java.util.Objects;

/**
 * ByteBufSource
 * =============================================================================
 * In-memory {@link ByteSource} backed by a Netty {@link ByteBuf}.
 *
 * <h2>Netty containment rule</h2>
 * The wrapped buffer is created here from a caller-owned {@code byte[]} and
 * never handed out. It wraps the array without copying and is read-only, so
 * the caller's data is not modified. Heap wrappers hold no pooled memory and
 * need no release.
 *
 * <p>The buffer's reader index is the cursor.</p>
 */
public final class ByteBufSource implements ByteSource
{
    private final ByteBuf buffer;
    private final ByteOrder order;

    private ByteBufSource(ByteBuf buffer, ByteOrder order)
    {
        this.buffer = buffer;
        this.order = order;
    }

    /**
     * Wraps {@code data} for little-endian reads.
     */
    public static ByteBufSource wrap(byte[] data)
    {
        return wrap(data, ByteOrder.LITTLE_ENDIAN);
    }

    public static ByteBufSource wrap(byte[] data, ByteOrder order)
    {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(order, "order");
        return new ByteBufSource(Unpooled.wrappedBuffer(data).asReadOnly(), order);
    }

    @Override
    public byte[] read(int n)
    {
        if (n < 0) {
            throw new IllegalArgumentException("Cannot read a negative number of bytes (" + n + ")");
        }
        byte[] out = new byte[Math.min(n, buffer.readableBytes())];
        buffer.readBytes(out);
        return out;
    }

    @Override
    public long tell()
    {
        return buffer.readerIndex();
    }

    @Override
    public void seek(long position)
    {
        if (position < 0 || position > buffer.writerIndex()) {
            throw new IllegalArgumentException("Position " + position + " is outside the data (0 to "
                    + buffer.writerIndex() + ")");
        }
        buffer.readerIndex((int) position);
    }

    @Override
    public long size()
    {
        return buffer.writerIndex();
    }

    @Override
    public ByteOrder order()
    {
        return order;
    }

    @Override
    public int readUnsignedShort()
    {
        return (order == ByteOrder.LITTLE_ENDIAN) ? buffer.readUnsignedShortLE() : buffer.readUnsignedShort();
    }

    @Override
    public long readUnsignedInt()
    {
        return (order == ByteOrder.LITTLE_ENDIAN) ? buffer.readUnsignedIntLE() : buffer.readUnsignedInt();
    }
}
