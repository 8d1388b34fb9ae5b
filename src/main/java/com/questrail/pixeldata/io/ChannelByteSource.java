package com.questrail.pixeldata.io;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.SeekableByteChannel;
import java.util.Arrays;
import java.util.Objects;

/**
 * ByteSource over a {@link SeekableByteChannel}, for pixel data that is read
 * straight from a file rather than loaded into memory.
 *
 * <p>Positions are relative to the channel position at construction, so the
 * channel may already be placed at the start of the Pixel Data value. The
 * channel stays owned by the caller and is never closed here.</p>
 *
 * <p>I/O failures are rethrown as {@link UncheckedIOException}.</p>
 */
public final class ChannelByteSource implements ByteSource
{
    private final SeekableByteChannel channel;
    private final ByteOrder order;
    private final long origin;
    private final long size;

    public ChannelByteSource(SeekableByteChannel channel)
    {
        this(channel, ByteOrder.LITTLE_ENDIAN);
    }

    public ChannelByteSource(SeekableByteChannel channel, ByteOrder order)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.order = Objects.requireNonNull(order, "order");
        try {
            this.origin = channel.position();
            this.size = channel.size() - origin;
        }
        catch (IOException e) {
            throw new UncheckedIOException("Unable to query channel position", e);
        }
    }

    @Override
    public byte[] read(int n)
    {
        if (n < 0) {
            throw new IllegalArgumentException("Cannot read a negative number of bytes (" + n + ")");
        }
        ByteBuffer dst = ByteBuffer.allocate((int) Math.min(n, Math.max(0, remaining())));
        try {
            while (dst.hasRemaining()) {
                if (channel.read(dst) < 0) {
                    break;
                }
            }
        }
        catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + n + " bytes at offset " + tell(), e);
        }
        return (dst.position() == dst.capacity()) ? dst.array() : Arrays.copyOf(dst.array(), dst.position());
    }

    @Override
    public long tell()
    {
        try {
            return channel.position() - origin;
        }
        catch (IOException e) {
            throw new UncheckedIOException("Unable to query channel position", e);
        }
    }

    @Override
    public void seek(long position)
    {
        if (position < 0 || position > size) {
            throw new IllegalArgumentException("Position " + position + " is outside the data (0 to " + size + ")");
        }
        try {
            channel.position(origin + position);
        }
        catch (IOException e) {
            throw new UncheckedIOException("Unable to seek to offset " + position, e);
        }
    }

    @Override
    public long size()
    {
        return size;
    }

    @Override
    public ByteOrder order()
    {
        return order;
    }
}
