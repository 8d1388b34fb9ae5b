package com.questrail.pixeldata.codec.impl;

import com.questrail.pixeldata.codec.EncapsulatedFrameDecoder;
import com.questrail.pixeldata.config.DecodeConfig;
import com.questrail.pixeldata.io.ByteBufSource;
import com.questrail.pixeldata.io.ByteSource;
import com.questrail.pixeldata.model.ExtendedOffsetTable;
import com.questrail.pixeldata.model.FragmentIndex;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * DefaultEncapsulatedFrameDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link EncapsulatedFrameDecoder}.
 *
 * <p>Decoding a container proceeds in this order:</p>
 * <ol>
 *   <li>Item parsing ({@link ItemCodec})</li>
 *   <li>Basic Offset Table parsing and validation ({@link BasicOffsetTable})</li>
 *   <li>Fragment iteration up to the Sequence Delimiter ({@link FragmentIterator})</li>
 *   <li>Grouping fragments into frames ({@link FrameAssembler})</li>
 * </ol>
 *
 * <p>Instances are immutable and may be shared; the iterators they return
 * are not.</p>
 */
public final class DefaultEncapsulatedFrameDecoder implements EncapsulatedFrameDecoder
{
    private final DecodeConfig config;
    private final FrameAssembler assembler;

    public DefaultEncapsulatedFrameDecoder()
    {
        this(DecodeConfig.defaults());
    }

    public DefaultEncapsulatedFrameDecoder(DecodeConfig config)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.assembler = new FrameAssembler(config.frameBoundaryStrategy(), config.observability());
    }

    public DecodeConfig config()
    {
        return config;
    }

    @Override
    public Iterator<byte[]> frames(byte[] pixelData, int numberOfFrames)
    {
        return frames(wrap(pixelData), numberOfFrames);
    }

    @Override
    public Iterator<byte[]> frames(ByteSource source, int numberOfFrames)
    {
        return assembler.frames(source, numberOfFrames, null);
    }

    @Override
    public Iterator<byte[]> frames(ByteSource source, int numberOfFrames, ExtendedOffsetTable offsetTable)
    {
        return assembler.frames(source, numberOfFrames, Objects.requireNonNull(offsetTable, "offsetTable"));
    }

    @Override
    public byte[] frame(byte[] pixelData, int index, int numberOfFrames)
    {
        return frame(wrap(pixelData), index, numberOfFrames);
    }

    @Override
    public byte[] frame(ByteSource source, int index, int numberOfFrames)
    {
        return assembler.frame(source, index, numberOfFrames, null);
    }

    @Override
    public byte[] frame(ByteSource source, int index, int numberOfFrames, ExtendedOffsetTable offsetTable)
    {
        return assembler.frame(source, index, numberOfFrames, Objects.requireNonNull(offsetTable, "offsetTable"));
    }

    @Override
    public Iterator<byte[]> fragments(ByteSource source)
    {
        return new FragmentIterator(Objects.requireNonNull(source, "source"), config.observability());
    }

    @Override
    public List<Long> basicOffsets(ByteSource source)
    {
        return BasicOffsetTable.parse(Objects.requireNonNull(source, "source"), config.observability());
    }

    @Override
    public FragmentIndex fragmentIndex(ByteSource source)
    {
        return FragmentIterator.index(Objects.requireNonNull(source, "source"), config.observability());
    }

    private ByteSource wrap(byte[] pixelData)
    {
        return ByteBufSource.wrap(Objects.requireNonNull(pixelData, "pixelData"), config.containerByteOrder());
    }
}
