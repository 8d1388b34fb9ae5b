package com.questrail.pixeldata.codec.impl;

import com.questrail.pixeldata.codec.EncapsulatedFrameEncoder;
import com.questrail.pixeldata.config.EncapsulationConfig;
import com.questrail.pixeldata.model.ExtendedEncapsulation;
import com.questrail.pixeldata.model.ExtendedOffsetTable;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * DefaultEncapsulatedFrameEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link EncapsulatedFrameEncoder}.
 *
 * <p>This is the mechanical inverse of {@link DefaultEncapsulatedFrameDecoder}.
 * Output is always little endian.</p>
 */
public final class DefaultEncapsulatedFrameEncoder implements EncapsulatedFrameEncoder
{
    private final EncapsulationConfig config;

    public DefaultEncapsulatedFrameEncoder()
    {
        this(EncapsulationConfig.defaults());
    }

    public DefaultEncapsulatedFrameEncoder(EncapsulationConfig config)
    {
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public byte[] encapsulate(List<byte[]> frames)
    {
        return encapsulate(frames, config.fragmentsPerFrame(), config.includeBasicOffsetTable());
    }

    @Override
    public byte[] encapsulate(List<byte[]> frames, int fragmentsPerFrame, boolean includeBasicOffsetTable)
    {
        Objects.requireNonNull(frames, "frames");
        if (frames.isEmpty()) {
            throw new IllegalArgumentException("At least one frame is required");
        }
        if (fragmentsPerFrame < 1 || fragmentsPerFrame > EncapsulationConfig.MAX_FRAGMENTS_PER_FRAME) {
            throw new IllegalArgumentException("fragmentsPerFrame must be in range 1 to "
                    + EncapsulationConfig.MAX_FRAGMENTS_PER_FRAME + " (was " + fragmentsPerFrame + ")");
        }

        // ---------------------------------------------------------------------
        // 1) Fragment every frame up front so the offsets are known
        // ---------------------------------------------------------------------

        final List<List<byte[]>> fragmented = new ArrayList<>(frames.size());
        final List<List<Integer>> lengths = new ArrayList<>(frames.size());
        for (byte[] frame : frames) {
            List<byte[]> fragments = FrameFragmenter.fragment(Objects.requireNonNull(frame, "frame"), fragmentsPerFrame);
            List<Integer> fragmentLengths = new ArrayList<>(fragments.size());
            for (byte[] fragment : fragments) {
                fragmentLengths.add(fragment.length);
            }
            fragmented.add(fragments);
            lengths.add(fragmentLengths);
        }

        // ---------------------------------------------------------------------
        // 2) Basic Offset Table item, then one item per fragment
        // ---------------------------------------------------------------------

        final ByteBuf out = Unpooled.buffer();
        try {
            BasicOffsetTable.write(out, includeBasicOffsetTable
                    ? BasicOffsetTable.build(lengths)
                    : Collections.emptyList());

            for (List<byte[]> fragments : fragmented) {
                for (byte[] fragment : fragments) {
                    ItemCodec.writeItem(out, fragment);
                }
            }
            return ByteBufUtil.getBytes(out);
        }
        finally {
            out.release();
        }
    }

    @Override
    public ExtendedEncapsulation encapsulateExtended(List<byte[]> frames)
    {
        Objects.requireNonNull(frames, "frames");

        final List<Long> offsets = new ArrayList<>(frames.size());
        final List<Long> lengths = new ArrayList<>(frames.size());
        long offset = 0;
        for (byte[] frame : frames) {
            long length = frame.length + (frame.length % 2);
            offsets.add(offset);
            lengths.add(length);
            offset += ItemCodec.HEADER_LENGTH + length;
        }

        final byte[] pixelData = encapsulate(frames, 1, false);
        return new ExtendedEncapsulation(pixelData, new ExtendedOffsetTable(offsets, lengths));
    }

    @Override
    public List<byte[]> fragment(byte[] frame, int nrFragments)
    {
        return FrameFragmenter.fragment(frame, nrFragments);
    }

    @Override
    public List<byte[]> itemise(byte[] frame, int nrFragments)
    {
        return FrameFragmenter.itemise(frame, nrFragments);
    }
}
