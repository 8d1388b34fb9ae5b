package com.questrail.pixeldata;

import com.questrail.pixeldata.codec.EncapsulatedFrameDecoder;
import com.questrail.pixeldata.codec.EncapsulatedFrameEncoder;
import com.questrail.pixeldata.codec.impl.DefaultEncapsulatedFrameDecoder;
import com.questrail.pixeldata.codec.impl.DefaultEncapsulatedFrameEncoder;
import com.questrail.pixeldata.config.DecodeConfig;
import com.questrail.pixeldata.config.EncapsulationConfig;
import com.questrail.pixeldata.model.ImageGeometry;
import com.questrail.pixeldata.observability.PixelDataFrameEvent;
import com.questrail.pixeldata.rle.RleFrameCodec;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * RlePixelDataCodec
 * -----------------------------------------------------------------------------
 * Encapsulated Pixel Data for the RLE Lossless transfer syntax, end to end.
 *
 * <p>This class wires together:</p>
 * <ul>
 *   <li>{@link EncapsulatedFrameDecoder} / {@link EncapsulatedFrameEncoder} (container)</li>
 *   <li>{@link RleFrameCodec} (compression)</li>
 * </ul>
 *
 * <p>Decoded frames are little endian with planar configuration 1. Frames are
 * decoded one at a time as the returned iterator is advanced.</p>
 */
public final class RlePixelDataCodec
{
    private final DecodeConfig decodeConfig;
    private final EncapsulatedFrameDecoder container;
    private final EncapsulatedFrameEncoder encapsulator;
    private final RleFrameCodec rle;

    public RlePixelDataCodec()
    {
        this(DecodeConfig.defaults());
    }

    public RlePixelDataCodec(DecodeConfig decodeConfig)
    {
        this.decodeConfig = Objects.requireNonNull(decodeConfig, "decodeConfig");
        this.container = new DefaultEncapsulatedFrameDecoder(decodeConfig);
        this.encapsulator = new DefaultEncapsulatedFrameEncoder(EncapsulationConfig.defaults());
        this.rle = new RleFrameCodec(decodeConfig);
    }

    /**
     * Yields each decoded frame of {@code pixelData} in order.
     */
    public Iterator<byte[]> decodeFrames(byte[] pixelData, ImageGeometry geometry, int numberOfFrames)
    {
        Objects.requireNonNull(geometry, "geometry");
        final Iterator<byte[]> frames = container.frames(pixelData, numberOfFrames);

        return new Iterator<>()
        {
            private int index;

            @Override
            public boolean hasNext()
            {
                return frames.hasNext();
            }

            @Override
            public byte[] next()
            {
                return decode(frames.next(), geometry, index++);
            }
        };
    }

    /**
     * Decodes every frame of {@code pixelData}.
     */
    public List<byte[]> decodeAll(byte[] pixelData, ImageGeometry geometry, int numberOfFrames)
    {
        final List<byte[]> decoded = new ArrayList<>(numberOfFrames);
        decodeFrames(pixelData, geometry, numberOfFrames).forEachRemaining(decoded::add);
        return decoded;
    }

    /**
     * Decodes only the frame at {@code index} (0-based).
     */
    public byte[] decodeFrame(byte[] pixelData, ImageGeometry geometry, int numberOfFrames, int index)
    {
        Objects.requireNonNull(geometry, "geometry");
        return decode(container.frame(pixelData, index, numberOfFrames), geometry, index);
    }

    /**
     * RLE-encodes each frame (little endian, planar configuration 1) and
     * encapsulates the results one fragment per frame with a Basic Offset Table.
     */
    public byte[] encode(List<byte[]> frames, ImageGeometry geometry)
    {
        Objects.requireNonNull(frames, "frames");
        Objects.requireNonNull(geometry, "geometry");

        final List<byte[]> encoded = new ArrayList<>(frames.size());
        for (byte[] frame : frames) {
            encoded.add(rle.encode(frame, geometry));
        }
        return encapsulator.encapsulate(encoded);
    }

    private byte[] decode(byte[] frame, ImageGeometry geometry, int index)
    {
        final byte[] decoded = rle.decode(frame, geometry);
        decodeConfig.observability().onFrameDecoded(PixelDataFrameEvent.of(index, frame.length, decoded.length));
        return decoded;
    }
}
