package com.questrail.pixeldata.rle;

import com.questrail.pixeldata.MalformedContainerException;
import com.questrail.pixeldata.SegmentCountMismatchException;
import com.questrail.pixeldata.SegmentLengthMismatchException;
import com.questrail.pixeldata.UnsupportedRleEncodingException;
import com.questrail.pixeldata.config.DecodeConfig;
import com.questrail.pixeldata.model.ImageGeometry;
import com.questrail.pixeldata.model.SegmentOrder;
import com.questrail.pixeldata.observability.PixelDataWarning;
import com.questrail.pixeldata.observability.PixelDataWarningEvent;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * RleFrameCodec
 * -----------------------------------------------------------------------------
 * Decodes and encodes one RLE Lossless frame (DICOM PS3.5 Annex G).
 *
 * <p>A frame is a 64-byte {@link RleHeader} followed by one segment per byte
 * plane. For every sample the segments run from the most significant byte
 * plane to the least significant:</p>
 * <pre>
 *   16-bit RGB:  segment 0    1    2    3    4    5
 *                        R MSB  R LSB  G MSB  G LSB  B MSB  B LSB
 * </pre>
 *
 * <p>Decoded frames are little endian with planar configuration 1: all bytes
 * of sample 0, then all bytes of sample 1, and so on. {@link #encode} takes
 * the same layout, so {@code decode(encode(pixels)) == pixels}.</p>
 */
public final class RleFrameCodec
{
    private final DecodeConfig config;

    public RleFrameCodec()
    {
        this(DecodeConfig.defaults());
    }

    public RleFrameCodec(DecodeConfig config)
    {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Decodes {@code frame} using the configured segment order.
     */
    public byte[] decode(byte[] frame, ImageGeometry geometry)
    {
        return decode(frame, geometry, config.segmentOrder());
    }

    /**
     * Decodes {@code frame} into {@code geometry.frameLength()} bytes.
     *
     * @param order {@link SegmentOrder#LITTLE_ENDIAN} for frames written by
     *              encoders that put the least significant plane first
     * @throws UnsupportedRleEncodingException if bits allocated is not a multiple of 8
     * @throws MalformedContainerException     if the header or a segment offset is invalid
     * @throws SegmentCountMismatchException   if the header lists the wrong number of segments
     * @throws SegmentLengthMismatchException  if a segment decodes to too few bytes
     */
    public byte[] decode(byte[] frame, ImageGeometry geometry, SegmentOrder order)
    {
        Objects.requireNonNull(frame, "frame");
        Objects.requireNonNull(geometry, "geometry");
        Objects.requireNonNull(order, "order");

        if (geometry.bitsAllocated() % 8 != 0) {
            throw new UnsupportedRleEncodingException(
                    "Unable to decode RLE encoded pixel data with " + geometry.bitsAllocated() + " bits allocated");
        }

        final RleHeader header = RleHeader.parse(frame);
        final int expectedSegments = geometry.segmentCount();
        if (header.segmentCount() != expectedSegments) {
            throw new SegmentCountMismatchException(expectedSegments, header.segmentCount());
        }

        // The last segment runs to the end of the frame
        final List<Long> bounds = new ArrayList<>(header.segmentOffsets());
        bounds.add((long) frame.length);

        final int bytesPerSample = geometry.bytesPerSample();
        final int pixels = geometry.pixelCount();
        final int stride = Math.multiplyExact(pixels, bytesPerSample);
        final byte[] out = new byte[geometry.frameLength()];

        for (int sample = 0; sample < geometry.samplesPerPixel(); sample++) {
            for (int b = 0; b < bytesPerSample; b++) {
                final int segmentIndex = sample * bytesPerSample
                        + (order == SegmentOrder.BIG_ENDIAN ? bytesPerSample - 1 - b : b);

                final long start = bounds.get(segmentIndex);
                final long end = bounds.get(segmentIndex + 1);
                if (start > end || end > frame.length) {
                    throw new MalformedContainerException(String.format(
                            "RLE segment %d spans offsets %d to %d, outside the %d byte frame",
                            segmentIndex, start, end, frame.length), start);
                }

                final byte[] segment = RleSegmentCodec.decode(frame, (int) start, (int) (end - start));
                if (segment.length < pixels) {
                    throw new SegmentLengthMismatchException(segmentIndex, pixels, segment.length);
                }
                if (segment.length > pixels) {
                    config.observability().onWarning(PixelDataWarningEvent.of(PixelDataWarning.RLE_SEGMENT_PADDING,
                            String.format("The decoded RLE segment %d contains non-conformant padding (%d vs. %d bytes expected)",
                                    segmentIndex, segment.length, pixels)));
                }

                int w = b + sample * stride;
                for (int i = 0; i < pixels; i++) {
                    out[w] = segment[i];
                    w += bytesPerSample;
                }
            }
        }
        return out;
    }

    /**
     * Encodes a little-endian, planar configuration 1 frame.
     *
     * @throws IllegalArgumentException        if the frame needs more than 15 segments
     *                                         or {@code pixels} has the wrong length
     * @throws UnsupportedRleEncodingException if bits allocated is not a multiple of 8
     */
    public byte[] encode(byte[] pixels, ImageGeometry geometry)
    {
        Objects.requireNonNull(pixels, "pixels");
        checkEncodable(pixels, geometry);

        final int bytesPerSample = geometry.bytesPerSample();
        final int pixelCount = geometry.pixelCount();
        final int stride = pixelCount * bytesPerSample;

        final List<byte[]> segments = new ArrayList<>(geometry.segmentCount());
        final List<Integer> lengths = new ArrayList<>(geometry.segmentCount());
        final byte[] plane = new byte[pixelCount];
        for (int sample = 0; sample < geometry.samplesPerPixel(); sample++) {
            for (int b = bytesPerSample - 1; b >= 0; b--) {
                int r = b + sample * stride;
                for (int i = 0; i < pixelCount; i++) {
                    plane[i] = pixels[r];
                    r += bytesPerSample;
                }
                byte[] segment = RleSegmentCodec.encodeRows(plane, geometry.columns());
                segments.add(segment);
                lengths.add(segment.length);
            }
        }

        final ByteBuf out = Unpooled.buffer();
        try {
            out.writeBytes(RleHeader.forSegmentLengths(lengths).encode());
            segments.forEach(out::writeBytes);
            return ByteBufUtil.getBytes(out);
        }
        finally {
            out.release();
        }
    }

    /**
     * Encodes a little-endian, pixel-interleaved (planar configuration 0) frame.
     */
    public byte[] encodeInterleaved(byte[] pixels, ImageGeometry geometry)
    {
        return encode(toPlaneSeparated(pixels, geometry), geometry);
    }

    /**
     * Converts a planar configuration 1 frame, as returned by {@link #decode},
     * to planar configuration 0.
     */
    public static byte[] toPixelInterleaved(byte[] planar, ImageGeometry geometry)
    {
        return rearrange(planar, geometry, true);
    }

    /**
     * Converts a planar configuration 0 frame to planar configuration 1.
     */
    public static byte[] toPlaneSeparated(byte[] interleaved, ImageGeometry geometry)
    {
        return rearrange(interleaved, geometry, false);
    }

    private static byte[] rearrange(byte[] in, ImageGeometry geometry, boolean toInterleaved)
    {
        Objects.requireNonNull(in, "in");
        Objects.requireNonNull(geometry, "geometry");
        if (in.length != geometry.frameLength()) {
            throw new IllegalArgumentException(String.format(
                    "Expected %d bytes of pixel data for %s but got %d", geometry.frameLength(), geometry, in.length));
        }

        final int samples = geometry.samplesPerPixel();
        if (samples == 1) {
            return in.clone();
        }

        final int bytesPerSample = geometry.bytesPerSample();
        final int pixels = geometry.pixelCount();
        final int stride = pixels * bytesPerSample;
        final byte[] out = new byte[in.length];
        for (int sample = 0; sample < samples; sample++) {
            for (int i = 0; i < pixels; i++) {
                int planar = sample * stride + i * bytesPerSample;
                int interleaved = (i * samples + sample) * bytesPerSample;
                if (toInterleaved) {
                    System.arraycopy(in, planar, out, interleaved, bytesPerSample);
                }
                else {
                    System.arraycopy(in, interleaved, out, planar, bytesPerSample);
                }
            }
        }
        return out;
    }

    private static void checkEncodable(byte[] pixels, ImageGeometry geometry)
    {
        Objects.requireNonNull(geometry, "geometry");
        if (geometry.bitsAllocated() % 8 != 0) {
            throw new UnsupportedRleEncodingException(
                    "Unable to encode RLE pixel data with " + geometry.bitsAllocated() + " bits allocated");
        }
        if (geometry.segmentCount() > RleHeader.MAX_SEGMENTS) {
            throw new IllegalArgumentException("Unable to encode as the DICOM standard only allows a maximum of "
                    + RleHeader.MAX_SEGMENTS + " segments in RLE encoded data (needs " + geometry.segmentCount() + ")");
        }
        if (pixels.length != geometry.frameLength()) {
            throw new IllegalArgumentException(String.format(
                    "Expected %d bytes of pixel data for %s but got %d", geometry.frameLength(), geometry, pixels.length));
        }
    }
}
