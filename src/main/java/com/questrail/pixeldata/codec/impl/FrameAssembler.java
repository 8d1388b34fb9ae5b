package com.questrail.pixeldata.codec.impl;

import com.questrail.pixeldata.FrameBoundaryException;
import com.questrail.pixeldata.io.ByteSource;
import com.questrail.pixeldata.model.ExtendedOffsetTable;
import com.questrail.pixeldata.model.FragmentIndex;
import com.questrail.pixeldata.model.FrameBoundaryStrategy;
import com.questrail.pixeldata.observability.PixelDataObservabilitySink;
import com.questrail.pixeldata.observability.PixelDataWarning;
import com.questrail.pixeldata.observability.PixelDataWarningEvent;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * FrameAssembler
 * -----------------------------------------------------------------------------
 * Groups the fragments of an encapsulated container into frames.
 *
 * <p>Boundary information is taken from, in order of preference:</p>
 * <ol>
 *   <li>an Extended Offset Table supplied by the caller</li>
 *   <li>a non-empty Basic Offset Table</li>
 *   <li>a single expected frame (every fragment belongs to it)</li>
 *   <li>the configured {@link FrameBoundaryStrategy}</li>
 * </ol>
 *
 * <p>Every returned iterator reads the source lazily, one frame per call to
 * {@code next()}.</p>
 */
final class FrameAssembler
{
    private static final int END_OF_IMAGE_SEARCH_WINDOW = 10;

    private final FrameBoundaryStrategy strategy;
    private final PixelDataObservabilitySink sink;

    FrameAssembler(FrameBoundaryStrategy strategy, PixelDataObservabilitySink sink)
    {
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Returns the frames of the container at the current position of
     * {@code source}, which must be the Basic Offset Table item.
     *
     * @param offsetTable Extended Offset Table, or {@code null} if there is none
     * @throws FrameBoundaryException if the frames cannot be delimited
     */
    Iterator<byte[]> frames(ByteSource source, int numberOfFrames, ExtendedOffsetTable offsetTable)
    {
        Objects.requireNonNull(source, "source");
        if (numberOfFrames < 1) {
            throw new IllegalArgumentException("numberOfFrames must be positive (was " + numberOfFrames + ")");
        }

        final List<Long> basicOffsets = BasicOffsetTable.parse(source, sink);
        final long fragmentsStart = source.tell();

        if (offsetTable != null && offsetTable.frameCount() > 0) {
            checkFrameCount("Extended", offsetTable.frameCount(), numberOfFrames);
            return new ExtendedOffsetFrames(source, fragmentsStart, offsetTable, 0);
        }

        if (!basicOffsets.isEmpty()) {
            checkFrameCount("Basic", basicOffsets.size(), numberOfFrames);
            return new BasicOffsetFrames(new FragmentIterator(source, sink), basicOffsets, 0);
        }

        if (numberOfFrames == 1) {
            return new SingleFrame(new FragmentIterator(source, sink));
        }

        return switch (strategy) {
            case STRICT -> throw new FrameBoundaryException(
                    "Unable to determine the frame boundaries for the encapsulated pixel data as there is "
                            + "no Basic or Extended Offset Table and " + numberOfFrames + " frames are expected");
            case EQUAL_FRAGMENTS -> equalFragments(source, numberOfFrames);
            case END_OF_IMAGE_MARKER -> new EndOfImageFrames(new FragmentIterator(source, sink), numberOfFrames);
        };
    }

    /**
     * Returns the single frame at {@code index}, restoring the source position
     * afterwards. Offset tables are used to jump straight to the frame.
     *
     * @throws FrameBoundaryException if there is no frame at {@code index}
     */
    byte[] frame(ByteSource source, int index, int numberOfFrames, ExtendedOffsetTable offsetTable)
    {
        Objects.requireNonNull(source, "source");
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative (was " + index + ")");
        }

        final long start = source.tell();
        try {
            final List<Long> basicOffsets = BasicOffsetTable.parse(source, sink);
            final long fragmentsStart = source.tell();

            if (offsetTable != null && offsetTable.frameCount() > 0) {
                if (index >= offsetTable.frameCount()) {
                    throw new FrameBoundaryException("There aren't enough offsets in the Extended Offset Table for "
                            + (index + 1) + " frames");
                }
                return new ExtendedOffsetFrames(source, fragmentsStart, offsetTable, index).next();
            }

            if (!basicOffsets.isEmpty()) {
                if (index >= basicOffsets.size()) {
                    throw new FrameBoundaryException("There aren't enough offsets in the Basic Offset Table for "
                            + (index + 1) + " frames");
                }
                final long frameStart = fragmentsStart + basicOffsets.get(index);
                if (frameStart > source.size()) {
                    throw new FrameBoundaryException(String.format(
                            "Frame %d starts at offset %d, past the end of the encapsulated data", index, frameStart));
                }
                source.seek(frameStart);
                return new BasicOffsetFrames(new FragmentIterator(source, sink), basicOffsets, index).next();
            }

            source.seek(start);
            final Iterator<byte[]> frames = frames(source, numberOfFrames, null);
            for (int i = 0; i < index && frames.hasNext(); i++) {
                frames.next();
            }
            if (!frames.hasNext()) {
                throw new FrameBoundaryException("There is insufficient pixel data to contain " + (index + 1) + " frames");
            }
            return frames.next();
        }
        finally {
            source.seek(start);
        }
    }

    private Iterator<byte[]> equalFragments(ByteSource source, int numberOfFrames)
    {
        final FragmentIndex index = FragmentIterator.index(source, sink);
        if (index.count() == 0 || index.count() % numberOfFrames != 0) {
            throw new FrameBoundaryException(String.format(
                    "Unable to divide %d fragments evenly between %d frames", index.count(), numberOfFrames));
        }
        return new FixedCountFrames(new FragmentIterator(source, sink), index.count() / numberOfFrames, numberOfFrames);
    }

    private void checkFrameCount(String table, int tableFrames, int numberOfFrames)
    {
        if (tableFrames != numberOfFrames) {
            sink.onWarning(PixelDataWarningEvent.of(PixelDataWarning.FRAME_COUNT_MISMATCH, String.format(
                    "The %s Offset Table lists %d frames but %d were expected, using the table",
                    table, tableFrames, numberOfFrames)));
        }
    }

    static byte[] concat(List<byte[]> parts)
    {
        if (parts.size() == 1) {
            return parts.get(0);
        }
        int length = 0;
        for (byte[] part : parts) {
            length = Math.addExact(length, part.length);
        }
        final byte[] out = new byte[length];
        int w = 0;
        for (byte[] part : parts) {
            System.arraycopy(part, 0, out, w, part.length);
            w += part.length;
        }
        return out;
    }

    static boolean hasEndOfImageMarker(byte[] fragment)
    {
        for (int i = Math.max(0, fragment.length - END_OF_IMAGE_SEARCH_WINDOW); i < fragment.length - 1; i++) {
            if ((fragment[i] & 0xFF) == 0xFF && (fragment[i + 1] & 0xFF) == 0xD9) {
                return true;
            }
        }
        return false;
    }

    /**
     * Frames delimited by Basic Offset Table entries.
     *
     * <p>{@code position} is the running offset from the first fragment,
     * including each fragment's 8-byte header. It must land exactly on every
     * table entry.</p>
     */
    private static final class BasicOffsetFrames implements Iterator<byte[]>
    {
        private final FragmentIterator fragments;
        private final List<Long> offsets;

        private int frameIndex;
        private long position;

        BasicOffsetFrames(FragmentIterator fragments, List<Long> offsets, int firstFrame)
        {
            this.fragments = fragments;
            this.offsets = offsets;
            this.frameIndex = firstFrame;
            this.position = offsets.get(firstFrame);
        }

        @Override
        public boolean hasNext()
        {
            return frameIndex < offsets.size();
        }

        @Override
        public byte[] next()
        {
            if (!hasNext()) {
                throw new NoSuchElementException("No more frames");
            }

            final boolean last = frameIndex == offsets.size() - 1;
            final long end = last ? Long.MAX_VALUE : offsets.get(frameIndex + 1);
            final List<byte[]> parts = new ArrayList<>();

            while (position < end) {
                if (!fragments.hasNext()) {
                    if (last && !parts.isEmpty()) {
                        break;
                    }
                    throw new FrameBoundaryException(String.format(
                            "The encapsulated data ended at offset %d before frame %d was complete",
                            position, frameIndex));
                }
                final byte[] fragment = fragments.next();
                parts.add(fragment);
                position += ItemCodec.HEADER_LENGTH + fragment.length;
            }

            if (position > end) {
                throw new FrameBoundaryException(String.format(
                        "A fragment of frame %d straddles the frame boundary at offset %d (fragments end at offset %d)",
                        frameIndex, end, position));
            }

            frameIndex++;
            return concat(parts);
        }
    }

    /**
     * Frames read directly at Extended Offset Table positions.
     */
    private static final class ExtendedOffsetFrames implements Iterator<byte[]>
    {
        private final ByteSource source;
        private final long fragmentsStart;
        private final ExtendedOffsetTable table;

        private int frameIndex;

        ExtendedOffsetFrames(ByteSource source, long fragmentsStart, ExtendedOffsetTable table, int firstFrame)
        {
            this.source = source;
            this.fragmentsStart = fragmentsStart;
            this.table = table;
            this.frameIndex = firstFrame;
        }

        @Override
        public boolean hasNext()
        {
            return frameIndex < table.frameCount();
        }

        @Override
        public byte[] next()
        {
            if (!hasNext()) {
                throw new NoSuchElementException("No more frames");
            }

            final long length = table.lengths().get(frameIndex);
            final long valueStart = fragmentsStart + table.offsets().get(frameIndex) + ItemCodec.HEADER_LENGTH;
            if (length > Integer.MAX_VALUE || valueStart + length > source.size()) {
                throw new FrameBoundaryException(String.format(
                        "Frame %d (%d bytes at offset %d) lies outside the encapsulated data",
                        frameIndex, length, valueStart));
            }

            source.seek(valueStart);
            frameIndex++;
            return source.read((int) length);
        }
    }

    /**
     * Every fragment concatenated into one frame.
     */
    private static final class SingleFrame implements Iterator<byte[]>
    {
        private final FragmentIterator fragments;
        private boolean consumed;

        SingleFrame(FragmentIterator fragments)
        {
            this.fragments = fragments;
        }

        @Override
        public boolean hasNext()
        {
            return !consumed;
        }

        @Override
        public byte[] next()
        {
            if (!hasNext()) {
                throw new NoSuchElementException("No more frames");
            }
            consumed = true;

            final List<byte[]> parts = new ArrayList<>();
            fragments.forEachRemaining(parts::add);
            if (parts.isEmpty()) {
                throw new FrameBoundaryException("The encapsulated pixel data contains no fragments");
            }
            return concat(parts);
        }
    }

    /**
     * The same number of fragments for every frame.
     */
    private static final class FixedCountFrames implements Iterator<byte[]>
    {
        private final FragmentIterator fragments;
        private final int fragmentsPerFrame;
        private final int numberOfFrames;

        private int frameIndex;

        FixedCountFrames(FragmentIterator fragments, int fragmentsPerFrame, int numberOfFrames)
        {
            this.fragments = fragments;
            this.fragmentsPerFrame = fragmentsPerFrame;
            this.numberOfFrames = numberOfFrames;
        }

        @Override
        public boolean hasNext()
        {
            return frameIndex < numberOfFrames;
        }

        @Override
        public byte[] next()
        {
            if (!hasNext()) {
                throw new NoSuchElementException("No more frames");
            }

            final List<byte[]> parts = new ArrayList<>(fragmentsPerFrame);
            for (int i = 0; i < fragmentsPerFrame; i++) {
                if (!fragments.hasNext()) {
                    throw new FrameBoundaryException("The encapsulated data ended during frame " + frameIndex);
                }
                parts.add(fragments.next());
            }
            frameIndex++;
            return concat(parts);
        }
    }

    /**
     * Frames ending at a fragment that carries a JPEG EOI / JPEG 2000 EOC marker.
     *
     * <p>More frames than expected may be produced if there are excess
     * fragments with markers.</p>
     */
    private final class EndOfImageFrames implements Iterator<byte[]>
    {
        private final FragmentIterator fragments;
        private final int numberOfFrames;

        private int produced;

        EndOfImageFrames(FragmentIterator fragments, int numberOfFrames)
        {
            this.fragments = fragments;
            this.numberOfFrames = numberOfFrames;
        }

        @Override
        public boolean hasNext()
        {
            return fragments.hasNext();
        }

        @Override
        public byte[] next()
        {
            if (!hasNext()) {
                throw new NoSuchElementException("No more frames");
            }

            final List<byte[]> parts = new ArrayList<>();
            boolean marked = false;
            while (fragments.hasNext()) {
                final byte[] fragment = fragments.next();
                parts.add(fragment);
                if (hasEndOfImageMarker(fragment)) {
                    marked = true;
                    break;
                }
            }

            if (!marked) {
                if (produced >= numberOfFrames) {
                    warn(PixelDataWarning.MISSING_END_OF_IMAGE_MARKER,
                            "The end of the encapsulated pixel data has been reached but no JPEG EOI/EOC marker "
                                    + "was found, the final frame may be invalid");
                }
                else {
                    warn(PixelDataWarning.FEWER_FRAMES_THAN_EXPECTED,
                            "The end of the encapsulated pixel data has been reached but fewer frames than "
                                    + "expected have been found, please confirm that the frame data is correct");
                }
            }

            produced++;
            if (marked && produced < numberOfFrames && !fragments.hasNext()) {
                warn(PixelDataWarning.FEWER_FRAMES_THAN_EXPECTED, String.format(
                        "The end of the encapsulated pixel data has been reached after %d of %d frames",
                        produced, numberOfFrames));
            }
            return concat(parts);
        }

        private void warn(PixelDataWarning kind, String message)
        {
            sink.onWarning(PixelDataWarningEvent.of(kind, message));
        }
    }
}
