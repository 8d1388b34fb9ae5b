package com.questrail.pixeldata.codec.impl;

import com.questrail.pixeldata.FrameBoundaryException;
import com.questrail.pixeldata.MalformedContainerException;
import com.questrail.pixeldata.config.DecodeConfig;
import com.questrail.pixeldata.io.ByteBufSource;
import com.questrail.pixeldata.io.ByteSource;
import com.questrail.pixeldata.model.ExtendedEncapsulation;
import com.questrail.pixeldata.model.FrameBoundaryStrategy;
import com.questrail.pixeldata.observability.PixelDataWarning;
import com.questrail.pixeldata.observability.RecordingObservabilitySink;
import org.junit.jupiter.api.Test;

import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static com.questrail.pixeldata.codec.impl.ContainerFixture.bytes;
import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultEncapsulatedFrameDecoderTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link DefaultEncapsulatedFrameDecoder}.
 *
 * <p>Containers are built with {@link ContainerFixture} so the decoder is
 * exercised independently of the encoder.</p>
 */
final class DefaultEncapsulatedFrameDecoderTest
{
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();

    private final DefaultEncapsulatedFrameDecoder decoder =
            new DefaultEncapsulatedFrameDecoder(DecodeConfig.builder().withObservability(sink).build());

    // -------------------------------------------------------------------------
    // Basic Offset Table
    // -------------------------------------------------------------------------

    @Test
    void threeFramesDelimitedByBasicOffsetTable()
    {
        byte[] data = ContainerFixture.littleEndian()
                .basicOffsetTable(0, 12, 24)
                .item(bytes(0x01, 0, 0, 0))
                .item(bytes(0x02, 0, 0, 0))
                .item(bytes(0x03, 0, 0, 0))
                .sequenceDelimiter()
                .build();

        List<byte[]> frames = collect(decoder.frames(data, 3));

        assertEquals(3, frames.size());
        assertArrayEquals(bytes(0x01, 0, 0, 0), frames.get(0));
        assertArrayEquals(bytes(0x02, 0, 0, 0), frames.get(1));
        assertArrayEquals(bytes(0x03, 0, 0, 0), frames.get(2));
        assertTrue(sink.getWarnings().isEmpty());
    }

    @Test
    void multiFragmentFramesDelimitedByBasicOffsetTable()
    {
        byte[] data = ContainerFixture.littleEndian()
                .basicOffsetTable(0, 20)
                .item(bytes(1, 2))
                .item(bytes(3, 4))
                .item(bytes(5, 6))
                .item(bytes(7, 8))
                .item(bytes(9, 10))
                .build();

        List<byte[]> frames = collect(decoder.frames(data, 2));

        assertArrayEquals(bytes(1, 2, 3, 4), frames.get(0));
        assertArrayEquals(bytes(5, 6, 7, 8, 9, 10), frames.get(1));
    }

    @Test
    void fragmentStraddlingBoundaryIsRejected()
    {
        byte[] data = ContainerFixture.littleEndian()
                .basicOffsetTable(0, 8)
                .item(bytes(1, 2, 3, 4))
                .item(bytes(5, 6, 7, 8))
                .build();

        Iterator<byte[]> frames = decoder.frames(data, 2);

        assertThrows(FrameBoundaryException.class, frames::next);
    }

    @Test
    void dataEndingBeforeLastFrameIsRejected()
    {
        byte[] data = ContainerFixture.littleEndian()
                .basicOffsetTable(0, 12, 24)
                .item(bytes(1, 2, 3, 4))
                .item(bytes(5, 6, 7, 8))
                .sequenceDelimiter()
                .build();

        Iterator<byte[]> frames = decoder.frames(data, 3);
        frames.next();
        frames.next();

        assertThrows(FrameBoundaryException.class, frames::next);
    }

    @Test
    void basicOffsetTableWinsFrameCountMismatch()
    {
        byte[] data = ContainerFixture.littleEndian()
                .basicOffsetTable(0, 12)
                .item(bytes(1, 2, 3, 4))
                .item(bytes(5, 6, 7, 8))
                .build();

        List<byte[]> frames = collect(decoder.frames(data, 3));

        assertEquals(2, frames.size());
        assertTrue(sink.hasWarning(PixelDataWarning.FRAME_COUNT_MISMATCH));
    }

    // -------------------------------------------------------------------------
    // Empty Basic Offset Table
    // -------------------------------------------------------------------------

    @Test
    void singleFrameConcatenatesAllFragments()
    {
        byte[] data = ContainerFixture.littleEndian()
                .basicOffsetTable()
                .item(bytes(1, 2, 3, 4))
                .item(bytes(5, 6, 7, 8))
                .item(bytes(9, 10, 11, 12))
                .sequenceDelimiter()
                .build();

        List<byte[]> frames = collect(decoder.frames(data, 1));

        assertEquals(1, frames.size());
        assertArrayEquals(bytes(1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12), frames.get(0));
    }

    @Test
    void singleFrameWithoutFragmentsIsRejected()
    {
        byte[] data = ContainerFixture.littleEndian().basicOffsetTable().sequenceDelimiter().build();

        Iterator<byte[]> frames = decoder.frames(data, 1);

        assertThrows(FrameBoundaryException.class, frames::next);
    }

    @Test
    void strictStrategyRejectsMultipleFramesWithoutOffsets()
    {
        byte[] data = ContainerFixture.littleEndian()
                .basicOffsetTable()
                .item(bytes(1, 2))
                .item(bytes(3, 4))
                .build();

        assertThrows(FrameBoundaryException.class, () -> decoder.frames(data, 2));
    }

    @Test
    void equalFragmentsStrategyDividesFragmentsEvenly()
    {
        DefaultEncapsulatedFrameDecoder equal = decoderWith(FrameBoundaryStrategy.EQUAL_FRAGMENTS);
        byte[] data = ContainerFixture.littleEndian()
                .basicOffsetTable()
                .item(bytes(1, 2))
                .item(bytes(3, 4))
                .item(bytes(5, 6))
                .item(bytes(7, 8))
                .sequenceDelimiter()
                .build();

        List<byte[]> frames = collect(equal.frames(data, 2));

        assertEquals(2, frames.size());
        assertArrayEquals(bytes(1, 2, 3, 4), frames.get(0));
        assertArrayEquals(bytes(5, 6, 7, 8), frames.get(1));
    }

    @Test
    void equalFragmentsStrategyRejectsUnevenCount()
    {
        DefaultEncapsulatedFrameDecoder equal = decoderWith(FrameBoundaryStrategy.EQUAL_FRAGMENTS);
        byte[] data = ContainerFixture.littleEndian()
                .basicOffsetTable()
                .item(bytes(1, 2))
                .item(bytes(3, 4))
                .item(bytes(5, 6))
                .build();

        assertThrows(FrameBoundaryException.class, () -> equal.frames(data, 2));
    }

    @Test
    void endOfImageStrategySplitsAtMarkers()
    {
        DefaultEncapsulatedFrameDecoder marker = decoderWith(FrameBoundaryStrategy.END_OF_IMAGE_MARKER);
        byte[] data = ContainerFixture.littleEndian()
                .basicOffsetTable()
                .item(bytes(0xFF, 0xD8, 0x01, 0x02))
                .item(bytes(0x03, 0x04, 0xFF, 0xD9))
                .item(bytes(0xFF, 0xD8, 0xFF, 0xD9))
                .sequenceDelimiter()
                .build();

        List<byte[]> frames = collect(marker.frames(data, 2));

        assertEquals(2, frames.size());
        assertArrayEquals(bytes(0xFF, 0xD8, 0x01, 0x02, 0x03, 0x04, 0xFF, 0xD9), frames.get(0));
        assertArrayEquals(bytes(0xFF, 0xD8, 0xFF, 0xD9), frames.get(1));
        assertTrue(sink.getWarnings().isEmpty());
    }

    @Test
    void endOfImageStrategyWarnsWhenFinalMarkerIsMissing()
    {
        DefaultEncapsulatedFrameDecoder marker = decoderWith(FrameBoundaryStrategy.END_OF_IMAGE_MARKER);
        byte[] data = ContainerFixture.littleEndian()
                .basicOffsetTable()
                .item(bytes(0xFF, 0xD8, 0xFF, 0xD9))
                .item(bytes(0xFF, 0xD8, 0x00, 0x00))
                .build();

        List<byte[]> frames = collect(marker.frames(data, 2));

        assertEquals(2, frames.size());
        assertTrue(sink.hasWarning(PixelDataWarning.FEWER_FRAMES_THAN_EXPECTED));
    }

    @Test
    void endOfImageStrategyWarnsAboutTrailingFragmentsWithoutMarker()
    {
        DefaultEncapsulatedFrameDecoder marker = decoderWith(FrameBoundaryStrategy.END_OF_IMAGE_MARKER);
        byte[] data = ContainerFixture.littleEndian()
                .basicOffsetTable()
                .item(bytes(0xFF, 0xD8, 0xFF, 0xD9))
                .item(bytes(0xFF, 0xD8, 0xFF, 0xD9))
                .item(bytes(0x00, 0x00))
                .build();

        List<byte[]> frames = collect(marker.frames(data, 2));

        assertEquals(3, frames.size());
        assertTrue(sink.hasWarning(PixelDataWarning.MISSING_END_OF_IMAGE_MARKER));
    }

    @Test
    void numberOfFramesMustBePositive()
    {
        byte[] data = ContainerFixture.littleEndian().basicOffsetTable().item(bytes(1, 2)).build();

        assertThrows(IllegalArgumentException.class, () -> decoder.frames(data, 0));
    }

    // -------------------------------------------------------------------------
    // Malformed containers
    // -------------------------------------------------------------------------

    @Test
    void undefinedLengthFragmentIsMalformedAtItsOffset()
    {
        byte[] data = ContainerFixture.littleEndian()
                .basicOffsetTable()
                .item(bytes(1, 2, 3, 4))
                .itemHeader(0xFFFFFFFFL)
                .build();

        Iterator<byte[]> frames = decoder.frames(data, 1);

        MalformedContainerException e = assertThrows(MalformedContainerException.class, frames::next);
        assertEquals(20, e.offset());
    }

    @Test
    void nonZeroDelimiterLengthStillEndsFragments()
    {
        byte[] data = ContainerFixture.littleEndian()
                .basicOffsetTable()
                .item(bytes(1, 2))
                .sequenceDelimiter(0x10)
                .build();

        List<byte[]> frames = collect(decoder.frames(data, 1));

        assertArrayEquals(bytes(1, 2), frames.get(0));
        assertTrue(sink.hasWarning(PixelDataWarning.NON_ZERO_DELIMITER_LENGTH));
    }

    @Test
    void bigEndianContainer()
    {
        DefaultEncapsulatedFrameDecoder bigEndian = new DefaultEncapsulatedFrameDecoder(
                DecodeConfig.builder().withContainerByteOrder(ByteOrder.BIG_ENDIAN).withObservability(sink).build());
        byte[] data = ContainerFixture.bigEndian()
                .basicOffsetTable(0, 10)
                .item(bytes(1, 2))
                .item(bytes(3, 4))
                .sequenceDelimiter()
                .build();

        List<byte[]> frames = collect(bigEndian.frames(data, 2));

        assertArrayEquals(bytes(1, 2), frames.get(0));
        assertArrayEquals(bytes(3, 4), frames.get(1));
    }

    // -------------------------------------------------------------------------
    // Random access
    // -------------------------------------------------------------------------

    @Test
    void frameByIndexUsesBasicOffsetTable()
    {
        byte[] data = ContainerFixture.littleEndian()
                .basicOffsetTable(0, 12, 24)
                .item(bytes(0x01, 0, 0, 0))
                .item(bytes(0x02, 0, 0, 0))
                .item(bytes(0x03, 0, 0, 0))
                .build();

        assertArrayEquals(bytes(0x03, 0, 0, 0), decoder.frame(data, 2, 3));
        assertArrayEquals(bytes(0x01, 0, 0, 0), decoder.frame(data, 0, 3));
        assertThrows(FrameBoundaryException.class, () -> decoder.frame(data, 3, 3));
    }

    @Test
    void frameByIndexRestoresSourcePosition()
    {
        ByteSource source = ByteBufSource.wrap(ContainerFixture.littleEndian()
                .basicOffsetTable(0, 12)
                .item(bytes(1, 2, 3, 4))
                .item(bytes(5, 6, 7, 8))
                .build());

        assertArrayEquals(bytes(5, 6, 7, 8), decoder.frame(source, 1, 2));
        assertEquals(0, source.tell());
    }

    @Test
    void frameByIndexWithoutOffsetsUsesStrategy()
    {
        DefaultEncapsulatedFrameDecoder equal = decoderWith(FrameBoundaryStrategy.EQUAL_FRAGMENTS);
        byte[] data = ContainerFixture.littleEndian()
                .basicOffsetTable()
                .item(bytes(1, 2))
                .item(bytes(3, 4))
                .item(bytes(5, 6))
                .build();

        assertArrayEquals(bytes(3, 4), equal.frame(data, 1, 3));
        assertThrows(FrameBoundaryException.class, () -> equal.frame(data, 3, 3));
        assertThrows(IllegalArgumentException.class, () -> equal.frame(data, -1, 3));
    }

    // -------------------------------------------------------------------------
    // Extended Offset Table
    // -------------------------------------------------------------------------

    @Test
    void extendedOffsetTableTakesPrecedence()
    {
        ExtendedEncapsulation encapsulated = new DefaultEncapsulatedFrameEncoder()
                .encapsulateExtended(List.of(bytes(1, 2, 3), bytes(4, 5, 6, 7), bytes(8, 9)));

        Iterator<byte[]> frames = decoder.frames(ByteBufSource.wrap(encapsulated.pixelData()), 3,
                encapsulated.offsetTable());

        assertArrayEquals(bytes(1, 2, 3, 0), frames.next());
        assertArrayEquals(bytes(4, 5, 6, 7), frames.next());
        assertArrayEquals(bytes(8, 9), frames.next());
        assertFalse(frames.hasNext());
        assertThrows(NoSuchElementException.class, frames::next);

        assertArrayEquals(bytes(4, 5, 6, 7), decoder.frame(ByteBufSource.wrap(encapsulated.pixelData()), 1, 3,
                encapsulated.offsetTable()));
    }

    // -------------------------------------------------------------------------
    // Lower-level access
    // -------------------------------------------------------------------------

    @Test
    void basicOffsetsThenFragments()
    {
        ByteSource source = ByteBufSource.wrap(ContainerFixture.littleEndian()
                .basicOffsetTable(0, 10)
                .item(bytes(1, 2))
                .item(bytes(3, 4))
                .sequenceDelimiter()
                .build());

        assertEquals(List.of(0L, 10L), decoder.basicOffsets(source));
        assertEquals(2, decoder.fragmentIndex(source).count());
        assertEquals(2, collect(decoder.fragments(source)).size());
    }

    private DefaultEncapsulatedFrameDecoder decoderWith(FrameBoundaryStrategy strategy)
    {
        return new DefaultEncapsulatedFrameDecoder(DecodeConfig.builder()
                .withFrameBoundaryStrategy(strategy)
                .withObservability(sink)
                .build());
    }

    private static List<byte[]> collect(Iterator<byte[]> iterator)
    {
        List<byte[]> out = new ArrayList<>();
        iterator.forEachRemaining(out::add);
        return out;
    }
}
