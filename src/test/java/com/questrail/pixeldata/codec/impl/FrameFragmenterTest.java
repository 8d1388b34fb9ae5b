package com.questrail.pixeldata.codec.impl;

import com.questrail.pixeldata.FragmentationLimitExceededException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.questrail.pixeldata.codec.impl.ContainerFixture.bytes;
import static org.junit.jupiter.api.Assertions.*;

/**
 * FrameFragmenterTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link FrameFragmenter}.
 *
 * <p>Every fragment must have an even length of at least 2 bytes where the
 * frame allows it; the last one absorbs the remainder and a single pad byte
 * where needed.</p>
 */
final class FrameFragmenterTest
{
    @Test
    void oddFrameIsPaddedToEvenLength()
    {
        List<byte[]> fragments = FrameFragmenter.fragment(bytes(0xFE, 0xFF, 0x00), 1);

        assertEquals(1, fragments.size());
        assertArrayEquals(bytes(0xFE, 0xFF, 0x00, 0x00), fragments.get(0));
    }

    @Test
    void evenFrameIsNotPadded()
    {
        List<byte[]> fragments = FrameFragmenter.fragment(bytes(1, 2, 3, 4), 1);

        assertArrayEquals(bytes(1, 2, 3, 4), fragments.get(0));
    }

    @Test
    void budgetIsRoundedUpToEven()
    {
        // ceil(10 / 2) = 5, rounded to 6
        List<byte[]> fragments = FrameFragmenter.fragment(bytes(1, 2, 3, 4, 5, 6, 7, 8, 9, 10), 2);

        assertEquals(2, fragments.size());
        assertArrayEquals(bytes(1, 2, 3, 4, 5, 6), fragments.get(0));
        assertArrayEquals(bytes(7, 8, 9, 10), fragments.get(1));
    }

    @Test
    void oddRemainderGetsOnePadByte()
    {
        List<byte[]> fragments = FrameFragmenter.fragment(bytes(1, 2, 3, 4, 5, 6, 7, 8, 9), 2);

        assertArrayEquals(bytes(1, 2, 3, 4, 5, 6), fragments.get(0));
        assertArrayEquals(bytes(7, 8, 9, 0), fragments.get(1));
    }

    @Test
    void everyFragmentHasEvenLength()
    {
        byte[] frame = new byte[1001];
        for (int n = 1; n <= 47; n++) {
            List<byte[]> fragments = FrameFragmenter.fragment(frame, n);
            assertEquals(n, fragments.size());
            int total = 0;
            for (byte[] fragment : fragments) {
                assertEquals(0, fragment.length % 2, "fragment length with n=" + n);
                assertTrue(fragment.length >= 2, "fragment length with n=" + n);
                total += fragment.length;
            }
            assertEquals(1002, total);
        }
    }

    @Test
    void emptyFrameAsSingleFragment()
    {
        List<byte[]> fragments = FrameFragmenter.fragment(new byte[0], 1);

        assertEquals(1, fragments.size());
        assertEquals(0, fragments.get(0).length);
    }

    // -------------------------------------------------------------------------
    // Limits
    // -------------------------------------------------------------------------

    @Test
    void tooManyFragmentsForFrameLength()
    {
        assertThrows(FragmentationLimitExceededException.class,
                () -> FrameFragmenter.fragment(bytes(1, 2, 3, 4), 4));
    }

    @Test
    void trailingFragmentsAreShrunkRatherThanLeftEmpty()
    {
        // budget ceil(10 / 4) = 3, rounded to 4, would leave 4 4 2 0
        List<byte[]> fragments = FrameFragmenter.fragment(bytes(1, 2, 3, 4, 5, 6, 7, 8, 9, 10), 4);

        assertEquals(4, fragments.size());
        assertArrayEquals(bytes(1, 2, 3, 4), fragments.get(0));
        assertArrayEquals(bytes(5, 6), fragments.get(1));
        assertArrayEquals(bytes(7, 8), fragments.get(2));
        assertArrayEquals(bytes(9, 10), fragments.get(3));
    }

    @Test
    void budgetCoveringTheFrameEarlyIsRebalanced()
    {
        List<byte[]> fragments = FrameFragmenter.fragment(bytes(1, 2, 3, 4, 5, 6, 7, 8), 3);

        assertEquals(3, fragments.size());
        assertArrayEquals(bytes(1, 2, 3, 4), fragments.get(0));
        assertArrayEquals(bytes(5, 6), fragments.get(1));
        assertArrayEquals(bytes(7, 8), fragments.get(2));
    }

    @Test
    void padByteGoesToTheLastFragment()
    {
        List<byte[]> fragments = FrameFragmenter.fragment(bytes(1, 2, 3, 4, 5, 6, 7, 8, 9), 4);

        assertEquals(4, fragments.size());
        assertArrayEquals(bytes(1, 2, 3, 4), fragments.get(0));
        assertArrayEquals(bytes(5, 6), fragments.get(1));
        assertArrayEquals(bytes(7, 8), fragments.get(2));
        assertArrayEquals(bytes(9, 0), fragments.get(3));
    }

    @Test
    void everyFragmentHasTwoBytesWheneverTheFrameAllowsIt()
    {
        for (int length = 1; length <= 64; length++) {
            int limit = 1 + length / 2;
            for (int n = 1; n <= limit; n++) {
                List<byte[]> fragments = FrameFragmenter.fragment(new byte[length], n);
                int total = 0;
                int empty = 0;
                for (byte[] fragment : fragments) {
                    assertEquals(0, fragment.length % 2);
                    total += fragment.length;
                    if (fragment.length == 0) {
                        empty++;
                    }
                }
                assertEquals(length + length % 2, total, "length=" + length + " n=" + n);
                // an even length at the limit is one byte short of 2 bytes per fragment
                int expectedEmpty = (n == limit && length % 2 == 0) ? 1 : 0;
                assertEquals(expectedEmpty, empty, "length=" + length + " n=" + n);
            }
        }
    }

    @Test
    void onlyTheLastFragmentIsEmptyAtTheLimit()
    {
        List<byte[]> fragments = FrameFragmenter.fragment(bytes(1, 2, 3, 4), 3);

        assertArrayEquals(bytes(1, 2), fragments.get(0));
        assertArrayEquals(bytes(3, 4), fragments.get(1));
        assertEquals(0, fragments.get(2).length);
    }

    @Test
    void nonPositiveFragmentCountIsRejected()
    {
        assertThrows(IllegalArgumentException.class, () -> FrameFragmenter.fragment(new byte[4], 0));
    }

    // -------------------------------------------------------------------------
    // Itemising
    // -------------------------------------------------------------------------

    @Test
    void itemiseWrapsEachFragment()
    {
        List<byte[]> items = FrameFragmenter.itemise(bytes(0xFE, 0xFF, 0x00), 1);

        assertEquals(1, items.size());
        assertArrayEquals(bytes(0xFE, 0xFF, 0x00, 0xE0, 0x04, 0x00, 0x00, 0x00, 0xFE, 0xFF, 0x00, 0x00),
                items.get(0));
    }
}
