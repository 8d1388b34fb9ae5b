package com.questrail.pixeldata.codec.impl;

import com.questrail.pixeldata.FragmentationLimitExceededException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * FrameFragmenter
 * -----------------------------------------------------------------------------
 * Splits one frame into fragments and wraps them as items.
 *
 * <p>Every fragment has an even length:</p>
 * <ul>
 *   <li>the per-fragment budget is {@code ceil(length / nrFragments)}, rounded up to even</li>
 *   <li>a fragment is shrunk below the budget when the bytes left would not
 *       give each later fragment at least 2 bytes</li>
 *   <li>the last fragment takes the remainder and gets one {@code 0x00} pad byte
 *       if the remainder is odd</li>
 * </ul>
 *
 * <p>Only the fragment holding the last byte of the frame can be odd before
 * padding, so the concatenated fragments are the frame plus at most one pad
 * byte.</p>
 */
final class FrameFragmenter
{
    private FrameFragmenter() {}

    /**
     * Splits {@code frame} into {@code nrFragments} even-length fragments.
     *
     * <p>Every fragment holds at least 2 bytes whenever the frame is long
     * enough. A fragment is empty only when {@code nrFragments} is exactly
     * {@code 1 + frame.length / 2} and the frame length is even, or the
     * frame itself is empty.</p>
     *
     * @throws FragmentationLimitExceededException if {@code nrFragments} exceeds
     *         {@code 1 + frame.length / 2}
     */
    static List<byte[]> fragment(byte[] frame, int nrFragments)
    {
        Objects.requireNonNull(frame, "frame");
        if (nrFragments < 1) {
            throw new IllegalArgumentException("nrFragments must be positive (was " + nrFragments + ")");
        }

        final int length = frame.length;
        if (nrFragments > 1 + length / 2) {
            throw new FragmentationLimitExceededException("Too many fragments requested (" + nrFragments
                    + " for " + length + " bytes, the minimum fragment size is 2 bytes)");
        }

        int budget = (length + nrFragments - 1) / nrFragments;
        if (budget % 2 != 0) {
            budget++;
        }

        final List<byte[]> fragments = new ArrayList<>(nrFragments);
        int from = 0;
        for (int i = 0; i < nrFragments; i++) {
            final int remaining = length - from;
            final int size;
            if (i == nrFragments - 1) {
                size = remaining;
            }
            else {
                // later fragments need 2 bytes each, the last only 1 before padding
                final int later = nrFragments - i - 1;
                final int spare = Math.max(0, remaining - (2 * later - 1)) & ~1;
                size = Math.max(Math.min(budget, spare), Math.min(2, remaining));
            }
            fragments.add(padded(frame, from, from + size));
            from += size;
        }
        return fragments;
    }

    // copyOfRange fills past the end of the frame with 0x00
    private static byte[] padded(byte[] frame, int from, int to)
    {
        final int size = to - from;
        return Arrays.copyOfRange(frame, from, from + size + (size % 2));
    }

    /**
     * Splits {@code frame} into {@code nrFragments} fragments and returns each
     * one as a complete item.
     */
    static List<byte[]> itemise(byte[] frame, int nrFragments)
    {
        final List<byte[]> items = new ArrayList<>(nrFragments);
        for (byte[] fragment : fragment(frame, nrFragments)) {
            items.add(ItemCodec.writeItem(fragment));
        }
        return items;
    }
}
