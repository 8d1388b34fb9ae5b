package com.questrail.pixeldata;

/**
 * Raised when a decoded RLE segment holds fewer than {@code rows * columns}
 * bytes.
 *
 * <p>Longer segments are not an error: they are truncated and reported as a
 * warning through the observability sink.</p>
 */
public final class SegmentLengthMismatchException extends PixelDataException
{
    private final int segmentIndex;
    private final int expected;
    private final int actual;

    public SegmentLengthMismatchException(int segmentIndex, int expected, int actual) {
        super("The amount of decoded RLE segment data doesn't match the expected amount for segment "
                + segmentIndex + " (" + actual + " vs. " + expected + " bytes)");
        this.segmentIndex = segmentIndex;
        this.expected = expected;
        this.actual = actual;
    }

    public int segmentIndex() {
        return segmentIndex;
    }

    public int expected() {
        return expected;
    }

    public int actual() {
        return actual;
    }
}
