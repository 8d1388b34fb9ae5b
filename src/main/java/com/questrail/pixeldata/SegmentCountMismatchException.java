package com.questrail.pixeldata;

/**
 * Raised when the segment count in an RLE header disagrees with
 * {@code samplesPerPixel * bitsAllocated / 8}.
 */
public final class SegmentCountMismatchException extends PixelDataException
{
    private final int expected;
    private final int actual;

    public SegmentCountMismatchException(int expected, int actual) {
        super("The number of RLE segments in the pixel data doesn't match the expected amount ("
                + actual + " vs. " + expected + " segments)");
        this.expected = expected;
        this.actual = actual;
    }

    public int expected() {
        return expected;
    }

    public int actual() {
        return actual;
    }
}
