package com.questrail.pixeldata.observability;

/**
 * Kinds of tolerated non-conformance reported while decoding.
 */
public enum PixelDataWarning
{
    /** A Sequence Delimiter item carried a non-zero length field. */
    NON_ZERO_DELIMITER_LENGTH,

    /** The Basic Offset Table lists a different number of frames than the caller expected. */
    FRAME_COUNT_MISMATCH,

    /** A decoded RLE segment was longer than {@code rows * columns} and was truncated. */
    RLE_SEGMENT_PADDING,

    /** The final frame found by the end-of-image heuristic has no EOI/EOC marker. */
    MISSING_END_OF_IMAGE_MARKER,

    /** The end-of-image heuristic ran out of fragments before reaching the expected frame count. */
    FEWER_FRAMES_THAN_EXPECTED
}
