package com.questrail.pixeldata.model;

/**
 * Order of the byte-plane segments of a multi-byte sample in RLE data.
 */
public enum SegmentOrder
{
    /** Most significant byte's segment first. This is the conformant order. */
    BIG_ENDIAN,

    /**
     * Least significant byte's segment first.
     *
     * <p>Not conformant, but written by some encoders and seen in real files.</p>
     */
    LITTLE_ENDIAN
}
