package com.questrail.pixeldata.model;

/**
 * How frames are delimited when the container carries neither a Basic nor an
 * Extended Offset Table and more than one frame is expected.
 *
 * <p>With a single frame no strategy is consulted: every fragment belongs to
 * it.</p>
 */
public enum FrameBoundaryStrategy
{
    /** Refuse to guess; decoding fails with a frame boundary error. */
    STRICT,

    /**
     * Every frame has the same number of fragments. Fails when the fragment
     * count is not a multiple of the frame count.
     */
    EQUAL_FRAGMENTS,

    /**
     * A frame ends with the fragment whose last 10 bytes contain the JPEG
     * EOI / JPEG 2000 EOC marker ({@code FF D9}).
     */
    END_OF_IMAGE_MARKER
}
