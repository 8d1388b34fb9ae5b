package com.questrail.pixeldata;

/**
 * Indicates that fragment-to-frame boundaries cannot be determined, or that a
 * fragment straddles a boundary declared by an offset table.
 */
public final class FrameBoundaryException extends PixelDataException
{
    public FrameBoundaryException(String message) {
        super(message);
    }
}
