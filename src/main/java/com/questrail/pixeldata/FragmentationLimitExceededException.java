package com.questrail.pixeldata;

/**
 * Raised when a frame is asked to split into more fragments than its byte
 * count supports (every fragment needs at least 2 bytes after padding).
 */
public final class FragmentationLimitExceededException extends PixelDataException
{
    public FragmentationLimitExceededException(String message) {
        super(message);
    }
}
