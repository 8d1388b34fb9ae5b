package com.questrail.pixeldata;

/**
 * Base type for every failure raised while reading or writing encapsulated
 * pixel data or RLE Lossless frames.
 *
 * <p>All subtypes are unchecked and are thrown synchronously to the immediate
 * caller. Parsing is deterministic, so a malformed input fails the same way on
 * every attempt and nothing at this layer retries.</p>
 */
public abstract class PixelDataException extends RuntimeException
{
    protected PixelDataException(String message) {
        super(message);
    }

    protected PixelDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
