package com.questrail.pixeldata;

/**
 * Raised when RLE Lossless data cannot be handled for the declared geometry,
 * i.e. when bits allocated is not a multiple of 8.
 */
public final class UnsupportedRleEncodingException extends PixelDataException
{
    public UnsupportedRleEncodingException(String message) {
        super(message);
    }
}
