package com.questrail.pixeldata.observability;

import java.time.Instant;

/**
 * Record representing one frame that has been assembled and decoded.
 */
public record PixelDataFrameEvent(
    Instant timestamp,
    int frameIndex,
    int encodedLength,
    int decodedLength
) {
    public static PixelDataFrameEvent of(int frameIndex, int encodedLength, int decodedLength) {
        return new PixelDataFrameEvent(Instant.now(), frameIndex, encodedLength, decodedLength);
    }
}
