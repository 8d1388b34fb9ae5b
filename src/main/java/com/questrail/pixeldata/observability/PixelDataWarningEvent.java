package com.questrail.pixeldata.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * Record representing a tolerated anomaly in the pixel data being decoded.
 */
public record PixelDataWarningEvent(
    Instant timestamp,
    PixelDataWarning kind,
    String message
) {
    public PixelDataWarningEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }

    public static PixelDataWarningEvent of(PixelDataWarning kind, String message) {
        return new PixelDataWarningEvent(Instant.now(), kind, message);
    }
}
