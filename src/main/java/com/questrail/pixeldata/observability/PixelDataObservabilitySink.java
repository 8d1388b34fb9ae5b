package com.questrail.pixeldata.observability;

/**
 * Main interface for receiving pixel data codec observability events.
 * Implementations can provide logging, metrics, or test recording.
 */
public interface PixelDataObservabilitySink {
    /**
     * Called when non-conformant data is accepted instead of rejected.
     * @param event the warning details
     */
    void onWarning(PixelDataWarningEvent event);

    /**
     * Called after a frame has been decoded.
     * @param event the frame details
     */
    void onFrameDecoded(PixelDataFrameEvent event);
}
