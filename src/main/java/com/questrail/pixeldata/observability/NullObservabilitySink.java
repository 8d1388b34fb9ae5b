package com.questrail.pixeldata.observability;

/**
 * No-op implementation of PixelDataObservabilitySink.
 */
public final class NullObservabilitySink implements PixelDataObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onWarning(PixelDataWarningEvent event) {}

    @Override
    public void onFrameDecoded(PixelDataFrameEvent event) {}
}
