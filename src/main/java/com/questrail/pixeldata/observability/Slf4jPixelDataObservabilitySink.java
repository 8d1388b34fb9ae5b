package com.questrail.pixeldata.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of PixelDataObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jPixelDataObservabilitySink implements PixelDataObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jPixelDataObservabilitySink.class);

    @Override
    public void onWarning(PixelDataWarningEvent event) {
        log.warn("Pixel data {}: {}", event.kind(), event.message());
    }

    @Override
    public void onFrameDecoded(PixelDataFrameEvent event) {
        log.debug("Decoded frame {}: {} -> {} bytes",
            event.frameIndex(),
            event.encodedLength(),
            event.decodedLength());
    }
}
