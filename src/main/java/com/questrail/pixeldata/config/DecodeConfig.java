package com.questrail.pixeldata.config;

import com.questrail.pixeldata.model.FrameBoundaryStrategy;
import com.questrail.pixeldata.model.SegmentOrder;
import com.questrail.pixeldata.observability.PixelDataObservabilitySink;
import com.questrail.pixeldata.observability.Slf4jPixelDataObservabilitySink;

import java.nio.ByteOrder;
import java.util.Objects;

/**
 * Aggregated configuration for decoding encapsulated pixel data.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>segmentOrder</b>: byte-plane order of multi-byte RLE samples.
 *       {@link SegmentOrder#BIG_ENDIAN} is conformant; the little-endian order is
 *       accepted for files written by non-conformant encoders.</li>
 *   <li><b>frameBoundaryStrategy</b>: how to split fragments into frames when
 *       there is no offset table and more than one frame.</li>
 *   <li><b>containerByteOrder</b>: byte order of item tags, lengths and Basic
 *       Offset Table entries. Little endian except for the retired explicit
 *       big endian transfer syntax.</li>
 *   <li><b>observability</b>: receives warnings for tolerated
 *       non-conformance and per-frame progress.</li>
 * </ul>
 */
public record DecodeConfig(
    SegmentOrder segmentOrder,
    FrameBoundaryStrategy frameBoundaryStrategy,
    ByteOrder containerByteOrder,
    PixelDataObservabilitySink observability
) {
    public DecodeConfig {
        Objects.requireNonNull(segmentOrder, "segmentOrder");
        Objects.requireNonNull(frameBoundaryStrategy, "frameBoundaryStrategy");
        Objects.requireNonNull(containerByteOrder, "containerByteOrder");
        Objects.requireNonNull(observability, "observability");
    }

    /**
     * Conformant defaults: big endian segment order, strict frame boundaries,
     * little endian container, SLF4J logging.
     */
    public static DecodeConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .withSegmentOrder(segmentOrder)
            .withFrameBoundaryStrategy(frameBoundaryStrategy)
            .withContainerByteOrder(containerByteOrder)
            .withObservability(observability);
    }

    public static final class Builder {
        private SegmentOrder segmentOrder = SegmentOrder.BIG_ENDIAN;
        private FrameBoundaryStrategy frameBoundaryStrategy = FrameBoundaryStrategy.STRICT;
        private ByteOrder containerByteOrder = ByteOrder.LITTLE_ENDIAN;
        private PixelDataObservabilitySink observability;

        public Builder withSegmentOrder(SegmentOrder segmentOrder) {
            this.segmentOrder = segmentOrder;
            return this;
        }

        public Builder withFrameBoundaryStrategy(FrameBoundaryStrategy frameBoundaryStrategy) {
            this.frameBoundaryStrategy = frameBoundaryStrategy;
            return this;
        }

        public Builder withContainerByteOrder(ByteOrder containerByteOrder) {
            this.containerByteOrder = containerByteOrder;
            return this;
        }

        public Builder withObservability(PixelDataObservabilitySink observability) {
            this.observability = observability;
            return this;
        }

        public DecodeConfig build() {
            PixelDataObservabilitySink sink = (observability != null)
                ? observability
                : new Slf4jPixelDataObservabilitySink();
            return new DecodeConfig(segmentOrder, frameBoundaryStrategy, containerByteOrder, sink);
        }
    }
}
