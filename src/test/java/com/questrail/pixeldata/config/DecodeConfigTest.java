package com.questrail.pixeldata.config;

import com.questrail.pixeldata.model.FrameBoundaryStrategy;
import com.questrail.pixeldata.model.SegmentOrder;
import com.questrail.pixeldata.observability.NullObservabilitySink;
import com.questrail.pixeldata.observability.Slf4jPixelDataObservabilitySink;
import org.junit.jupiter.api.Test;

import java.nio.ByteOrder;

import static org.junit.jupiter.api.Assertions.*;

final class DecodeConfigTest
{
    @Test
    void defaultsAreConformant()
    {
        DecodeConfig config = DecodeConfig.defaults();

        assertEquals(SegmentOrder.BIG_ENDIAN, config.segmentOrder());
        assertEquals(FrameBoundaryStrategy.STRICT, config.frameBoundaryStrategy());
        assertEquals(ByteOrder.LITTLE_ENDIAN, config.containerByteOrder());
        assertTrue(config.observability() instanceof Slf4jPixelDataObservabilitySink);
    }

    @Test
    void toBuilderCopiesEverySetting()
    {
        DecodeConfig config = DecodeConfig.builder()
                .withSegmentOrder(SegmentOrder.LITTLE_ENDIAN)
                .withFrameBoundaryStrategy(FrameBoundaryStrategy.END_OF_IMAGE_MARKER)
                .withContainerByteOrder(ByteOrder.BIG_ENDIAN)
                .withObservability(NullObservabilitySink.INSTANCE)
                .build();

        assertEquals(config, config.toBuilder().build());
        assertEquals(FrameBoundaryStrategy.EQUAL_FRAGMENTS,
                config.toBuilder().withFrameBoundaryStrategy(FrameBoundaryStrategy.EQUAL_FRAGMENTS).build()
                        .frameBoundaryStrategy());
    }

    @Test
    void nullSettingsAreRejected()
    {
        assertThrows(NullPointerException.class,
                () -> DecodeConfig.builder().withSegmentOrder(null).build());
        assertThrows(NullPointerException.class,
                () -> new DecodeConfig(SegmentOrder.BIG_ENDIAN, FrameBoundaryStrategy.STRICT, ByteOrder.LITTLE_ENDIAN, null));
    }
}
