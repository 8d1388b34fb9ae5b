package com.questrail.pixeldata.config;

/**
 * EncapsulationConfig
 * -----------------------------------------------------------------------------
 * Encode-side settings for building an encapsulated container.
 *
 * <ul>
 *   <li><b>fragmentsPerFrame</b>: number of fragment items each frame is
 *       split into, between 1 and {@link #MAX_FRAGMENTS_PER_FRAME}.</li>
 *   <li><b>includeBasicOffsetTable</b>: whether the leading Basic Offset
 *       Table item carries frame offsets. When false the item is still written,
 *       with zero length. Strongly recommended when fragmentsPerFrame is not 1.</li>
 * </ul>
 */
public record EncapsulationConfig(
        int fragmentsPerFrame,
        boolean includeBasicOffsetTable
) {
    /** Upper bound on fragments per frame used by this codec. */
    public static final int MAX_FRAGMENTS_PER_FRAME = 47;

    public EncapsulationConfig {
        if (fragmentsPerFrame < 1 || fragmentsPerFrame > MAX_FRAGMENTS_PER_FRAME) {
            throw new IllegalArgumentException("fragmentsPerFrame must be in range 1 to "
                    + MAX_FRAGMENTS_PER_FRAME + " (was " + fragmentsPerFrame + ")");
        }
    }

    /**
     * One fragment per frame with a populated Basic Offset Table.
     */
    public static EncapsulationConfig defaults() {
        return new EncapsulationConfig(1, true);
    }

    public static EncapsulationConfig withFragmentsPerFrame(int fragmentsPerFrame) {
        return new EncapsulationConfig(fragmentsPerFrame, true);
    }
}
