package com.questrail.pixeldata;

/**
 * Indicates that the encapsulated container (or an RLE header) does not follow
 * the item layout.
 *
 * This typically reflects:
 * <ul>
 *   <li>An unexpected tag where an Item or Sequence Delimiter was expected</li>
 *   <li>A Basic Offset Table whose length is not a multiple of 4</li>
 *   <li>An undefined ({@code 0xFFFFFFFF}) length on a fragment item</li>
 *   <li>An item that runs past the end of the data</li>
 * </ul>
 */
public final class MalformedContainerException extends PixelDataException
{
    /** Offset value used when no byte position applies. */
    public static final long UNKNOWN_OFFSET = -1;

    private final long offset;

    public MalformedContainerException(String message) {
        this(message, UNKNOWN_OFFSET);
    }

    public MalformedContainerException(String message, long offset) {
        super(message);
        this.offset = offset;
    }

    /**
     * Returns the byte position (from the start of the source) of the offending
     * item, or {@link #UNKNOWN_OFFSET}.
     */
    public long offset() {
        return offset;
    }
}
