package com.questrail.pixeldata.codec;

import com.questrail.pixeldata.model.ExtendedEncapsulation;

import java.util.List;

/**
 * EncapsulatedFrameEncoder
 * -----------------------------------------------------------------------------
 * Builds the value of an encapsulated Pixel Data element from compressed frames.
 *
 * <p><strong>Layering note:</strong> This encoder does NOT compress frames and
 * does NOT write the element's own tag, VR, undefined length, or the final
 * Sequence Delimiter. It only applies the mechanical rules of:</p>
 * <ul>
 *   <li>Fragmenting frames into even-length fragments</li>
 *   <li>Wrapping fragments as items</li>
 *   <li>Writing the leading Basic Offset Table item</li>
 * </ul>
 */
public interface EncapsulatedFrameEncoder
{
    /**
     * Encapsulates {@code frames} using the encoder's configuration.
     */
    byte[] encapsulate(List<byte[]> frames);

    /**
     * Encapsulates {@code frames}, splitting each into {@code fragmentsPerFrame}
     * fragments. A Basic Offset Table item is always written first; it holds the
     * frame offsets only when {@code includeBasicOffsetTable} is true.
     *
     * @throws IllegalArgumentException if {@code fragmentsPerFrame} is outside 1 to 47
     */
    byte[] encapsulate(List<byte[]> frames, int fragmentsPerFrame, boolean includeBasicOffsetTable);

    /**
     * Encapsulates {@code frames} one fragment per frame with an empty Basic
     * Offset Table, and returns the matching Extended Offset Table.
     */
    ExtendedEncapsulation encapsulateExtended(List<byte[]> frames);

    /**
     * Splits {@code frame} into {@code nrFragments} even-length fragments.
     */
    List<byte[]> fragment(byte[] frame, int nrFragments);

    /**
     * Splits {@code frame} into {@code nrFragments} fragments, each returned as
     * a complete item.
     */
    List<byte[]> itemise(byte[] frame, int nrFragments);
}
