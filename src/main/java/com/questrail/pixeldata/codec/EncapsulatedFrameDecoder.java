package com.questrail.pixeldata.codec;

import com.questrail.pixeldata.io.ByteSource;
import com.questrail.pixeldata.model.ExtendedOffsetTable;
import com.questrail.pixeldata.model.FragmentIndex;

import java.util.Iterator;
import java.util.List;

/**
 * EncapsulatedFrameDecoder
 * -----------------------------------------------------------------------------
 * Reads frames out of the value of an encapsulated Pixel Data element.
 *
 * <p>This interface defines the inbound boundary between the raw container
 * bytes (the element value, with the element's own tag, VR and length already
 * stripped) and per-frame compressed byte sequences.</p>
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Parsing the Basic Offset Table and fragment items</li>
 *   <li>Deciding which fragments belong to which frame</li>
 *   <li>Concatenating each frame's fragments</li>
 * </ul>
 *
 * <p>The decoder is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Decompressing frames (see {@code com.questrail.pixeldata.rle})</li>
 *   <li>Interpreting pixel values</li>
 *   <li>Locating the Pixel Data element in a dataset</li>
 * </ul>
 *
 * <p>Every {@code Iterator} returned is lazy, single-pass and not thread-safe.
 * {@code ByteSource} arguments are positioned at the Basic Offset Table item
 * unless stated otherwise.</p>
 */
public interface EncapsulatedFrameDecoder
{
    /**
     * Yields one byte array per frame, in frame order.
     *
     * @param pixelData       the Pixel Data element value
     * @param numberOfFrames  the expected number of frames, at least 1
     */
    Iterator<byte[]> frames(byte[] pixelData, int numberOfFrames);

    Iterator<byte[]> frames(ByteSource source, int numberOfFrames);

    /**
     * Yields one byte array per frame using an Extended Offset Table, which
     * takes precedence over the Basic Offset Table.
     */
    Iterator<byte[]> frames(ByteSource source, int numberOfFrames, ExtendedOffsetTable offsetTable);

    /**
     * Returns the frame at {@code index} (0-based). The source position is
     * restored afterwards.
     */
    byte[] frame(byte[] pixelData, int index, int numberOfFrames);

    byte[] frame(ByteSource source, int index, int numberOfFrames);

    byte[] frame(ByteSource source, int index, int numberOfFrames, ExtendedOffsetTable offsetTable);

    /**
     * Yields fragment values from a source positioned at a fragment's item tag,
     * stopping at a Sequence Delimiter or the end of the data.
     */
    Iterator<byte[]> fragments(ByteSource source);

    /**
     * Reads the Basic Offset Table, leaving the source at the first fragment.
     *
     * @return the frame offsets, empty when the table is empty
     */
    List<Long> basicOffsets(ByteSource source);

    /**
     * Counts the fragments from a source positioned at a fragment's item tag,
     * without consuming it.
     */
    FragmentIndex fragmentIndex(ByteSource source);
}
