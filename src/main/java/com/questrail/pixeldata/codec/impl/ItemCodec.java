package com.questrail.pixeldata.codec.impl;

import com.questrail.pixeldata.MalformedContainerException;
import com.questrail.pixeldata.io.ByteSource;
import com.questrail.pixeldata.observability.PixelDataObservabilitySink;
import com.questrail.pixeldata.observability.PixelDataWarning;
import com.questrail.pixeldata.observability.PixelDataWarningEvent;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

/**
 * ItemCodec
 * -----------------------------------------------------------------------------
 * Reads and writes the length-prefixed item primitive that the encapsulated
 * container is built from.
 *
 * <p>Wire layout:</p>
 * <pre>
 *   group(2) | element(2) | length(4) | value(length)
 * </pre>
 *
 * <ul>
 *   <li>Item tag {@code (FFFE,E000)}: the following {@code length} bytes are the value.
 *       {@code 0xFFFFFFFF} (undefined length) is not allowed here.</li>
 *   <li>Sequence Delimiter tag {@code (FFFE,E0DD)}: ends the run of items. Its length
 *       should be zero; a non-zero length is accepted and reported as a warning.</li>
 *   <li>Any other tag is a malformed container.</li>
 * </ul>
 *
 * <p>This class is responsible only for one item at a time. It does not know
 * about offset tables or frames.</p>
 */
final class ItemCodec
{
    /** Item tag (FFFE,E000) as {@code group << 16 | element}. */
    static final int ITEM_TAG = 0xFFFEE000;

    /** Sequence Delimiter tag (FFFE,E0DD) as {@code group << 16 | element}. */
    static final int SEQUENCE_DELIMITER_TAG = 0xFFFEE0DD;

    /** Undefined length marker, invalid for fragment and offset table items. */
    static final long UNDEFINED_LENGTH = 0xFFFFFFFFL;

    /** Bytes taken by an item's tag and length fields. */
    static final int HEADER_LENGTH = 8;

    private static final int TAG_LENGTH = 4;

    private ItemCodec() {}

    /**
     * Reads the next item from {@code source}.
     *
     * <p>Fewer than 4 bytes left at a tag boundary is the end of the data, not
     * an error.</p>
     *
     * @throws MalformedContainerException on an unexpected tag, an undefined
     *         length, or an item that runs past the end of the data
     */
    static Item readItem(ByteSource source, PixelDataObservabilitySink sink)
    {
        final long itemOffset = source.tell();
        if (source.remaining() < TAG_LENGTH) {
            return Item.endOfData(itemOffset);
        }

        final int group = source.readUnsignedShort();
        final int element = source.readUnsignedShort();
        final int tag = (group << 16) | element;

        if (tag == SEQUENCE_DELIMITER_TAG) {
            // The delimiter never carries a value; a non-zero length is
            // reported and otherwise ignored.
            if (source.remaining() >= 4) {
                long length = source.readUnsignedInt();
                if (length != 0) {
                    sink.onWarning(PixelDataWarningEvent.of(PixelDataWarning.NON_ZERO_DELIMITER_LENGTH,
                            String.format("Expected 0x00000000 after the sequence delimiter at offset %d, found 0x%X",
                                    itemOffset, length)));
                }
            }
            return Item.sequenceDelimiter(itemOffset);
        }

        if (tag != ITEM_TAG) {
            throw new MalformedContainerException(String.format(
                    "Unexpected tag (%04X,%04X) at offset %d when parsing the encapsulated pixel data items",
                    group, element, itemOffset), itemOffset);
        }

        if (source.remaining() < 4) {
            throw new MalformedContainerException(
                    "Unable to determine the length of the item at offset " + itemOffset
                            + " as the end of the data has been reached", itemOffset);
        }

        final long length = source.readUnsignedInt();
        if (length == UNDEFINED_LENGTH) {
            throw new MalformedContainerException(
                    "Undefined item length at offset " + itemOffset
                            + " when parsing the encapsulated pixel data fragments", itemOffset);
        }
        if (length > source.remaining()) {
            throw new MalformedContainerException(String.format(
                    "The item at offset %d has a length of %d bytes but only %d bytes remain",
                    itemOffset, length, source.remaining()), itemOffset);
        }

        return Item.value(itemOffset, source.read((int) length));
    }

    /**
     * Appends an item holding {@code value} to {@code out}, little endian.
     *
     * <p>The caller is responsible for {@code value} having an even length.</p>
     */
    static void writeItem(ByteBuf out, byte[] value)
    {
        out.writeShortLE(ITEM_TAG >>> 16);
        out.writeShortLE(ITEM_TAG & 0xFFFF);
        out.writeIntLE(value.length);
        out.writeBytes(value);
    }

    /**
     * Returns an item holding {@code value}, little endian.
     */
    static byte[] writeItem(byte[] value)
    {
        byte[] item = new byte[HEADER_LENGTH + value.length];
        ByteBuf out = Unpooled.wrappedBuffer(item);
        out.writerIndex(0);
        writeItem(out, value);
        return item;
    }

    /**
     * One result of {@link #readItem}: an item value, the sequence delimiter, or
     * the end of the data.
     *
     * <p>{@code value} is empty (never null) unless {@code kind} is {@link Kind#VALUE}.</p>
     */
    record Item(Kind kind, long offset, byte[] value)
    {
        private static final byte[] NO_VALUE = new byte[0];

        enum Kind
        {
            VALUE,
            SEQUENCE_DELIMITER,
            END_OF_DATA
        }

        static Item value(long offset, byte[] value)
        {
            return new Item(Kind.VALUE, offset, value);
        }

        static Item sequenceDelimiter(long offset)
        {
            return new Item(Kind.SEQUENCE_DELIMITER, offset, NO_VALUE);
        }

        static Item endOfData(long offset)
        {
            return new Item(Kind.END_OF_DATA, offset, NO_VALUE);
        }

        boolean isValue()
        {
            return kind == Kind.VALUE;
        }
    }
}
