package com.questrail.pixeldata.model;

import java.util.Objects;

/**
 * Result of encapsulating frames for use with an Extended Offset Table: the
 * container bytes (with an empty Basic Offset Table) plus the table itself.
 */
public final class ExtendedEncapsulation
{
    private final byte[] pixelData;
    private final ExtendedOffsetTable offsetTable;

    public ExtendedEncapsulation(byte[] pixelData, ExtendedOffsetTable offsetTable) {
        this.pixelData = Objects.requireNonNull(pixelData, "pixelData").clone();
        this.offsetTable = Objects.requireNonNull(offsetTable, "offsetTable");
    }

    /**
     * Returns a copy of the encapsulated container bytes.
     */
    public byte[] pixelData() {
        return pixelData.clone();
    }

    public ExtendedOffsetTable offsetTable() {
        return offsetTable;
    }

    @Override
    public String toString() {
        return "ExtendedEncapsulation[" +
                "pixelDataLength=" + pixelData.length +
                ", frames=" + offsetTable.frameCount() +
                ']';
    }
}
