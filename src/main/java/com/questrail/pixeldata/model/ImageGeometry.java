package com.questrail.pixeldata.model;

/**
 * Declared geometry of one image frame.
 *
 * <h2>Why this type exists</h2>
 * <p>
 * The codec never interprets pixel values, but the RLE layer must know how
 * many byte planes a frame holds and how long each plane is. Those numbers
 * come from the enclosing dataset (Rows, Columns, Samples per Pixel and Bits
 * Allocated) and are handed in by the caller.
 * </p>
 *
 * <h2>Constraints</h2>
 * <ul>
 *   <li>{@code rows}, {@code columns} and {@code samplesPerPixel} are positive</li>
 *   <li>{@code bitsAllocated} is positive; whether it is usable is a codec
 *       decision (RLE requires a multiple of 8)</li>
 * </ul>
 */
public record ImageGeometry(
        int rows,
        int columns,
        int samplesPerPixel,
        int bitsAllocated
) {
    public ImageGeometry {
        if (rows < 1) {
            throw new IllegalArgumentException("rows must be positive (was " + rows + ")");
        }
        if (columns < 1) {
            throw new IllegalArgumentException("columns must be positive (was " + columns + ")");
        }
        if (samplesPerPixel < 1) {
            throw new IllegalArgumentException("samplesPerPixel must be positive (was " + samplesPerPixel + ")");
        }
        if (bitsAllocated < 1) {
            throw new IllegalArgumentException("bitsAllocated must be positive (was " + bitsAllocated + ")");
        }
    }

    public static ImageGeometry of(int rows, int columns, int samplesPerPixel, int bitsAllocated) {
        return new ImageGeometry(rows, columns, samplesPerPixel, bitsAllocated);
    }

    /**
     * Number of pixels in one sample plane ({@code rows * columns}).
     *
     * @throws ArithmeticException if the product overflows an {@code int}
     */
    public int pixelCount() {
        return Math.multiplyExact(rows, columns);
    }

    /**
     * Bytes used by one sample, rounded up to whole bytes.
     */
    public int bytesPerSample() {
        return (bitsAllocated + 7) / 8;
    }

    /**
     * Number of RLE segments a frame with this geometry holds.
     */
    public int segmentCount() {
        return samplesPerPixel * bytesPerSample();
    }

    /**
     * Size in bytes of one uncompressed frame.
     *
     * @throws ArithmeticException if the size overflows an {@code int}
     */
    public int frameLength() {
        return Math.multiplyExact(Math.multiplyExact(pixelCount(), samplesPerPixel), bytesPerSample());
    }
}
