/**
 * RLE Lossless codec for single frames.
 *
 * <pre>
 *   byte[] RLE frame
 *        → RleHeader.parse              (segment count and offsets)
 *        → RleSegmentCodec.decode       (one byte plane per segment)
 *        → RleFrameCodec                (planes interleaved into samples)
 *        → byte[] frame, little endian, planar configuration 1
 * </pre>
 *
 * <p>Frames reach this package already separated by
 * {@link com.questrail.pixeldata.codec.EncapsulatedFrameDecoder}.</p>
 */
package com.questrail.pixeldata.rle;
