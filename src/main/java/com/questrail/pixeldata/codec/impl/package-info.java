/**
 * Encapsulated Pixel Data Container (Implementation)
 * =============================================================================
 *
 * <p>Concrete container decoder and encoder, plus the package-private helpers
 * they are built from.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   ByteSource
 *        → ItemCodec.readItem
 *        → BasicOffsetTable.parse
 *        → FragmentIterator
 *        → FrameAssembler
 *        → byte[] per frame
 *
 *   byte[] per frame
 *        → FrameFragmenter.fragment
 *        → BasicOffsetTable.build / write
 *        → ItemCodec.writeItem
 *        → Pixel Data element value
 * </pre>
 *
 * <p>Failures surface as subclasses of
 * {@link com.questrail.pixeldata.PixelDataException}; nothing at this layer
 * is silently dropped.</p>
 */
package com.questrail.pixeldata.codec.impl;
