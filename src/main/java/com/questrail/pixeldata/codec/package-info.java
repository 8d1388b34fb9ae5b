/**
 * Encapsulated Pixel Data Container
 * =============================================================================
 *
 * <p>This package defines the <strong>container layer</strong>: the rules for
 * storing compressed frames as a run of items inside the value of an
 * encapsulated Pixel Data element, including:</p>
 *
 * <ul>
 *   <li>Item framing (tag, 32-bit length, value)</li>
 *   <li>The leading Basic Offset Table item</li>
 *   <li>Fragment iteration up to the Sequence Delimiter</li>
 *   <li>Grouping fragments into frames, and splitting frames into fragments</li>
 * </ul>
 *
 * <h2>Normative Authority</h2>
 * <p>DICOM PS3.5 Annex A.4 (Transfer Syntaxes for Encapsulation of Encoded
 * Pixel Data) defines the layout. Tolerated departures from it are reported
 * through {@link com.questrail.pixeldata.observability.PixelDataObservabilitySink}
 * rather than rejected.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   Pixel Data element value
 *        → EncapsulatedFrameDecoder   (container rules applied here)
 *            → byte[] per frame       (still compressed)
 *                → RleFrameCodec
 *                    → uncompressed frame
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>The element's own tag, VR and length are stripped by the caller.</li>
 *   <li>Frames are opaque here. Decompression lives in
 *       {@code com.questrail.pixeldata.rle}.</li>
 * </ul>
 */
package com.questrail.pixeldata.codec;
