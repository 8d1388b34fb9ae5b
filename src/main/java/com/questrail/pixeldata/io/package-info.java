/**
 * Byte source port and its implementations.
 *
 * <pre>
 *   byte[]               → ByteBufSource      (Netty ByteBuf, zero copy)
 *   SeekableByteChannel  → ChannelByteSource  (files, seekable streams)
 * </pre>
 *
 * <p>The container parser depends only on {@link com.questrail.pixeldata.io.ByteSource}.
 * Netty types never appear in public signatures.</p>
 */
package com.questrail.pixeldata.io;
