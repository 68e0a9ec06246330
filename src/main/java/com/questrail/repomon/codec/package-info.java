/**
 * Message Wire Codec
 * =============================================================================
 *
 * <p>This package defines the boundary between {@link com.questrail.repomon.model.Message}
 * values and the bytes carried by a transport.</p>
 *
 * <pre>
 *   Message
 *        → MessageEncoder   (byte layout owned by codec.impl)
 *            → byte[] frame
 *                → stream write / datagram
 *
 *   stream read / datagram
 *        → byte[] frame
 *            → MessageDecoder
 *                → Optional&lt;Message&gt;
 * </pre>
 *
 * <h2>Framing policy</h2>
 * <p>One transport read is one frame. There is no length prefix or delimiter
 * between frames, so a frame split across two reads, or two frames coalesced
 * into one read, cannot be recovered. Both decode as malformed.</p>
 *
 * <h2>Failure policy</h2>
 * <p>Codec failures are never terminal. {@link com.questrail.repomon.codec.WireCodec}
 * absorbs them, reports them to the observability sink, and keeps the
 * session running.</p>
 */
package com.questrail.repomon.codec;
