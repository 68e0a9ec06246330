/**
 * Transport Ports and Variants
 * =============================================================================
 *
 * <h2>Two layers</h2>
 * <ul>
 *   <li><strong>Ports</strong> ({@link com.questrail.repomon.transport.StreamConnection},
 *       {@link com.questrail.repomon.transport.DatagramEndpoint}): raw byte I/O,
 *       backed by Netty in production and by fakes in tests.</li>
 *   <li><strong>Variants</strong> ({@link com.questrail.repomon.transport.StreamTransport},
 *       {@link com.questrail.repomon.transport.DatagramTransport}): the closed
 *       {@link com.questrail.repomon.transport.Transport} hierarchy that adds
 *       framing through the wire codec, outbound forwarding from the input
 *       handoff, and (for datagrams) sender filtering.</li>
 * </ul>
 *
 * <p>Everything above this package sees only {@code Message} values, a
 * {@code MessageHandoff}, and {@code BridgeException} terminations. Netty
 * types stay inside {@code transport.netty}.</p>
 *
 * <h2>Threads</h2>
 * <ul>
 *   <li>Port callbacks, and therefore inbound message delivery, run on the
 *       port's single event loop thread.</li>
 *   <li>Outbound forwarding runs on a {@code repomon-forwarder} thread that
 *       blocks on the handoff and on write completion.</li>
 * </ul>
 */
package com.questrail.repomon.transport;
