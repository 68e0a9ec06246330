package com.questrail.repomon.transport;

import java.net.SocketAddress;

/**
 * DatagramEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link DatagramEndpoint}.
 *
 * <p>All callbacks must be delivered in a <em>serialized</em> manner by the
 * implementation. Netty endpoints serialize callbacks on the channel's
 * event loop.</p>
 */
public interface DatagramEndpointListener
{
    /**
     * Called once the socket is bound.
     *
     * @param localAddress the address actually bound (ephemeral port resolved)
     */
    void onTransportUp(SocketAddress localAddress);

    /**
     * Called when the socket becomes unusable, at most once.
     *
     * @param cause bind or I/O failure; {@code null} for an orderly close
     */
    void onTransportDown(Throwable cause);

    /**
     * Called for every datagram received, from any sender.
     *
     * <p>The payload is a copy owned by the listener and is one complete
     * datagram. No streaming assumptions are permitted at this boundary.</p>
     *
     * @param sender remote sender endpoint
     * @param payload raw datagram payload
     */
    void onDatagram(SocketAddress sender, byte[] payload);
}
