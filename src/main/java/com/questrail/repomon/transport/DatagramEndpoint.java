package com.questrail.repomon.transport;

import java.net.SocketAddress;
import java.util.concurrent.CompletableFuture;

/**
 * DatagramEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a datagram-based transport (UDP-style).
 *
 * <p>This endpoint is intentionally small. {@link DatagramTransport} is
 * responsible for:</p>
 * <ul>
 *   <li>filtering inbound datagrams by sender</li>
 *   <li>feeding accepted payloads through the wire codec</li>
 *   <li>draining the outbound handoff into {@link #send(SocketAddress, byte[])}</li>
 * </ul>
 *
 * <p>Implementations may be backed by Netty, java.nio, or a test harness.</p>
 */
public interface DatagramEndpoint
{
    /**
     * Bind the endpoint and begin receiving datagrams.
     *
     * <p>On successful bind, the endpoint MUST notify its listener via
     * {@link DatagramEndpointListener#onTransportUp(SocketAddress)} exactly once.
     * A bind failure is reported via
     * {@link DatagramEndpointListener#onTransportDown(Throwable)}.</p>
     */
    void start();

    /**
     * Close the socket and release all transport resources.
     */
    void stop();

    /**
     * Send one datagram.
     *
     * @param remote remote destination
     * @param payload datagram payload
     * @return completes when the datagram has been handed to the socket, or
     *         exceptionally if it could not be
     */
    CompletableFuture<Void> send(SocketAddress remote, byte[] payload);

    /**
     * Register the listener that receives inbound datagrams and lifecycle events.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(DatagramEndpointListener listener);
}
