package com.questrail.repomon.transport;

import com.questrail.repomon.endpoint.Endpoint;
import com.questrail.repomon.input.MessageHandoff;

/**
 * Transport
 * =============================================================================
 * One session with the remote {@link Endpoint}: consumes an outbound message
 * sequence and produces an inbound one.
 *
 * <p>Exactly two variants exist, {@link StreamTransport} and
 * {@link DatagramTransport}; the set is closed.</p>
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>{@link #open} is called once. It returns immediately; I/O proceeds on
 *       the transport's own threads.</li>
 *   <li>Once the transport is up, it drains {@code outbound} until the
 *       handoff is closed, waiting for each write to complete before taking
 *       the next message.</li>
 *   <li>Inbound messages are delivered to {@code inbound} in receive order;
 *       the sequence ends with exactly one
 *       {@link InboundMessageListener#onInboundEnd} call.</li>
 *   <li>A failed outbound write ends the inbound sequence with a
 *       {@code WRITE} failure.</li>
 *   <li>{@link #close()} stops both directions. It is idempotent and does not
 *       produce an {@code onInboundEnd} call of its own if one was already made.</li>
 * </ul>
 */
public sealed interface Transport permits StreamTransport, DatagramTransport
{
    TransportKind kind();

    Endpoint remote();

    void open(MessageHandoff outbound, InboundMessageListener inbound);

    void close();
}
