package com.questrail.repomon.observability;

import com.questrail.repomon.transport.TransportKind;

import java.net.SocketAddress;
import java.time.Instant;

/**
 * Record representing a lifecycle change of the active transport.
 *
 * @param address the remote address for stream events, the bound local
 *                address for {@link Type#BOUND}; may be {@code null}
 */
public record TransportObservabilityEvent(
    Instant timestamp,
    TransportKind transport,
    Type type,
    SocketAddress address
) {
    public enum Type {
        CONNECTING,
        CONNECTED,
        BOUND,
        OUTBOUND_DRAINED,
        CLOSED
    }
}
