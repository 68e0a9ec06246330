package com.questrail.repomon.transport;

/**
 * Selects the transport for a session.
 */
public enum TransportKind
{
    /** Connection-oriented (TCP). */
    STREAM,

    /** Connectionless (UDP). */
    DATAGRAM
}
