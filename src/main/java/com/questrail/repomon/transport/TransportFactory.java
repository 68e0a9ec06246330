package com.questrail.repomon.transport;

import com.questrail.repomon.endpoint.Endpoint;

/**
 * Creates the transport variant selected for a session.
 */
public interface TransportFactory
{
    StreamTransport createStream(Endpoint remote);

    DatagramTransport createDatagram(Endpoint remote);

    default Transport create(TransportKind kind, Endpoint remote)
    {
        return switch (kind) {
            case STREAM -> createStream(remote);
            case DATAGRAM -> createDatagram(remote);
        };
    }
}
