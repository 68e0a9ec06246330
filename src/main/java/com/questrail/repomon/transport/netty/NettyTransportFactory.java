package com.questrail.repomon.transport.netty;

import com.questrail.repomon.codec.WireCodec;
import com.questrail.repomon.endpoint.Endpoint;
import com.questrail.repomon.internal.time.WallClock;
import com.questrail.repomon.observability.BridgeObservabilitySink;
import com.questrail.repomon.transport.DatagramTransport;
import com.questrail.repomon.transport.StreamTransport;
import com.questrail.repomon.transport.TransportFactory;

import java.util.Objects;

/**
 * Production {@link TransportFactory}: each transport gets its own Netty
 * channel and single-threaded event loop.
 *
 * <p>Datagram sockets bind the wildcard address of the remote's family on an
 * ephemeral port. Both transports read into fixed buffers of
 * {@code maxFrameLength} bytes, so any frame within the limit arrives whole.</p>
 */
public final class NettyTransportFactory implements TransportFactory
{
    private final WireCodec codec;
    private final int maxFrameLength;
    private final BridgeObservabilitySink observabilitySink;
    private final WallClock clock;

    public NettyTransportFactory(WireCodec codec,
                                 int maxFrameLength,
                                 BridgeObservabilitySink observabilitySink,
                                 WallClock clock)
    {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.maxFrameLength = maxFrameLength;
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public StreamTransport createStream(Endpoint remote)
    {
        return new StreamTransport(
                remote,
                new NettyTcpStreamConnection(remote.address(), maxFrameLength),
                codec,
                observabilitySink,
                clock);
    }

    @Override
    public DatagramTransport createDatagram(Endpoint remote)
    {
        return new DatagramTransport(
                remote,
                new NettyUdpDatagramEndpoint(remote.family().wildcardBindAddress(), maxFrameLength),
                codec,
                observabilitySink,
                clock);
    }
}
