package com.questrail.repomon.transport;

import com.questrail.repomon.codec.WireCodec;
import com.questrail.repomon.endpoint.Endpoint;
import com.questrail.repomon.error.BridgeErrorKind;
import com.questrail.repomon.error.BridgeException;
import com.questrail.repomon.input.MessageHandoff;
import com.questrail.repomon.internal.time.WallClock;
import com.questrail.repomon.observability.BridgeObservabilitySink;
import com.questrail.repomon.observability.TransportObservabilityEvent;

import java.net.SocketAddress;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * DatagramTransport
 * =============================================================================
 * Connectionless {@link Transport} over a {@link DatagramEndpoint}.
 *
 * <h2>Inbound path (filter-before-decode)</h2>
 *
 * <pre>
 *   DatagramEndpoint.onDatagram(sender, payload)
 *        → sender == remote ?   (otherwise dropped: no decode, no log)
 *            → WireCodec.decode
 *                → InboundMessageListener.onMessage
 * </pre>
 *
 * <h2>Outbound path</h2>
 *
 * <pre>
 *   MessageHandoff
 *        → OutboundForwarder
 *            → WireCodec.encode
 *                → DatagramEndpoint.send(remote, frame)
 * </pre>
 *
 * <p>Delivery is unordered and unacknowledged. No retransmission or
 * sequencing is added.</p>
 *
 * <p>The inbound sequence has no natural end; it ends when the socket is
 * closed, on a socket error, or on an outbound write failure.</p>
 */
public final class DatagramTransport implements Transport
{
    private final Endpoint remote;
    private final DatagramEndpoint endpoint;
    private final WireCodec codec;
    private final BridgeObservabilitySink observabilitySink;
    private final WallClock clock;

    private final AtomicBoolean opened = new AtomicBoolean(false);
    private final AtomicBoolean ended = new AtomicBoolean(false);
    private final AtomicReference<SocketAddress> boundAddress = new AtomicReference<>();

    private volatile MessageHandoff outbound;
    private volatile InboundMessageListener inbound;
    private volatile OutboundForwarder forwarder;

    public DatagramTransport(Endpoint remote,
                             DatagramEndpoint endpoint,
                             WireCodec codec,
                             BridgeObservabilitySink observabilitySink,
                             WallClock clock)
    {
        this.remote = Objects.requireNonNull(remote, "remote");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public TransportKind kind()
    {
        return TransportKind.DATAGRAM;
    }

    @Override
    public Endpoint remote()
    {
        return remote;
    }

    /**
     * The local address once bound, or {@code null} before that.
     */
    public SocketAddress boundAddress()
    {
        return boundAddress.get();
    }

    @Override
    public void open(MessageHandoff outbound, InboundMessageListener inbound)
    {
        this.outbound = Objects.requireNonNull(outbound, "outbound");
        this.inbound = Objects.requireNonNull(inbound, "inbound");

        if (!opened.compareAndSet(false, true)) {
            throw new IllegalStateException("DatagramTransport already opened");
        }

        endpoint.setListener(new Listener());
        endpoint.start();
    }

    @Override
    public void close()
    {
        if (!opened.get()) {
            return;
        }
        boolean first = ended.compareAndSet(false, true);
        stopForwarder();
        endpoint.stop();
        if (first) {
            end(null);
        }
    }

    private void onWriteFailure(Throwable cause)
    {
        fail(new BridgeException(BridgeErrorKind.WRITE,
                "Failed to send datagram to " + remote + ": " + cause.getMessage(), cause));
    }

    private void fail(BridgeException failure)
    {
        if (!ended.compareAndSet(false, true)) {
            return;
        }
        stopForwarder();
        endpoint.stop();
        end(failure);
    }

    private void stopForwarder()
    {
        OutboundForwarder f = forwarder;
        if (f != null) {
            f.stop();
        }
    }

    private void end(BridgeException failure)
    {
        emit(TransportObservabilityEvent.Type.CLOSED, boundAddress.get());
        inbound.onInboundEnd(failure);
    }

    private void emit(TransportObservabilityEvent.Type type, SocketAddress address)
    {
        observabilitySink.onTransportEvent(new TransportObservabilityEvent(
                clock.now(), TransportKind.DATAGRAM, type, address));
    }

    // -------------------------------------------------------------------------
    // Endpoint Listener
    // -------------------------------------------------------------------------

    private final class Listener implements DatagramEndpointListener
    {
        @Override
        public void onTransportUp(SocketAddress localAddress)
        {
            if (ended.get()) {
                return;
            }
            boundAddress.set(localAddress);
            emit(TransportObservabilityEvent.Type.BOUND, localAddress);

            OutboundForwarder f = new OutboundForwarder(
                    outbound,
                    codec,
                    frame -> endpoint.send(remote.address(), frame),
                    DatagramTransport.this::onWriteFailure,
                    () -> emit(TransportObservabilityEvent.Type.OUTBOUND_DRAINED, localAddress));
            forwarder = f;
            f.start();
        }

        @Override
        public void onTransportDown(Throwable cause)
        {
            if (boundAddress.get() == null) {
                String reason = cause != null ? cause.getMessage() : "socket closed";
                fail(new BridgeException(BridgeErrorKind.BIND,
                        "Failed to bind datagram socket: " + reason, cause));
            }
            else if (cause != null) {
                fail(new BridgeException(BridgeErrorKind.READ,
                        "Datagram socket failed: " + cause.getMessage(), cause));
            }
            else if (ended.compareAndSet(false, true)) {
                stopForwarder();
                end(null);
            }
        }

        @Override
        public void onDatagram(SocketAddress sender, byte[] payload)
        {
            if (!remote.matches(sender) || ended.get()) {
                return;
            }
            codec.decode(payload).ifPresent(inbound::onMessage);
        }
    }
}
