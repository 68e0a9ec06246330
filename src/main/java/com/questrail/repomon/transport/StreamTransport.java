package com.questrail.repomon.transport;

import com.questrail.repomon.codec.WireCodec;
import com.questrail.repomon.endpoint.Endpoint;
import com.questrail.repomon.error.BridgeErrorKind;
import com.questrail.repomon.error.BridgeException;
import com.questrail.repomon.input.MessageHandoff;
import com.questrail.repomon.internal.time.WallClock;
import com.questrail.repomon.observability.BridgeObservabilitySink;
import com.questrail.repomon.observability.TransportObservabilityEvent;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * StreamTransport
 * =============================================================================
 * Connection-oriented {@link Transport} over a {@link StreamConnection}.
 *
 * <h2>States</h2>
 * <pre>
 *   IDLE ──open──▶ CONNECTING ──onConnected──▶ CONNECTED ──▶ CLOSED
 *                      │                                      ▲
 *                      └──────── connect failure ─────────────┘
 * </pre>
 *
 * <p>While {@code CONNECTED}, forwarding and receiving run concurrently:</p>
 * <ul>
 *   <li>an {@link OutboundForwarder} drains the handoff into
 *       {@link StreamConnection#write(byte[])}</li>
 *   <li>each read delivered by the connection is decoded as one frame and
 *       passed to the inbound listener on the connection's event loop</li>
 * </ul>
 *
 * <h2>Termination</h2>
 * <ul>
 *   <li>connect failure: {@link BridgeErrorKind#CONNECTION}</li>
 *   <li>read failure: {@link BridgeErrorKind#READ}</li>
 *   <li>write failure: {@link BridgeErrorKind#WRITE}; the connection is closed</li>
 *   <li>peer close or {@link #close()}: clean end</li>
 * </ul>
 *
 * <p>The inbound sequence is not restartable.</p>
 */
public final class StreamTransport implements Transport
{
    public enum State
    {
        IDLE,
        CONNECTING,
        CONNECTED,
        CLOSED
    }

    private final Endpoint remote;
    private final StreamConnection connection;
    private final WireCodec codec;
    private final BridgeObservabilitySink observabilitySink;
    private final WallClock clock;

    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);

    private volatile MessageHandoff outbound;
    private volatile InboundMessageListener inbound;
    private volatile OutboundForwarder forwarder;

    public StreamTransport(Endpoint remote,
                           StreamConnection connection,
                           WireCodec codec,
                           BridgeObservabilitySink observabilitySink,
                           WallClock clock)
    {
        this.remote = Objects.requireNonNull(remote, "remote");
        this.connection = Objects.requireNonNull(connection, "connection");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public TransportKind kind()
    {
        return TransportKind.STREAM;
    }

    @Override
    public Endpoint remote()
    {
        return remote;
    }

    public State state()
    {
        return state.get();
    }

    @Override
    public void open(MessageHandoff outbound, InboundMessageListener inbound)
    {
        this.outbound = Objects.requireNonNull(outbound, "outbound");
        this.inbound = Objects.requireNonNull(inbound, "inbound");

        if (!state.compareAndSet(State.IDLE, State.CONNECTING)) {
            throw new IllegalStateException("StreamTransport already opened");
        }

        connection.setListener(new Listener());
        emit(TransportObservabilityEvent.Type.CONNECTING);
        connection.connect();
    }

    @Override
    public void close()
    {
        State previous = state.getAndSet(State.CLOSED);
        if (previous == State.CLOSED) {
            return;
        }
        stopForwarder();
        connection.close();
        if (previous != State.IDLE) {
            end(null);
        }
    }

    private void onWriteFailure(Throwable cause)
    {
        if (state.getAndSet(State.CLOSED) == State.CLOSED) {
            return;
        }
        connection.close();
        end(new BridgeException(BridgeErrorKind.WRITE,
                "Failed to write to " + remote + ": " + cause.getMessage(), cause));
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
        emit(TransportObservabilityEvent.Type.CLOSED);
        inbound.onInboundEnd(failure);
    }

    private void emit(TransportObservabilityEvent.Type type)
    {
        observabilitySink.onTransportEvent(new TransportObservabilityEvent(
                clock.now(), TransportKind.STREAM, type, remote.address()));
    }

    // -------------------------------------------------------------------------
    // Connection Listener
    // -------------------------------------------------------------------------

    private final class Listener implements StreamConnectionListener
    {
        @Override
        public void onConnected()
        {
            if (!state.compareAndSet(State.CONNECTING, State.CONNECTED)) {
                // Closed while connecting.
                connection.close();
                return;
            }
            emit(TransportObservabilityEvent.Type.CONNECTED);

            OutboundForwarder f = new OutboundForwarder(
                    outbound,
                    codec,
                    connection::write,
                    StreamTransport.this::onWriteFailure,
                    () -> emit(TransportObservabilityEvent.Type.OUTBOUND_DRAINED));
            forwarder = f;
            f.start();
        }

        @Override
        public void onBytes(byte[] bytes)
        {
            if (state.get() != State.CONNECTED) {
                return;
            }
            codec.decode(bytes).ifPresent(inbound::onMessage);
        }

        @Override
        public void onDisconnected(Throwable cause)
        {
            State previous = state.getAndSet(State.CLOSED);
            if (previous == State.CLOSED) {
                return;
            }
            stopForwarder();

            if (previous == State.CONNECTING) {
                String reason = cause != null ? cause.getMessage() : "connection closed";
                end(new BridgeException(BridgeErrorKind.CONNECTION,
                        "Failed to connect to " + remote + ": " + reason, cause));
            }
            else if (cause != null) {
                end(new BridgeException(BridgeErrorKind.READ,
                        "Failed to read from " + remote + ": " + cause.getMessage(), cause));
            }
            else {
                end(null);
            }
        }
    }
}
