package com.questrail.repomon.driver;

import com.questrail.repomon.config.BridgeConfig;
import com.questrail.repomon.error.BridgeErrorKind;
import com.questrail.repomon.error.BridgeException;
import com.questrail.repomon.input.InputBridge;
import com.questrail.repomon.internal.time.WallClock;
import com.questrail.repomon.model.Message;
import com.questrail.repomon.observability.BridgeErrorEvent;
import com.questrail.repomon.observability.BridgeObservabilitySink;
import com.questrail.repomon.transport.InboundMessageListener;
import com.questrail.repomon.transport.Transport;
import com.questrail.repomon.transport.TransportFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * ForwardingDriver
 * =============================================================================
 * Top-level loop of a bridge session.
 *
 * <h2>Purpose</h2>
 * <ul>
 *   <li>Select the transport variant from {@link BridgeConfig#transport()}</li>
 *   <li>Start the console {@link InputBridge} and open the transport on its handoff</li>
 *   <li>Write every inbound message to the {@link MessageOutput}, unchanged and in order</li>
 *   <li>Shut down both directions when the inbound sequence ends</li>
 * </ul>
 *
 * <h2>Threading Model</h2>
 * {@link #run()} blocks the calling thread until the session ends. Inbound
 * messages are written on the transport's event loop thread, so output
 * writes are serialized with network reads.
 *
 * <h2>Termination</h2>
 * <pre>
 *   inbound end, no failure    → run() returns
 *   inbound end, failure       → run() throws that BridgeException
 *   output write failure       → transport closed, run() throws OUTPUT
 * </pre>
 * In every case the transport is closed and the input thread interrupted
 * before {@code run()} returns.
 *
 * <p>A driver runs one session. It is not restartable.</p>
 */
public final class ForwardingDriver
{
    private final BridgeConfig config;
    private final TransportFactory transports;
    private final InputBridge input;
    private final MessageOutput output;
    private final BridgeObservabilitySink observabilitySink;
    private final WallClock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final CountDownLatch finished = new CountDownLatch(1);
    private final AtomicReference<BridgeException> failure = new AtomicReference<>();

    private volatile Transport transport;

    public ForwardingDriver(BridgeConfig config,
                            TransportFactory transports,
                            InputBridge input,
                            MessageOutput output,
                            BridgeObservabilitySink observabilitySink,
                            WallClock clock)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.transports = Objects.requireNonNull(transports, "transports");
        this.input = Objects.requireNonNull(input, "input");
        this.output = Objects.requireNonNull(output, "output");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Runs the session to completion.
     *
     * @throws BridgeException if the session ended with a terminal failure
     * @throws InterruptedException if the calling thread was interrupted; the
     *                              session is shut down first
     */
    public void run() throws InterruptedException
    {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("ForwardingDriver already ran");
        }

        Transport t = transports.create(config.transport(), config.remote());
        transport = t;

        try {
            t.open(input.handoff(), new Session());
            input.start();
            finished.await();
        }
        finally {
            t.close();
            input.stop();
        }

        BridgeException f = failure.get();
        if (f != null) {
            observabilitySink.onError(new BridgeErrorEvent(clock.now(), f.getMessage(), f));
            throw f;
        }
    }

    /**
     * The transport selected by {@link #run()}, or {@code null} before that.
     */
    public Transport transport()
    {
        return transport;
    }

    private final class Session implements InboundMessageListener
    {
        @Override
        public void onMessage(Message message)
        {
            if (finished.getCount() == 0 || failure.get() != null) {
                return;
            }
            try {
                output.write(message);
            }
            catch (IOException e) {
                failure.compareAndSet(null, new BridgeException(BridgeErrorKind.OUTPUT,
                        "Failed to write to output: " + e.getMessage(), e));
                // Ends the inbound sequence; onInboundEnd releases run().
                transport.close();
            }
        }

        @Override
        public void onInboundEnd(BridgeException cause)
        {
            if (cause != null) {
                failure.compareAndSet(null, cause);
            }
            finished.countDown();
        }
    }
}
