package com.questrail.repomon.input;

import com.questrail.repomon.internal.time.WallClock;
import com.questrail.repomon.observability.BridgeObservabilitySink;
import com.questrail.repomon.observability.InputObservabilityEvent;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * InputBridge
 * =============================================================================
 * Turns a blocking console {@link InputStream} into messages on a
 * {@link MessageHandoff}.
 *
 * <h2>Threading Model</h2>
 * The bridge owns one dedicated daemon thread ({@code repomon-input}) that is
 * the only reader of the stream and the only producer on the handoff. The
 * network event loop never touches the stream.
 *
 * <h2>Loop</h2>
 * <pre>
 *   read(chunk) → n &gt; 0 → factory.fromChunk → handoff.put (blocks until taken)
 *               → n &lt; 0 → handoff.close, exit
 *               → IOException → handoff.close, exit
 * </pre>
 *
 * <p>There are no retries. Interruption while waiting on the handoff (session
 * shutdown) exits without closing it. A thread blocked inside
 * {@code read} cannot be interrupted; being a daemon, it does not hold the
 * JVM open.</p>
 */
public final class InputBridge
{
    public static final int DEFAULT_CHUNK_SIZE = 1024;

    private final InputStream source;
    private final MessageHandoff handoff;
    private final InputMessageFactory messageFactory;
    private final int chunkSize;
    private final BridgeObservabilitySink observabilitySink;
    private final WallClock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile Thread readerThread;

    public InputBridge(InputStream source,
                       MessageHandoff handoff,
                       InputMessageFactory messageFactory,
                       int chunkSize,
                       BridgeObservabilitySink observabilitySink,
                       WallClock clock)
    {
        this.source = Objects.requireNonNull(source, "source");
        this.handoff = Objects.requireNonNull(handoff, "handoff");
        this.messageFactory = Objects.requireNonNull(messageFactory, "messageFactory");
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        this.chunkSize = chunkSize;
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Starts the reader thread.
     * Idempotent: calling start() multiple times has no effect after the first call.
     */
    public void start()
    {
        if (started.compareAndSet(false, true)) {
            Thread t = new Thread(this::run, "repomon-input");
            t.setDaemon(true);
            readerThread = t;
            t.start();
        }
    }

    /**
     * Interrupts the reader thread. Does not wait for it.
     */
    public void stop()
    {
        Thread t = readerThread;
        if (t != null) {
            t.interrupt();
        }
    }

    /**
     * Waits up to {@code millis} for the reader thread to finish.
     *
     * @return true if the thread has finished (or was never started)
     */
    public boolean awaitTermination(long millis) throws InterruptedException
    {
        Thread t = readerThread;
        if (t == null) {
            return true;
        }
        t.join(millis);
        return !t.isAlive();
    }

    public MessageHandoff handoff()
    {
        return handoff;
    }

    private void run()
    {
        emit(InputObservabilityEvent.Type.STARTED, null);
        try {
            pump();
            handoff.close();
        }
        catch (InterruptedException e) {
            emit(InputObservabilityEvent.Type.INTERRUPTED, null);
        }
    }

    private void pump() throws InterruptedException
    {
        final byte[] buffer = new byte[chunkSize];
        while (true) {
            final int n;
            try {
                n = source.read(buffer);
            }
            catch (IOException e) {
                emit(InputObservabilityEvent.Type.READ_FAILED, e);
                return;
            }

            if (n < 0) {
                emit(InputObservabilityEvent.Type.END_OF_INPUT, null);
                return;
            }
            if (n == 0) {
                continue;
            }

            handoff.put(messageFactory.fromChunk(buffer, n));
        }
    }

    private void emit(InputObservabilityEvent.Type type, Throwable cause)
    {
        observabilitySink.onInputEvent(new InputObservabilityEvent(clock.now(), type, cause));
    }
}
