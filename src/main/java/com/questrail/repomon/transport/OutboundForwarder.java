package com.questrail.repomon.transport;

import com.questrail.repomon.codec.WireCodec;
import com.questrail.repomon.input.MessageHandoff;
import com.questrail.repomon.model.Message;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * OutboundForwarder
 * -----------------------------------------------------------------------------
 * Drains a {@link MessageHandoff} into a transport, one frame at a time.
 *
 * <p>The forwarder runs on its own thread because taking from the handoff
 * blocks; the network event loop must never block. Each frame write is
 * awaited before the next message is taken, so a stalled socket stalls the
 * handoff, which stalls the console reader.</p>
 *
 * <p>Zero-length frames (encode failures) are skipped.</p>
 */
final class OutboundForwarder
{
    private final MessageHandoff handoff;
    private final WireCodec codec;
    private final Function<byte[], CompletableFuture<Void>> frameWriter;
    private final Consumer<Throwable> onWriteFailure;
    private final Runnable onDrained;

    private volatile Thread thread;

    OutboundForwarder(MessageHandoff handoff,
                      WireCodec codec,
                      Function<byte[], CompletableFuture<Void>> frameWriter,
                      Consumer<Throwable> onWriteFailure,
                      Runnable onDrained)
    {
        this.handoff = Objects.requireNonNull(handoff, "handoff");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.frameWriter = Objects.requireNonNull(frameWriter, "frameWriter");
        this.onWriteFailure = Objects.requireNonNull(onWriteFailure, "onWriteFailure");
        this.onDrained = Objects.requireNonNull(onDrained, "onDrained");
    }

    void start()
    {
        Thread t = new Thread(this::run, "repomon-forwarder");
        t.setDaemon(true);
        thread = t;
        t.start();
    }

    void stop()
    {
        Thread t = thread;
        if (t != null && t != Thread.currentThread()) {
            t.interrupt();
        }
    }

    private void run()
    {
        try {
            while (true) {
                Optional<Message> next = handoff.take();
                if (next.isEmpty()) {
                    onDrained.run();
                    return;
                }

                byte[] frame = codec.encode(next.get());
                if (frame.length == 0) {
                    continue;
                }

                try {
                    frameWriter.apply(frame).get();
                }
                catch (ExecutionException e) {
                    onWriteFailure.accept(e.getCause() != null ? e.getCause() : e);
                    return;
                }
            }
        }
        catch (InterruptedException e) {
            // Session shutdown.
            Thread.currentThread().interrupt();
        }
    }
}
