package com.questrail.repomon.input;

import com.questrail.repomon.model.Message;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.SynchronousQueue;

/**
 * MessageHandoff
 * =============================================================================
 * Zero-capacity rendezvous between the console input thread (single producer)
 * and a transport's outbound forwarder (single consumer).
 *
 * <p>{@link #put(Message)} returns only once the consumer has taken the
 * message. A slow outbound path therefore stalls the input thread instead of
 * letting messages pile up in memory.</p>
 *
 * <p>End of input is signalled in-band with {@link #close()}, which itself
 * blocks until the consumer observes it.</p>
 */
public final class MessageHandoff
{
    private static final Object END = new Object();

    private final SynchronousQueue<Object> queue = new SynchronousQueue<>();
    private volatile boolean closed;
    private volatile boolean drained;

    /**
     * Hand a message to the consumer, blocking until it is taken.
     *
     * @throws IllegalStateException if the handoff has been closed
     */
    public void put(Message message) throws InterruptedException
    {
        Objects.requireNonNull(message, "message");
        if (closed) {
            throw new IllegalStateException("MessageHandoff is closed");
        }
        queue.put(message);
    }

    /**
     * Signal end of input, blocking until the consumer observes it.
     * Idempotent.
     */
    public void close() throws InterruptedException
    {
        if (closed) {
            return;
        }
        closed = true;
        queue.put(END);
    }

    /**
     * Take the next message, blocking until one is handed over.
     *
     * @return the message, or {@link Optional#empty()} once the producer has closed
     */
    public Optional<Message> take() throws InterruptedException
    {
        if (drained) {
            return Optional.empty();
        }
        Object next = queue.take();
        if (next == END) {
            drained = true;
            return Optional.empty();
        }
        return Optional.of((Message) next);
    }

    public boolean isClosed()
    {
        return closed;
    }
}
