package com.questrail.repomon.transport;

import java.util.concurrent.CompletableFuture;

/**
 * StreamConnection
 * -----------------------------------------------------------------------------
 * Minimal port for a connection-oriented byte transport (TCP-style) to one
 * fixed remote address.
 *
 * <p>Like {@link DatagramEndpoint}, implementations perform I/O only. They do
 * not decode or interpret bytes; each read is delivered as-is.</p>
 */
public interface StreamConnection
{
    /**
     * Initiate the connection.
     *
     * <p>Success is reported via {@link StreamConnectionListener#onConnected()},
     * failure via {@link StreamConnectionListener#onDisconnected(Throwable)}.</p>
     */
    void connect();

    /**
     * Close the connection and release all transport resources.
     */
    void close();

    /**
     * Write one frame.
     *
     * @return completes when the bytes have been flushed to the socket, or
     *         exceptionally if the write failed
     */
    CompletableFuture<Void> write(byte[] frame);

    /**
     * Register the listener. This must be called before {@link #connect()}.
     */
    void setListener(StreamConnectionListener listener);
}
