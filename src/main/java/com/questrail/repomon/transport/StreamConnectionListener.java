package com.questrail.repomon.transport;

/**
 * Callback sink for {@link StreamConnection}.
 *
 * <p>Callbacks are serialized; Netty connections deliver them on the
 * channel's event loop, in read order.</p>
 */
public interface StreamConnectionListener
{
    /**
     * The connection is established and writable.
     */
    void onConnected();

    /**
     * One read's worth of bytes arrived. The array is owned by the listener.
     */
    void onBytes(byte[] bytes);

    /**
     * The connection attempt failed or the connection ended. Called at most once.
     *
     * @param cause connect or I/O failure; {@code null} when the peer closed
     *              the connection or {@link StreamConnection#close()} was called
     */
    void onDisconnected(Throwable cause);
}
