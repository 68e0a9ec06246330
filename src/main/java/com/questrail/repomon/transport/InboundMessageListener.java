package com.questrail.repomon.transport;

import com.questrail.repomon.error.BridgeException;
import com.questrail.repomon.model.Message;

/**
 * Consumer of a transport's inbound message sequence.
 *
 * <p>Calls are serialized and arrive in receive order. After
 * {@link #onInboundEnd(BridgeException)} no further calls are made.</p>
 */
public interface InboundMessageListener
{
    void onMessage(Message message);

    /**
     * The inbound sequence has ended. Called exactly once per opened transport.
     *
     * @param failure the terminal error, or {@code null} if the sequence ended cleanly
     */
    void onInboundEnd(BridgeException failure);
}
