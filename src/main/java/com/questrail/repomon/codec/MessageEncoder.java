package com.questrail.repomon.codec;

import com.questrail.repomon.model.Message;

/**
 * MessageEncoder
 * -----------------------------------------------------------------------------
 * Outbound half of the wire codec: one {@link Message} to one frame.
 *
 * <p>Implementations are pure. The same message always encodes to the same
 * bytes, and no state is carried between calls.</p>
 */
public interface MessageEncoder
{
    /**
     * Encode a message into a complete frame, ready to be written as a single
     * stream write or a single datagram.
     *
     * @throws MessageEncodeException if the message has no wire representation
     */
    byte[] encode(Message message);
}
