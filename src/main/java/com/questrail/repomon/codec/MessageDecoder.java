package com.questrail.repomon.codec;

import com.questrail.repomon.model.Message;

import java.util.Optional;

/**
 * MessageDecoder
 * -----------------------------------------------------------------------------
 * Inbound half of the wire codec.
 *
 * <p>The decoder is invoked with exactly one transport read (a stream read or
 * a datagram payload) and must treat the whole buffer as one frame. There is
 * no length prefix spanning reads, no delimiter and no accumulation across
 * calls.</p>
 */
public interface MessageDecoder
{
    /**
     * Decode one frame.
     *
     * @param frame the complete bytes of one transport read
     * @return the decoded message, or {@link Optional#empty()} for an empty buffer
     * @throws MessageDecodeException if the bytes are not a well-formed frame
     */
    Optional<Message> decode(byte[] frame);
}
