package com.questrail.repomon.codec;

/**
 * A {@link com.questrail.repomon.model.Message} could not be turned into a frame.
 */
public final class MessageEncodeException extends RuntimeException
{
    public MessageEncodeException(String message) {
        super(message);
    }

    public MessageEncodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
