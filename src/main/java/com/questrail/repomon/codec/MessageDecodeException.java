package com.questrail.repomon.codec;

/**
 * Indicates that received bytes could not be translated into a message.
 *
 * This typically reflects:
 * <ul>
 *   <li>A buffer shorter than the fixed header</li>
 *   <li>An unassigned category tag</li>
 *   <li>A declared text length that does not match the remaining bytes</li>
 *   <li>Text that is not valid UTF-8</li>
 * </ul>
 */
public final class MessageDecodeException extends RuntimeException
{
    public MessageDecodeException(String message) {
        super(message);
    }

    public MessageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
