package com.questrail.repomon.codec;

/**
 * What the inbound path yields when a received frame cannot be decoded.
 *
 * <p>The failure is reported to the observability sink in both cases.</p>
 */
public enum DecodeFailurePolicy
{
    /** Yield no message. */
    DROP,

    /** Yield {@link com.questrail.repomon.model.Message#placeholder()} in place of the frame. */
    SUBSTITUTE_PLACEHOLDER
}
