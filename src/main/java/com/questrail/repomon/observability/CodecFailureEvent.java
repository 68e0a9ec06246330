package com.questrail.repomon.observability;

import java.time.Instant;

/**
 * Record representing a frame that could not be encoded or decoded.
 *
 * <p>Codec failures are never terminal. The affected message is dropped (or
 * substituted, depending on policy) and the session continues.</p>
 */
public record CodecFailureEvent(
    Instant timestamp,
    Direction direction,
    String message,
    Throwable cause
) {
    public enum Direction {
        /** Received bytes could not be decoded. */
        INBOUND,
        /** A message could not be encoded; nothing was written for it. */
        OUTBOUND
    }
}
