package com.questrail.repomon.observability;

import java.time.Instant;

/**
 * Record representing a terminal failure of a bridge session.
 */
public record BridgeErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
