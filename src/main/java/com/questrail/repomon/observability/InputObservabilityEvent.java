package com.questrail.repomon.observability;

import java.time.Instant;

/**
 * Record representing a lifecycle change of the console input reader.
 *
 * @param cause the read failure for {@link Type#READ_FAILED}; {@code null} otherwise
 */
public record InputObservabilityEvent(
    Instant timestamp,
    Type type,
    Throwable cause
) {
    public enum Type {
        STARTED,
        END_OF_INPUT,
        READ_FAILED,
        INTERRUPTED
    }
}
