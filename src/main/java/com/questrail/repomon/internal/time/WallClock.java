package com.questrail.repomon.internal.time;

import java.time.Instant;

/**
 * Supplies the {@code timestamp} of every observability event the bridge
 * emits.
 *
 * <p>Production code uses {@link SystemWallClock}; tests pass a lambda that
 * returns a fixed instant so that recorded events compare equal. Forwarding
 * never reads the clock, so a clock that steps backwards only skews event
 * timestamps.</p>
 */
@FunctionalInterface
public interface WallClock
{
    Instant now();
}
