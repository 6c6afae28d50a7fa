package com.questrail.tao.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source for command log entries and observability events.
 *
 * <p>
 * This clock may jump due to DST, NTP adjustments, or explicit time setting.
 * Its values are for human-readable timestamps only.
 * </p>
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
