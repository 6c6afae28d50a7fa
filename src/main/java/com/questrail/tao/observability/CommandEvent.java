package com.questrail.tao.observability;

import java.time.Instant;

/**
 * Record representing one command handed to the engine.
 */
public record CommandEvent(
    Instant timestamp,
    Mode mode,
    String command
) {
    public enum Mode {
        /** Fire-and-forget command. */
        COMMAND,
        /** Command whose printed output is captured. */
        CAPTURE
    }
}
