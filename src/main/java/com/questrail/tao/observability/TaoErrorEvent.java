package com.questrail.tao.observability;

import java.time.Instant;

/**
 * Record representing a failure observed while talking to the engine.
 */
public record TaoErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
