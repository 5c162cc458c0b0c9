package com.pantheon.dispatch.monitor.observability;

import java.time.Instant;

/**
 * An unexpected failure inside the monitor.
 */
public record DispatchErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
