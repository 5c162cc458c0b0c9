package com.pantheon.dispatch.monitor.observability;

import com.pantheon.dispatch.api.PreconditionViolationException;

import java.time.Instant;

/**
 * A manifest offered to the monitor was refused.
 */
public record ManifestRejectedEvent(
    Instant timestamp,
    String shipmentId,
    PreconditionViolationException violation
) {
}
