package com.pantheon.dispatch.api;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only view of the dispatch monitor, taken from a single consistent state
 * value. Intended for display and supervision.
 *
 * @param state              the committed system state
 * @param manifest           the active manifest, if a cycle is in progress
 * @param tagsRead           tag identifiers observed in the current cycle
 * @param departureCountdown current value of the departure countdown, in ticks
 * @param countdownRunning   whether the countdown is currently ticking
 * @param lastTransition     wall-clock time the system state last changed
 */
public record MonitorStatus(SystemState state,
                            Optional<ShipmentManifest> manifest,
                            Set<String> tagsRead,
                            long departureCountdown,
                            boolean countdownRunning,
                            Instant lastTransition)
{
    public MonitorStatus {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(manifest, "manifest");
        tagsRead = Set.copyOf(tagsRead);
        Objects.requireNonNull(lastTransition, "lastTransition");
    }
}
