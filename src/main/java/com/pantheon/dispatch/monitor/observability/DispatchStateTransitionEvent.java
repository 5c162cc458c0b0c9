package com.pantheon.dispatch.monitor.observability;

import com.pantheon.dispatch.monitor.internal.events.DispatchEvent;
import com.pantheon.dispatch.monitor.internal.state.DispatchIntents;
import com.pantheon.dispatch.monitor.internal.state.MonitorState;

import java.time.Instant;

/**
 * One event applied to the monitor state.
 */
public record DispatchStateTransitionEvent(
    Instant timestamp,
    MonitorState oldState,
    MonitorState newState,
    DispatchEvent triggeringEvent,
    DispatchIntents resultingIntents
) {
    /**
     * Checks if the committed system state changed.
     */
    public boolean isSystemStateChange() {
        return oldState.systemState() != newState.systemState();
    }

    /**
     * Checks if a manifest was installed or removed.
     */
    public boolean isCycleChange() {
        return oldState.hasManifest() != newState.hasManifest();
    }
}
