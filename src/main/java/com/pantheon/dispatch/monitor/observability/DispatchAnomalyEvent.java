package com.pantheon.dispatch.monitor.observability;

import com.pantheon.dispatch.monitor.internal.state.MonitorState;
import com.pantheon.dispatch.monitor.internal.state.TransitionAnomaly;

import java.time.Instant;

/**
 * A decision that did not follow the declared state machine.
 *
 * @param snapshot the state the decision was made on, before any recovery
 */
public record DispatchAnomalyEvent(
    Instant timestamp,
    TransitionAnomaly anomaly,
    MonitorState snapshot
) {
}
