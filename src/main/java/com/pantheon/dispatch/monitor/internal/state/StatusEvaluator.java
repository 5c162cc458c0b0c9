package com.pantheon.dispatch.monitor.internal.state;

import com.pantheon.dispatch.api.ShipmentManifest;
import com.pantheon.dispatch.api.SystemState;

import java.util.Objects;

/**
 * StatusEvaluator
 * -----------------------------------------------------------------------------
 * Computes which {@link SystemState} the monitor's data currently describes.
 *
 * <p>The evaluator looks only at the manifest, the tags read and the departure
 * countdown of one snapshot. It ignores the committed state; deciding whether
 * the computed state is reachable is the reducer's job.</p>
 *
 * <pre>
 *   no manifest, no tags                 → IDLE
 *   no manifest, tags read               → EXTRA_TAGS
 *   manifest, countdown expired          → MISSING_TAGS  (even if complete)
 *   manifest, tags exactly match         → SHIPMENT_COMPLETE
 *   manifest, otherwise                  → TRUCK_DEPARTING
 * </pre>
 */
public final class StatusEvaluator
{
    private final CompletenessPredicate completeness;

    public StatusEvaluator(CompletenessPredicate completeness) {
        this.completeness = Objects.requireNonNull(completeness, "completeness");
    }

    public SystemState evaluate(MonitorState snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");

        if (!snapshot.hasManifest()) {
            return snapshot.tagsRead().isEmpty()
                    ? SystemState.IDLE
                    : SystemState.EXTRA_TAGS;
        }

        if (snapshot.departureTimer().isExpired()) {
            return SystemState.MISSING_TAGS;
        }

        ShipmentManifest manifest = snapshot.manifest().orElseThrow();
        return completeness.isComplete(manifest, snapshot.tagsRead())
                ? SystemState.SHIPMENT_COMPLETE
                : SystemState.TRUCK_DEPARTING;
    }
}
