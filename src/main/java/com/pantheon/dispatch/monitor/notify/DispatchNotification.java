package com.pantheon.dispatch.monitor.notify;

import com.pantheon.dispatch.api.ShipmentManifest;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Outbound message about the outcome of a dispatch cycle.
 *
 * @param kind      what happened
 * @param timestamp when the monitor decided it
 * @param manifest  manifest of the cycle; empty for {@link Kind#EXTRA_TAGS}, which is
 *                  only decided for a departing truck whose manifest is gone
 * @param tagsRead  tags observed when the decision was made
 */
public record DispatchNotification(Kind kind,
                                   Instant timestamp,
                                   Optional<ShipmentManifest> manifest,
                                   Set<String> tagsRead)
{
    public enum Kind {
        MISSING_TAGS,
        EXTRA_TAGS,
        SHIPMENT_COMPLETE
    }

    public DispatchNotification {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(manifest, "manifest");
        tagsRead = Set.copyOf(tagsRead);
    }
}
