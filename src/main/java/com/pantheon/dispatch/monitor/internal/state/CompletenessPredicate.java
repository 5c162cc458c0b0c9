package com.pantheon.dispatch.monitor.internal.state;

import com.pantheon.dispatch.api.ShipmentManifest;

import java.util.Set;

/**
 * Decides whether the tags read so far are exactly the shipment described by a
 * manifest: nothing missing and nothing extra.
 */
@FunctionalInterface
public interface CompletenessPredicate
{
    boolean isComplete(ShipmentManifest manifest, Set<String> tagsRead);
}
