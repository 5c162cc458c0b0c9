package com.pantheon.dispatch.monitor.internal.events;

import com.pantheon.dispatch.api.ShipmentManifest;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * ManifestEvent
 * -----------------------------------------------------------------------------
 * Events originating from the manifest intake boundary.
 */
public sealed interface ManifestEvent extends DispatchEvent
        permits ManifestEvent.ManifestSubmitted
{
    /**
     * A shipment manifest was offered for the next dispatch cycle.
     *
     * <p>The precondition check and the installation happen together when the
     * event is applied, so no other event can slip in between them. The outcome
     * is reported through {@link #reply()}, which the controller completes after
     * the event has been applied.</p>
     */
    final class ManifestSubmitted extends DispatchEvent.Base implements ManifestEvent {
        private final ShipmentManifest manifest;
        private final CompletableFuture<Void> reply;

        public ManifestSubmitted(Instant timestamp, ShipmentManifest manifest) {
            super(timestamp);
            this.manifest = Objects.requireNonNull(manifest, "manifest");
            this.reply = new CompletableFuture<>();
        }

        public ShipmentManifest manifest() {
            return manifest;
        }

        public CompletableFuture<Void> reply() {
            return reply;
        }
    }
}
