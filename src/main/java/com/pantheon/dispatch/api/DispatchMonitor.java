package com.pantheon.dispatch.api;

import java.util.concurrent.CompletableFuture;

/**
 * DispatchMonitor
 * -----------------------------------------------------------------------------
 * Semantic facade of the dispatch bay monitor.
 *
 * <p>This is the boundary used by request handlers and dashboards. It exposes
 * intent (install a manifest) and observation (status), and nothing of the
 * event loop, timers or reader plumbing underneath.</p>
 *
 * <h2>Threading</h2>
 * Both operations may be called from any thread. Neither blocks on the monitor's
 * event loop: intake only enqueues, and status reads the last published state
 * value.
 */
public interface DispatchMonitor
{
    /**
     * Offers a manifest for the next dispatch cycle.
     *
     * <p>The returned future completes normally once the manifest is installed and
     * the departure countdown armed. It completes exceptionally with
     * {@link PreconditionViolationException} when the reader is inactive, a cycle is
     * already active, or the previous cycle has not been reset yet.</p>
     *
     * @param manifest the shipment manifest (must not be {@code null})
     * @return completion of the intake
     */
    CompletableFuture<Void> installManifest(ShipmentManifest manifest);

    /**
     * Returns the current status snapshot.
     */
    MonitorStatus getStatus();
}
