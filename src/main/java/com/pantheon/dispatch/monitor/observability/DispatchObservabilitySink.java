package com.pantheon.dispatch.monitor.observability;

/**
 * Receives observability events from the dispatch monitor.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks run on the monitor's event loop and must return quickly.</p>
 */
public interface DispatchObservabilitySink {
    /**
     * Called after every applied event, whether or not anything changed.
     */
    void onStateTransition(DispatchStateTransitionEvent event);

    /**
     * Called when a decision hit an illegal or unhandled transition.
     */
    void onAnomaly(DispatchAnomalyEvent event);

    /**
     * Called when a submitted manifest is refused.
     */
    void onManifestRejected(ManifestRejectedEvent event);

    /**
     * Called when event processing fails unexpectedly.
     */
    void onError(DispatchErrorEvent event);
}
