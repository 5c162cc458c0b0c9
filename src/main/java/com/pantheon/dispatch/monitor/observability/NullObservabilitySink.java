package com.pantheon.dispatch.monitor.observability;

/**
 * No-op implementation of DispatchObservabilitySink.
 */
public final class NullObservabilitySink implements DispatchObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(DispatchStateTransitionEvent event) {}

    @Override
    public void onAnomaly(DispatchAnomalyEvent event) {}

    @Override
    public void onManifestRejected(ManifestRejectedEvent event) {}

    @Override
    public void onError(DispatchErrorEvent event) {}
}
