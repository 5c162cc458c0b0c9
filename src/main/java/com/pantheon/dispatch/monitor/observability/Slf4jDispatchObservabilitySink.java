package com.pantheon.dispatch.monitor.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of DispatchObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jDispatchObservabilitySink implements DispatchObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jDispatchObservabilitySink.class);

    @Override
    public void onStateTransition(DispatchStateTransitionEvent event) {
        if (event.isSystemStateChange()) {
            log.info("Dispatch state: {} -> {}",
                event.oldState().systemState(),
                event.newState().systemState());
        }

        if (event.isCycleChange()) {
            event.newState().manifest().ifPresentOrElse(
                m -> log.info("Shipment {} installed, {} items expected, countdown {}",
                    m.shipmentId(), m.expectedItemCount(), event.newState().departureTimer().currentValue()),
                () -> log.info("Dispatch cycle cleared"));
        }

        if (!event.resultingIntents().isEmpty()) {
            log.debug("Intents {} after {}", event.resultingIntents(), event.triggeringEvent().getClass().getSimpleName());
        }
    }

    @Override
    public void onAnomaly(DispatchAnomalyEvent event) {
        switch (event.anomaly().kind()) {
            case ILLEGAL_TRANSITION -> log.warn("Illegal transition {} -> {}; hard reset from {}",
                event.anomaly().from(), event.anomaly().to(), event.snapshot());
            case UNHANDLED_TRANSITION -> log.info("No action implemented for state change {} -> {}",
                event.anomaly().from(), event.anomaly().to());
        }
    }

    @Override
    public void onManifestRejected(ManifestRejectedEvent event) {
        log.warn("Manifest {} rejected ({}): {}",
            event.shipmentId(), event.violation().reason(), event.violation().getMessage());
    }

    @Override
    public void onError(DispatchErrorEvent event) {
        log.error("Dispatch monitor error: {}", event.message(), event.cause());
    }
}
