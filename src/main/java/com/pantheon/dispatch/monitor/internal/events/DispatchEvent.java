package com.pantheon.dispatch.monitor.internal.events;

import java.time.Instant;
import java.util.Objects;

/**
 * DispatchEvent
 * -----------------------------------------------------------------------------
 * Marker interface for everything that can change the dispatch monitor state.
 *
 * <h2>Role in the architecture</h2>
 * The monitor has several independent producers: manifest intake from the
 * request boundary, tag reads from the reader driver, the departure countdown,
 * and the periodic decision loop. None of them touches state directly. Each one
 * hands its effect over as an event, and events are applied strictly one at a
 * time by the owning controller.
 *
 * <p>Events are immutable and carry only what is needed to advance state. The
 * timestamp is wall-clock and observational only.</p>
 */
public interface DispatchEvent
{
    /**
     * Time at which the event was generated.
     */
    Instant timestamp();

    /**
     * Convenience base class for simple events.
     */
    abstract class Base implements DispatchEvent {
        private final Instant timestamp;

        protected Base(Instant timestamp) {
            this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        }

        @Override
        public Instant timestamp() {
            return timestamp;
        }
    }
}
