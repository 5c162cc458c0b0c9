package com.pantheon.dispatch.monitor.internal.events;

import java.time.Instant;

/**
 * TickEvent
 * -----------------------------------------------------------------------------
 * Periodic events injected by the scheduling layer.
 *
 * <p>Ticks travel through the same queue as intake and tag reads so that a
 * countdown decrement or a decision never interleaves with another update.</p>
 */
public sealed interface TickEvent extends DispatchEvent
        permits TickEvent.CountdownTick, TickEvent.DecisionTick
{
    /**
     * One period of the departure countdown elapsed.
     *
     * <p>Carries the generation of the countdown run that produced it. The
     * reducer ignores ticks from any run other than the current one.</p>
     */
    final class CountdownTick extends DispatchEvent.Base implements TickEvent {
        private final long generation;

        public CountdownTick(Instant timestamp, long generation) {
            super(timestamp);
            this.generation = generation;
        }

        public long generation() {
            return generation;
        }
    }

    /**
     * Time to evaluate the shipment status and act on it.
     */
    final class DecisionTick extends DispatchEvent.Base implements TickEvent {
        public DecisionTick(Instant timestamp) {
            super(timestamp);
        }
    }
}
