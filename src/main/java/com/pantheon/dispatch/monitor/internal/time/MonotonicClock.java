package com.pantheon.dispatch.monitor.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every operational period in the monitor: the decision loop
 * cadence and the departure countdown ticks.
 *
 * <p>Wall-clock time ({@code Instant.now()}) is used only for timestamps on
 * events, notifications and status. A clock adjustment on the dispatch bay PC
 * must never shorten or stretch a departure window.</p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Only the
     * difference between two readings is meaningful.
     */
    long nowNanos();
}
