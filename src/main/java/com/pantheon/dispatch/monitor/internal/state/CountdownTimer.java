package com.pantheon.dispatch.monitor.internal.state;

import java.time.Duration;
import java.util.Objects;

/**
 * CountdownTimer
 * -----------------------------------------------------------------------------
 * Immutable value of the departure countdown.
 *
 * <p>The timer simply counts down from {@code startingValue} once per
 * {@code period} while running. It is up to an observer to act when the value
 * reaches zero; by itself the timer keeps counting below zero.</p>
 *
 * <p>The ticking itself is not part of this value. A ticker outside the state
 * posts one tick event per period, and the reducer applies
 * {@link #decrement()} to the current value. {@code generation} identifies
 * the run a tick belongs to and changes on every {@link #start()}.</p>
 *
 * @param startingValue value the countdown is (re)armed to
 * @param currentValue  value remaining; never above {@code startingValue}
 * @param period        time between two decrements
 * @param running       whether ticks are currently applied
 * @param generation    identifier of the current run
 */
public record CountdownTimer(long startingValue,
                             long currentValue,
                             Duration period,
                             boolean running,
                             long generation)
{
    public CountdownTimer {
        Objects.requireNonNull(period, "period");
        if (startingValue <= 0) {
            throw new IllegalArgumentException("startingValue must be positive");
        }
        if (currentValue > startingValue) {
            throw new IllegalArgumentException("currentValue must not exceed startingValue");
        }
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be positive");
        }
    }

    /**
     * Returns a stopped timer armed at {@code startingValue}.
     */
    public static CountdownTimer stopped(long startingValue, Duration period) {
        return new CountdownTimer(startingValue, startingValue, period, false, 0L);
    }

    /**
     * Rearms the countdown and starts a new run.
     */
    public CountdownTimer start() {
        return new CountdownTimer(startingValue, startingValue, period, true, generation + 1);
    }

    /**
     * Stops the countdown and restores the starting value.
     */
    public CountdownTimer reset() {
        return new CountdownTimer(startingValue, startingValue, period, false, generation);
    }

    /**
     * Applies one elapsed period. No floor: negative values mean "timed out".
     */
    public CountdownTimer decrement() {
        return new CountdownTimer(startingValue, currentValue - 1, period, running, generation);
    }

    /**
     * Whether a tick of the given run should be applied to this timer.
     */
    public boolean accepts(long tickGeneration) {
        return running && tickGeneration == generation;
    }

    public boolean isExpired() {
        return currentValue <= 0;
    }
}
