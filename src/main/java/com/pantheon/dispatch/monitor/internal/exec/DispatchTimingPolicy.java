package com.pantheon.dispatch.monitor.internal.exec;

import java.time.Duration;
import java.util.Objects;

/**
 * DispatchTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational timing of the dispatch monitor.
 *
 * <ul>
 *   <li><b>decisionPeriod</b>: how often the status is evaluated and acted on.</li>
 *   <li><b>countdownPeriod</b>: time represented by one departure countdown tick.</li>
 *   <li><b>departureWindow</b>: how long a truck has, from manifest installation,
 *       to leave the bay with the complete shipment.</li>
 * </ul>
 */
public record DispatchTimingPolicy(
        Duration decisionPeriod,
        Duration countdownPeriod,
        Duration departureWindow
) {
    public DispatchTimingPolicy {
        Objects.requireNonNull(decisionPeriod, "decisionPeriod");
        Objects.requireNonNull(countdownPeriod, "countdownPeriod");
        Objects.requireNonNull(departureWindow, "departureWindow");

        if (decisionPeriod.isZero() || decisionPeriod.isNegative()) {
            throw new IllegalArgumentException("decisionPeriod must be positive");
        }
        if (countdownPeriod.isZero() || countdownPeriod.isNegative()) {
            throw new IllegalArgumentException("countdownPeriod must be positive");
        }
        if (departureWindow.compareTo(countdownPeriod) < 0) {
            throw new IllegalArgumentException("departureWindow must be at least one countdownPeriod");
        }
    }

    /**
     * Starting value of the departure countdown, in ticks.
     */
    public long startingCountdown() {
        return departureWindow.toNanos() / countdownPeriod.toNanos();
    }

    /**
     * Defaults for a dispatch bay:
     * <ul>
     *   <li>decisionPeriod: 1 s</li>
     *   <li>countdownPeriod: 1 s</li>
     *   <li>departureWindow: 10 min</li>
     * </ul>
     */
    public static DispatchTimingPolicy defaults() {
        return new DispatchTimingPolicy(
                Duration.ofSeconds(1),
                Duration.ofSeconds(1),
                Duration.ofMinutes(10)
        );
    }
}
