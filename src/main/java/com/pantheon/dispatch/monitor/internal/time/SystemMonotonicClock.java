package com.pantheon.dispatch.monitor.internal.time;

/**
 * {@link MonotonicClock} backed by {@link System#nanoTime()}.
 */
public enum SystemMonotonicClock implements MonotonicClock {
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
