package com.pantheon.dispatch.monitor.internal.exec;

import com.pantheon.dispatch.monitor.internal.events.DispatchEvent;
import com.pantheon.dispatch.monitor.internal.events.TickEvent;
import com.pantheon.dispatch.monitor.internal.time.FixedRateTicker;
import com.pantheon.dispatch.monitor.internal.time.MonotonicClock;
import com.pantheon.dispatch.monitor.internal.time.MonotonicScheduler;
import com.pantheon.dispatch.monitor.internal.time.WallClock;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * CountdownTicker
 * =============================================================================
 * Ticking source of the departure countdown.
 *
 * <p>While running, posts one {@link TickEvent.CountdownTick} per period into the
 * monitor's event queue. It never touches the countdown value itself; the
 * decrement is applied by the reducer together with every other update.</p>
 */
public final class CountdownTicker
{
    private final Consumer<DispatchEvent> eventSink;
    private final WallClock wallClock;
    private final FixedRateTicker ticker;

    private volatile long generation;

    public CountdownTicker(Consumer<DispatchEvent> eventSink,
                           MonotonicScheduler scheduler,
                           MonotonicClock clock,
                           WallClock wallClock,
                           Duration period)
    {
        this.eventSink = Objects.requireNonNull(eventSink, "eventSink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.ticker = new FixedRateTicker(scheduler, clock, period, this::tick);
    }

    /**
     * Starts ticking for the countdown run {@code generation}, replacing any
     * earlier run.
     */
    public void start(long generation)
    {
        this.generation = generation;
        ticker.start();
    }

    public void stop()
    {
        ticker.stop();
    }

    public boolean isRunning()
    {
        return ticker.isRunning();
    }

    private void tick()
    {
        eventSink.accept(new TickEvent.CountdownTick(wallClock.now(), generation));
    }
}
