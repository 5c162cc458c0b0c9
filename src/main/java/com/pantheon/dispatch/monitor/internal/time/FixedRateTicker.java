package com.pantheon.dispatch.monitor.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * FixedRateTicker
 * =============================================================================
 * Runs a task once per period on a {@link MonotonicScheduler} until stopped.
 *
 * <p>Deadlines advance by exactly one period from the previous deadline, not
 * from the time the task finished, so a slow task does not make the ticker
 * drift. The first tick fires one period after {@link #start()}.</p>
 *
 * <p>Each start begins a new run. A tick belonging to a run that has since been
 * stopped or restarted does nothing, even if the scheduler fails to cancel it.</p>
 *
 * <h2>Thread safety</h2>
 * {@link #start()} and {@link #stop()} may be called from any thread.
 */
public final class FixedRateTicker
{
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final long periodNanos;
    private final Runnable task;

    private long run;
    private boolean running;
    private Cancellable pending;

    public FixedRateTicker(MonotonicScheduler scheduler,
                           MonotonicClock clock,
                           Duration period,
                           Runnable task)
    {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.task = Objects.requireNonNull(task, "task");

        Objects.requireNonNull(period, "period");
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be positive");
        }
        this.periodNanos = period.toNanos();
    }

    /**
     * Starts (or restarts) ticking. A restart discards the previous run.
     */
    public synchronized void start()
    {
        cancelPending();
        run++;
        running = true;
        scheduleNext(run, clock.nowNanos() + periodNanos);
    }

    /**
     * Stops ticking. Idempotent.
     */
    public synchronized void stop()
    {
        running = false;
        cancelPending();
    }

    public synchronized boolean isRunning()
    {
        return running;
    }

    private void scheduleNext(long runId, long deadlineNanos)
    {
        pending = scheduler.scheduleAtNanos(deadlineNanos, () -> fire(runId, deadlineNanos));
    }

    private void fire(long runId, long deadlineNanos)
    {
        synchronized (this) {
            if (!running || runId != run) {
                return;
            }
            scheduleNext(runId, deadlineNanos + periodNanos);
        }
        task.run();
    }

    private void cancelPending()
    {
        if (pending != null) {
            pending.cancel();
            pending = null;
        }
    }
}
