package com.pantheon.dispatch.monitor.time;

import com.pantheon.dispatch.monitor.internal.time.Cancellable;
import com.pantheon.dispatch.monitor.internal.time.MonotonicClock;
import com.pantheon.dispatch.monitor.internal.time.MonotonicScheduler;

import java.util.PriorityQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Deterministic scheduler driven by a ManualMonotonicClock.
 *
 * Tasks execute ONLY when {@link #runDueTasks()} is called.
 */
public final class DeterministicScheduler implements MonotonicScheduler {

    private final MonotonicClock clock;
    private final PriorityQueue<Scheduled> queue = new PriorityQueue<>();
    private long sequence;

    public DeterministicScheduler(MonotonicClock clock) {
        this.clock = clock;
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Scheduled scheduled = new Scheduled(deadlineNanos, sequence++, task);
        queue.add(scheduled);
        return scheduled;
    }

    /**
     * Run all tasks whose deadlines are <= current clock time, including tasks
     * those tasks schedule for deadlines that are already due.
     */
    public void runDueTasks() {
        while (!queue.isEmpty() && queue.peek().deadlineNanos <= clock.nowNanos()) {
            Scheduled next = queue.poll();
            if (!next.cancelled.get()) {
                next.task.run();
            }
        }
    }

    /**
     * Number of scheduled tasks that have not been cancelled.
     */
    public long pendingTaskCount() {
        return queue.stream().filter(s -> !s.cancelled.get()).count();
    }

    private static final class Scheduled implements Comparable<Scheduled>, Cancellable {
        private final long deadlineNanos;
        private final long order;
        private final Runnable task;
        private final AtomicBoolean cancelled = new AtomicBoolean(false);

        private Scheduled(long deadlineNanos, long order, Runnable task) {
            this.deadlineNanos = deadlineNanos;
            this.order = order;
            this.task = task;
        }

        @Override
        public boolean cancel() {
            return cancelled.compareAndSet(false, true);
        }

        @Override
        public int compareTo(Scheduled o) {
            int byDeadline = Long.compare(this.deadlineNanos, o.deadlineNanos);
            return byDeadline != 0 ? byDeadline : Long.compare(this.order, o.order);
        }
    }
}
