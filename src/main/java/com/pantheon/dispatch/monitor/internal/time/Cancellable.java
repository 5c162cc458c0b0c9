package com.pantheon.dispatch.monitor.internal.time;

/**
 * Cancellation handle for a scheduled task.
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         already ran or was cancelled before.
     */
    boolean cancel();
}
