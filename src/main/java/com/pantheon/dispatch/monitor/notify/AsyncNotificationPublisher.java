package com.pantheon.dispatch.monitor.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * AsyncNotificationPublisher
 * =============================================================================
 * Hands notifications to a delegate on a dedicated background thread.
 *
 * <p>{@link #publish} only enqueues, so the monitor's event loop never waits on
 * an SMS gateway or mail server. Deliveries happen in submission order. A
 * failed delivery is logged and dropped; the monitor has already moved on.</p>
 *
 * <p>{@link #close()} delivers what is already queued, waiting up to the
 * configured time, then abandons the rest.</p>
 */
public final class AsyncNotificationPublisher implements NotificationPublisher, AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(AsyncNotificationPublisher.class);

    private static final long DEFAULT_SHUTDOWN_WAIT_MS = 5_000;

    private final NotificationPublisher delegate;
    private final ExecutorService executor;
    private final long shutdownWaitMs;

    public AsyncNotificationPublisher(NotificationPublisher delegate) {
        this(delegate, DEFAULT_SHUTDOWN_WAIT_MS);
    }

    public AsyncNotificationPublisher(NotificationPublisher delegate, long shutdownWaitMs) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.shutdownWaitMs = shutdownWaitMs;
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "dispatch-notifications");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public void publish(DispatchNotification notification) {
        Objects.requireNonNull(notification, "notification");
        try {
            executor.execute(() -> deliver(notification));
        } catch (RejectedExecutionException e) {
            log.warn("Notification publisher closed; dropping {} notification", notification.kind());
        }
    }

    private void deliver(DispatchNotification notification) {
        try {
            delegate.publish(notification);
        } catch (RuntimeException e) {
            log.error("Failed to deliver {} notification", notification.kind(), e);
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownWaitMs, TimeUnit.MILLISECONDS)) {
                List<Runnable> unfinished = executor.shutdownNow();
                log.warn("Notification publisher stopped with {} undelivered notifications", unfinished.size());
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
