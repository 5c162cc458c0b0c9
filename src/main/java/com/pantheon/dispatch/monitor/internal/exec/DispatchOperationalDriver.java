package com.pantheon.dispatch.monitor.internal.exec;

import com.pantheon.dispatch.monitor.DispatchController;
import com.pantheon.dispatch.monitor.internal.events.DispatchEvent;
import com.pantheon.dispatch.monitor.internal.state.MonitorState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * DispatchOperationalDriver
 * =============================================================================
 * Runs the {@link DispatchController} on a dedicated event loop thread.
 *
 * <h2>Threading model</h2>
 * Producers on any thread (manifest intake, the reader, both tickers) call
 * {@link #submitEvent(DispatchEvent)}. Events are queued and handed to the
 * controller one at a time, in submission order, on the
 * {@code dispatch-monitor} thread. Nothing else touches the monitor state.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   driver.start()           → starts the event loop thread
 *   driver.submitEvent(...)  → enqueues an event; refused unless running
 *   driver.stop()            → refuses new events, processes the queued ones, joins
 * </pre>
 */
public final class DispatchOperationalDriver
{
    private static final Logger log = LoggerFactory.getLogger(DispatchOperationalDriver.class);

    private static final DispatchEvent SHUTDOWN = new DispatchEvent.Base(Instant.EPOCH) { };

    private final DispatchController controller;
    private final long joinTimeoutMs;

    private final BlockingQueue<DispatchEvent> eventQueue = new LinkedBlockingQueue<>();
    private final Object lifecycleLock = new Object();

    private boolean running;
    private Thread eventLoopThread;

    public DispatchOperationalDriver(DispatchController controller)
    {
        this(controller, 5000);
    }

    public DispatchOperationalDriver(DispatchController controller, long joinTimeoutMs)
    {
        this.controller = Objects.requireNonNull(controller, "controller");
        this.joinTimeoutMs = joinTimeoutMs;
    }

    /**
     * Starts the event loop thread. Idempotent.
     */
    public void start()
    {
        synchronized (lifecycleLock) {
            if (running) {
                return;
            }
            running = true;
            eventLoopThread = new Thread(this::runEventLoop, "dispatch-monitor");
            eventLoopThread.setDaemon(true);
            eventLoopThread.start();
        }
    }

    /**
     * Stops the event loop. Events accepted before this call are still
     * processed. Blocks until the loop thread terminates or the join timeout
     * elapses. Idempotent.
     */
    public void stop()
    {
        final Thread loop;
        synchronized (lifecycleLock) {
            if (!running) {
                return;
            }
            running = false;
            eventQueue.offer(SHUTDOWN);
            loop = eventLoopThread;
            eventLoopThread = null;
        }

        if (loop == Thread.currentThread()) {
            return;
        }

        try {
            loop.join(joinTimeoutMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning()
    {
        synchronized (lifecycleLock) {
            return running;
        }
    }

    /**
     * Submits an event for processing.
     *
     * @return {@code false} if the driver is not running and the event was dropped
     */
    public boolean submitEvent(DispatchEvent event)
    {
        Objects.requireNonNull(event, "event");
        synchronized (lifecycleLock) {
            if (!running) {
                return false;
            }
            return eventQueue.offer(event);
        }
    }

    /**
     * Current state snapshot. Safe from any thread.
     */
    public MonitorState currentState()
    {
        return controller.state();
    }

    private void runEventLoop()
    {
        while (true) {
            final DispatchEvent event;
            try {
                event = eventQueue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }

            if (event == SHUTDOWN) {
                return;
            }

            try {
                controller.submit(event);
                controller.drain();
            } catch (RuntimeException e) {
                // Only a failing observability sink or status callback gets here.
                log.error("Dispatch event loop failed on {}", event.getClass().getSimpleName(), e);
            }
        }
    }
}
