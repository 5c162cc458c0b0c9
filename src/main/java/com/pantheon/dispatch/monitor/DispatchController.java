package com.pantheon.dispatch.monitor;

import com.pantheon.dispatch.api.PreconditionViolationException;
import com.pantheon.dispatch.monitor.internal.events.DispatchEvent;
import com.pantheon.dispatch.monitor.internal.events.ManifestEvent;
import com.pantheon.dispatch.monitor.internal.exec.DispatchIntentExecutor;
import com.pantheon.dispatch.monitor.internal.state.DispatchReducer;
import com.pantheon.dispatch.monitor.internal.state.MonitorState;
import com.pantheon.dispatch.monitor.internal.time.WallClock;
import com.pantheon.dispatch.monitor.observability.DispatchAnomalyEvent;
import com.pantheon.dispatch.monitor.observability.DispatchErrorEvent;
import com.pantheon.dispatch.monitor.observability.DispatchObservabilitySink;
import com.pantheon.dispatch.monitor.observability.DispatchStateTransitionEvent;
import com.pantheon.dispatch.monitor.observability.ManifestRejectedEvent;
import com.pantheon.dispatch.monitor.observability.NullObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;

/**
 * DispatchController
 * -----------------------------------------------------------------------------
 * Owner of the dispatch monitor state and its event loop.
 *
 * <p>The controller composes the reducer, the intent executor and the
 * observability sink. It adds no dispatch semantics of its own: legality and
 * decisions live in {@link DispatchReducer}, effects in
 * {@link DispatchIntentExecutor}.</p>
 *
 * <h2>Execution model</h2>
 * <pre>
 *   event → reducer → commit new state → observability / reply → executor
 * </pre>
 * <p>The new state is committed before any intent runs, so an intent that feeds
 * a new event back (a countdown tick, for example) always sees it. Callers
 * drive the loop explicitly via {@link #step()} or {@link #drain()}; the
 * threaded {@code DispatchOperationalDriver} does this in production.</p>
 *
 * <p>Observer callbacks are isolated: a sink that throws is reported through
 * {@code onError} and never prevents the reply or the intents of a committed
 * state.</p>
 *
 * <p>Only one thread may drive the loop. {@link #state()} may be read from any
 * thread.</p>
 */
public class DispatchController
{
    private static final Logger log = LoggerFactory.getLogger(DispatchController.class);

    private final DispatchReducer reducer;
    private final DispatchIntentExecutor executor;
    private final DispatchObservabilitySink observabilitySink;
    private final WallClock wallClock;

    private final Deque<DispatchEvent> queue = new ArrayDeque<>();

    private volatile MonitorState state;

    public DispatchController(MonitorState initialState,
                              DispatchReducer reducer,
                              DispatchIntentExecutor executor,
                              DispatchObservabilitySink observabilitySink,
                              WallClock wallClock)
    {
        this.state = Objects.requireNonNull(initialState, "initialState");
        this.reducer = Objects.requireNonNull(reducer, "reducer");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    /**
     * Enqueue an event for later processing.
     */
    public void submit(DispatchEvent event)
    {
        Objects.requireNonNull(event, "event");
        queue.addLast(event);
    }

    /**
     * Process exactly one queued event, if present.
     *
     * <p>A failure while applying the event leaves the committed state as it
     * was; it is reported to the observability sink and, for a submitted
     * manifest, to the caller waiting on the reply.</p>
     *
     * @return {@code true} if an event was processed; {@code false} if the queue was empty.
     */
    public boolean step()
    {
        DispatchEvent event = queue.pollFirst();
        if (event == null) {
            return false;
        }

        final DispatchReducer.Result result;
        try {
            result = reducer.apply(state, event);
        } catch (RuntimeException e) {
            failReply(event, e);
            reportError("Failed to apply " + event.getClass().getSimpleName(), e);
            return true;
        }

        final MonitorState oldState = state;
        this.state = result.newState();

        observe("onStateTransition", () -> observabilitySink.onStateTransition(new DispatchStateTransitionEvent(
                wallClock.now(),
                oldState,
                result.newState(),
                event,
                result.intents())));

        result.anomaly().ifPresent(anomaly -> observe("onAnomaly", () -> observabilitySink.onAnomaly(
                new DispatchAnomalyEvent(wallClock.now(), anomaly, oldState))));

        completeReply(event, result.rejection());

        try {
            executor.execute(result.intents());
        } catch (RuntimeException e) {
            reportError("Failed to execute " + result.intents(), e);
        }

        return true;
    }

    /**
     * Drain the queue until no events remain.
     */
    public void drain()
    {
        while (step()) {
            // Intentionally empty.
        }
    }

    /**
     * Current immutable state snapshot.
     */
    public MonitorState state()
    {
        return state;
    }

    public int queuedEventCount()
    {
        return queue.size();
    }

    public Optional<DispatchEvent> peekNextEvent()
    {
        return Optional.ofNullable(queue.peekFirst());
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private void completeReply(DispatchEvent event, Optional<PreconditionViolationException> rejection)
    {
        if (!(event instanceof ManifestEvent.ManifestSubmitted submitted)) {
            return;
        }

        if (rejection.isPresent()) {
            PreconditionViolationException violation = rejection.get();
            observe("onManifestRejected", () -> observabilitySink.onManifestRejected(new ManifestRejectedEvent(
                    wallClock.now(), submitted.manifest().shipmentId(), violation)));
            submitted.reply().completeExceptionally(violation);
        }
        else {
            submitted.reply().complete(null);
        }
    }

    private static void failReply(DispatchEvent event, Throwable cause)
    {
        if (event instanceof ManifestEvent.ManifestSubmitted submitted) {
            submitted.reply().completeExceptionally(cause);
        }
    }

    private void observe(String callback, Runnable notification)
    {
        try {
            notification.run();
        } catch (RuntimeException e) {
            reportError("Observability sink failed in " + callback, e);
        }
    }

    private void reportError(String message, Throwable cause)
    {
        try {
            observabilitySink.onError(new DispatchErrorEvent(wallClock.now(), message, cause));
        } catch (RuntimeException e) {
            // Sink cannot take its own error report; fall back to the log.
            log.error("{} (sink onError also failed: {})", message, e.toString(), cause);
        }
    }
}
