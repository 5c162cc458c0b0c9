package com.pantheon.dispatch.monitor.internal.state;

import com.pantheon.dispatch.api.PreconditionViolationException;
import com.pantheon.dispatch.api.SystemState;
import com.pantheon.dispatch.monitor.internal.events.DispatchEvent;
import com.pantheon.dispatch.monitor.internal.events.ManifestEvent;
import com.pantheon.dispatch.monitor.internal.events.TagEvent;
import com.pantheon.dispatch.monitor.internal.events.TickEvent;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * DispatchReducer
 * -----------------------------------------------------------------------------
 * Pure, deterministic state transition engine of the dispatch monitor.
 *
 * <p>Given the current {@link MonitorState} and one {@link DispatchEvent}, the
 * reducer computes the next state and the side effects to carry out. It never
 * performs them: no I/O, no timers, no notifications happen here.</p>
 *
 * <h2>Decision ticks</h2>
 * On every {@link TickEvent.DecisionTick} the reducer evaluates the snapshot,
 * checks the computed state against the {@link TransitionGraph}, and either
 * recovers with a hard reset (illegal move) or runs the action bound to the
 * target state and commits it. Actions fire on the edge only; resting in a
 * state does nothing.
 *
 * <h2>Terminal states</h2>
 * {@code MISSING_TAGS} and {@code SHIPMENT_COMPLETE} clear the cycle as part of
 * their action. The terminal state is still committed, so status shows it for
 * one decision period, and the next evaluation sees an empty cycle and moves
 * to {@code IDLE}. Neither terminal state can be evaluated twice in a row.
 */
public final class DispatchReducer
{
    /**
     * Result of applying an event.
     *
     * @param newState  the state to commit; the same instance when nothing changed
     * @param intents   side effects to carry out after committing
     * @param rejection why a submitted manifest was refused, if it was
     * @param anomaly   illegal or unhandled transition detected, if any
     */
    public record Result(MonitorState newState,
                         DispatchIntents intents,
                         Optional<PreconditionViolationException> rejection,
                         Optional<TransitionAnomaly> anomaly)
    {
        public Result {
            Objects.requireNonNull(newState, "newState");
            Objects.requireNonNull(intents, "intents");
            Objects.requireNonNull(rejection, "rejection");
            Objects.requireNonNull(anomaly, "anomaly");
        }

        static Result of(MonitorState newState, DispatchIntents intents) {
            return new Result(newState, intents, Optional.empty(), Optional.empty());
        }

        static Result unchanged(MonitorState state) {
            return of(state, DispatchIntents.none());
        }
    }

    private final StatusEvaluator evaluator;
    private final TransitionGraph graph;

    public DispatchReducer(StatusEvaluator evaluator) {
        this(evaluator, TransitionGraph.DISPATCH);
    }

    public DispatchReducer(StatusEvaluator evaluator, TransitionGraph graph) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.graph = Objects.requireNonNull(graph, "graph");
    }

    /**
     * Applies a single event to the current state.
     *
     * @param state the current state (must not be {@code null})
     * @param event the event to apply (must not be {@code null})
     * @return the resulting state and intents
     */
    public Result apply(MonitorState state, DispatchEvent event) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(event, "event");

        if (event instanceof ManifestEvent.ManifestSubmitted e) {
            return onManifestSubmitted(state, e);
        }
        if (event instanceof TagEvent.TagsObserved e) {
            return onTagsObserved(state, e);
        }
        if (event instanceof TickEvent.CountdownTick e) {
            return onCountdownTick(state, e);
        }
        if (event instanceof TickEvent.DecisionTick e) {
            return onDecisionTick(state, e);
        }

        return Result.unchanged(state);
    }

    // ---------------------------------------------------------------------
    // Event handlers
    // ---------------------------------------------------------------------

    private Result onManifestSubmitted(MonitorState state, ManifestEvent.ManifestSubmitted e) {
        if (state.hasManifest()) {
            return rejected(state, new PreconditionViolationException(
                    PreconditionViolationException.Reason.MANIFEST_ACTIVE,
                    "Shipment " + state.manifest().orElseThrow().shipmentId() + " is already in progress"));
        }

        // Installing here would make the next decision evaluate TRUCK_DEPARTING
        // from a state that cannot reach it, forcing a hard reset.
        if (!graph.isLegal(state.systemState(), SystemState.TRUCK_DEPARTING)) {
            return rejected(state, new PreconditionViolationException(
                    PreconditionViolationException.Reason.CYCLE_NOT_RESET,
                    "Monitor is in " + state.systemState() + "; wait for it to return to IDLE"));
        }

        MonitorState installed = state.withManifestInstalled(e.manifest());
        return Result.of(installed,
                DispatchIntents.startCountdown(installed.departureTimer().generation()));
    }

    private Result onTagsObserved(MonitorState state, TagEvent.TagsObserved e) {
        return Result.unchanged(state.withTagsObserved(e.tagIds()));
    }

    private Result onCountdownTick(MonitorState state, TickEvent.CountdownTick e) {
        // Ticks from a stopped or superseded run may still be queued.
        if (!state.departureTimer().accepts(e.generation())) {
            return Result.unchanged(state);
        }
        return Result.unchanged(state.withCountdownDecremented());
    }

    private Result onDecisionTick(MonitorState state, TickEvent.DecisionTick e) {
        final SystemState from = state.systemState();
        final SystemState to = evaluator.evaluate(state);
        final Instant now = e.timestamp();

        if (!graph.isLegal(from, to)) {
            return new Result(
                    hardReset(state, now),
                    DispatchIntents.stopCountdown().and(DispatchIntents.resyncReader()),
                    Optional.empty(),
                    Optional.of(new TransitionAnomaly(TransitionAnomaly.Kind.ILLEGAL_TRANSITION, from, to)));
        }

        if (from == to) {
            return Result.unchanged(state);
        }

        return switch (to) {
            case MISSING_TAGS -> Result.of(
                    state.withCycleCleared().withSystemState(to, now),
                    DispatchIntents.notifyMissingTags(state).and(DispatchIntents.stopCountdown()));

            case SHIPMENT_COMPLETE -> Result.of(
                    state.withCycleCleared().withSystemState(to, now),
                    DispatchIntents.notifyShipmentComplete(state).and(DispatchIntents.stopCountdown()));

            case EXTRA_TAGS -> Result.of(
                    state.withSystemState(to, now),
                    DispatchIntents.notifyExtraTags(state));

            case INVALID -> Result.of(
                    state.withCycleCleared().withSystemState(to, now),
                    DispatchIntents.stopCountdown().and(DispatchIntents.resyncReader()));

            case IDLE -> Result.of(state.withSystemState(to, now), DispatchIntents.none());

            case TRUCK_DEPARTING -> {
                MonitorState committed = state.withSystemState(to, now);
                if (from == SystemState.IDLE) {
                    yield Result.of(committed, DispatchIntents.none());
                }
                yield new Result(committed, DispatchIntents.none(), Optional.empty(),
                        Optional.of(new TransitionAnomaly(TransitionAnomaly.Kind.UNHANDLED_TRANSITION, from, to)));
            }
        };
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private static MonitorState hardReset(MonitorState state, Instant now) {
        return state.withCycleCleared().withSystemState(SystemState.IDLE, now);
    }

    private static Result rejected(MonitorState state, PreconditionViolationException violation) {
        return new Result(state, DispatchIntents.none(), Optional.of(violation), Optional.empty());
    }
}
