package com.pantheon.dispatch.monitor.internal.state;

import com.pantheon.dispatch.api.SystemState;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static com.pantheon.dispatch.api.SystemState.*;

/**
 * TransitionGraph
 * -----------------------------------------------------------------------------
 * Fixed table of legal moves between {@link SystemState}s.
 *
 * <p>Only {@link SystemState#IDLE} and {@link SystemState#TRUCK_DEPARTING} may
 * repeat. The terminal states must pass through {@code IDLE} (or {@code INVALID})
 * before anything else happens, so the decision loop can never act on the same
 * terminal state twice.</p>
 */
public final class TransitionGraph
{
    /**
     * The dispatch monitor's declared state machine.
     */
    public static final TransitionGraph DISPATCH = new TransitionGraph(Map.of(
            IDLE,              EnumSet.of(IDLE, TRUCK_DEPARTING, MISSING_TAGS, INVALID),
            TRUCK_DEPARTING,   EnumSet.of(TRUCK_DEPARTING, MISSING_TAGS, EXTRA_TAGS, SHIPMENT_COMPLETE, INVALID),
            MISSING_TAGS,      EnumSet.of(IDLE, INVALID),
            EXTRA_TAGS,        EnumSet.of(IDLE, INVALID),
            SHIPMENT_COMPLETE, EnumSet.of(IDLE, INVALID),
            INVALID,           EnumSet.of(IDLE)
    ));

    private final Map<SystemState, Set<SystemState>> successors;

    private TransitionGraph(Map<SystemState, Set<SystemState>> successors) {
        EnumMap<SystemState, Set<SystemState>> copy = new EnumMap<>(SystemState.class);
        for (SystemState state : SystemState.values()) {
            Set<SystemState> next = successors.get(state);
            copy.put(state, next == null
                    ? Collections.emptySet()
                    : Collections.unmodifiableSet(EnumSet.copyOf(next)));
        }
        this.successors = Collections.unmodifiableMap(copy);
    }

    /**
     * Returns {@code true} iff {@code to} is an allowed successor of {@code from}.
     */
    public boolean isLegal(SystemState from, SystemState to) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        return successors.get(from).contains(to);
    }

    /**
     * Returns the allowed successors of {@code from}.
     */
    public Set<SystemState> successors(SystemState from) {
        return successors.get(Objects.requireNonNull(from, "from"));
    }
}
