package com.pantheon.dispatch.monitor.internal.state;

import com.pantheon.dispatch.api.SystemState;

import java.util.Objects;

/**
 * A decision the monitor could not carry out as declared.
 *
 * @param kind what went wrong
 * @param from committed state at the time of the decision
 * @param to   state computed by the evaluator
 */
public record TransitionAnomaly(Kind kind, SystemState from, SystemState to)
{
    public enum Kind {
        /** {@code to} is not a legal successor of {@code from}; recovered by a hard reset. */
        ILLEGAL_TRANSITION,

        /** Legal, but no action is bound to the edge; the state is committed without one. */
        UNHANDLED_TRANSITION
    }

    public TransitionAnomaly {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
    }
}
