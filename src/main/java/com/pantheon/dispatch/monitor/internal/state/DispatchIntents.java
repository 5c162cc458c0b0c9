package com.pantheon.dispatch.monitor.internal.state;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * DispatchIntents
 * -----------------------------------------------------------------------------
 * Immutable set of side effects requested by the {@link DispatchReducer}.
 *
 * <p>The reducer decides <b>what</b> should happen; an executor decides
 * <b>how</b>. Nothing here performs I/O. Intents are realised only after the
 * state that produced them has been committed.</p>
 *
 * <p>Notification intents carry the snapshot they refer to, taken before any
 * reset cleared it, so the notification still names the manifest and tags of
 * the finished cycle.</p>
 */
public final class DispatchIntents
{
    public enum Kind {
        /** Start ticking the departure countdown for the given generation. */
        START_COUNTDOWN,

        /** Stop ticking the departure countdown. */
        STOP_COUNTDOWN,

        /** Queue a "missing tags" notification. */
        NOTIFY_MISSING_TAGS,

        /** Queue an "extra tags" notification. */
        NOTIFY_EXTRA_TAGS,

        /** Queue a "shipment complete" notification. */
        NOTIFY_SHIPMENT_COMPLETE,

        /** Ask the reader driver to re-synchronise. */
        RESYNC_READER
    }

    private static final DispatchIntents NONE = new DispatchIntents(EnumSet.noneOf(Kind.class), null, null);

    private final Set<Kind> kinds;
    private final Long countdownGeneration;
    private final MonitorState subject;

    private DispatchIntents(Set<Kind> kinds, Long countdownGeneration, MonitorState subject) {
        this.kinds = Collections.unmodifiableSet(kinds.isEmpty()
                ? EnumSet.noneOf(Kind.class)
                : EnumSet.copyOf(kinds));
        this.countdownGeneration = countdownGeneration;
        this.subject = subject;
    }

    public Set<Kind> kinds() {
        return kinds;
    }

    public boolean isEmpty() {
        return kinds.isEmpty();
    }

    public boolean contains(Kind kind) {
        return kinds.contains(kind);
    }

    /**
     * Generation of the countdown run to start, present with {@link Kind#START_COUNTDOWN}.
     */
    public Optional<Long> countdownGeneration() {
        return Optional.ofNullable(countdownGeneration);
    }

    /**
     * Snapshot a notification refers to, present with the {@code NOTIFY_*} kinds.
     */
    public Optional<MonitorState> subject() {
        return Optional.ofNullable(subject);
    }

    // ---------------------------------------------------------------------
    // Factory methods
    // ---------------------------------------------------------------------

    public static DispatchIntents none() {
        return NONE;
    }

    public static DispatchIntents startCountdown(long generation) {
        return new DispatchIntents(EnumSet.of(Kind.START_COUNTDOWN), generation, null);
    }

    public static DispatchIntents stopCountdown() {
        return new DispatchIntents(EnumSet.of(Kind.STOP_COUNTDOWN), null, null);
    }

    public static DispatchIntents resyncReader() {
        return new DispatchIntents(EnumSet.of(Kind.RESYNC_READER), null, null);
    }

    public static DispatchIntents notifyMissingTags(MonitorState subject) {
        return notification(Kind.NOTIFY_MISSING_TAGS, subject);
    }

    public static DispatchIntents notifyExtraTags(MonitorState subject) {
        return notification(Kind.NOTIFY_EXTRA_TAGS, subject);
    }

    public static DispatchIntents notifyShipmentComplete(MonitorState subject) {
        return notification(Kind.NOTIFY_SHIPMENT_COMPLETE, subject);
    }

    private static DispatchIntents notification(Kind kind, MonitorState subject) {
        return new DispatchIntents(EnumSet.of(kind), null, Objects.requireNonNull(subject, "subject"));
    }

    // ---------------------------------------------------------------------
    // Composition
    // ---------------------------------------------------------------------

    /**
     * Combines two intent sets. At most one of them may carry a subject, and at
     * most one a countdown generation.
     */
    public DispatchIntents and(DispatchIntents other) {
        Objects.requireNonNull(other, "other");

        if (subject != null && other.subject != null) {
            throw new IllegalArgumentException("Cannot combine two notification subjects");
        }
        if (countdownGeneration != null && other.countdownGeneration != null) {
            throw new IllegalArgumentException("Cannot combine two countdown generations");
        }

        EnumSet<Kind> merged = EnumSet.noneOf(Kind.class);
        merged.addAll(kinds);
        merged.addAll(other.kinds);

        return new DispatchIntents(
                merged,
                countdownGeneration != null ? countdownGeneration : other.countdownGeneration,
                subject != null ? subject : other.subject);
    }

    @Override
    public String toString() {
        return "DispatchIntents" + kinds;
    }
}
