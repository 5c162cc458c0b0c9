package com.pantheon.dispatch.monitor.internal.state;

import com.pantheon.dispatch.api.MonitorStatus;
import com.pantheon.dispatch.api.ShipmentManifest;
import com.pantheon.dispatch.api.SystemState;

import java.time.Instant;
import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * MonitorState
 * -----------------------------------------------------------------------------
 * Immutable snapshot of everything the dispatch monitor knows: the committed
 * system state, the active manifest, the tags read in this cycle and the
 * departure countdown.
 *
 * <h2>Why one value</h2>
 * The invariants of the monitor span fields (a manifest is present exactly while
 * a cycle runs, the countdown only means something while a manifest is present).
 * Keeping all of them in a single immutable value means every reader sees the
 * record either before or after an update, never halfway. Updates produce a new
 * value through the {@code with*} methods below; only the reducer calls them.
 */
public final class MonitorState
{
    private final SystemState systemState;
    private final ShipmentManifest manifest;
    private final Set<String> tagsRead;
    private final CountdownTimer departureTimer;
    private final Instant lastTransition;

    private MonitorState(SystemState systemState,
                         ShipmentManifest manifest,
                         Set<String> tagsRead,
                         CountdownTimer departureTimer,
                         Instant lastTransition) {
        this.systemState = Objects.requireNonNull(systemState, "systemState");
        this.manifest = manifest;
        this.tagsRead = Set.copyOf(tagsRead);
        this.departureTimer = Objects.requireNonNull(departureTimer, "departureTimer");
        this.lastTransition = Objects.requireNonNull(lastTransition, "lastTransition");
    }

    /**
     * Cold-start state: idle, no manifest, no tags, countdown stopped.
     */
    public static MonitorState idle(CountdownTimer departureTimer, Instant now) {
        return new MonitorState(SystemState.IDLE, null, Set.of(), departureTimer.reset(), now);
    }

    public SystemState systemState() {
        return systemState;
    }

    public Optional<ShipmentManifest> manifest() {
        return Optional.ofNullable(manifest);
    }

    public boolean hasManifest() {
        return manifest != null;
    }

    /**
     * Returns the immutable set of tag identifiers read in the current cycle.
     */
    public Set<String> tagsRead() {
        return tagsRead;
    }

    public CountdownTimer departureTimer() {
        return departureTimer;
    }

    /**
     * Wall-clock time the committed system state last changed. Tag reads,
     * countdown ticks and manifest installation leave it untouched.
     */
    public Instant lastTransition() {
        return lastTransition;
    }

    // ---------------------------------------------------------------------
    // Updates
    // ---------------------------------------------------------------------

    public MonitorState withSystemState(SystemState newState, Instant now) {
        Instant changedAt = newState == systemState ? lastTransition : now;
        return new MonitorState(newState, manifest, tagsRead, departureTimer, changedAt);
    }

    /**
     * Installs a manifest, starts a new countdown run and empties the tag set.
     */
    public MonitorState withManifestInstalled(ShipmentManifest newManifest) {
        Objects.requireNonNull(newManifest, "newManifest");
        return new MonitorState(systemState, newManifest, Set.of(), departureTimer.start(), lastTransition);
    }

    /**
     * Unions newly observed identifiers into the tag set. Returns this instance
     * when nothing new was observed.
     */
    public MonitorState withTagsObserved(Set<String> observed) {
        if (tagsRead.containsAll(observed)) {
            return this;
        }
        Set<String> union = new HashSet<>(tagsRead);
        union.addAll(observed);
        return new MonitorState(systemState, manifest, union, departureTimer, lastTransition);
    }

    public MonitorState withCountdownDecremented() {
        return new MonitorState(systemState, manifest, tagsRead, departureTimer.decrement(), lastTransition);
    }

    /**
     * Clears the cycle: no manifest, no tags, countdown stopped and rearmed.
     * The committed system state is left for the caller to set.
     */
    public MonitorState withCycleCleared() {
        return new MonitorState(systemState, null, Set.of(), departureTimer.reset(), lastTransition);
    }

    /**
     * Read-only status view of this snapshot.
     */
    public MonitorStatus toStatus() {
        return new MonitorStatus(
                systemState,
                manifest(),
                tagsRead,
                departureTimer.currentValue(),
                departureTimer.running(),
                lastTransition);
    }

    @Override
    public String toString() {
        return "MonitorState{" +
                "state=" + systemState +
                ", shipment=" + (manifest == null ? "none" : manifest.shipmentId()) +
                ", tagsRead=" + tagsRead.size() +
                ", countdown=" + departureTimer.currentValue() +
                (departureTimer.running() ? " (running)" : " (stopped)") +
                '}';
    }
}
