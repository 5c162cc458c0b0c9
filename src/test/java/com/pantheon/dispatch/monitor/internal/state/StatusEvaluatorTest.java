package com.pantheon.dispatch.monitor.internal.state;

import com.pantheon.dispatch.api.ShipmentManifest;
import com.pantheon.dispatch.api.SystemState;
import com.pantheon.dispatch.monitor.testing.DispatchFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StatusEvaluatorTest
 * -----------------------------------------------------------------------------
 * The evaluator is a pure function of manifest, tags and countdown. A stub
 * completeness predicate keeps these tests independent of the tag database.
 */
class StatusEvaluatorTest {

    private Instant now;
    private MonitorState idle;
    private ShipmentManifest manifest;
    private boolean complete;
    private StatusEvaluator evaluator;

    @BeforeEach
    void setUp() {
        now = Instant.parse("2026-03-02T08:00:00Z");
        idle = MonitorState.idle(CountdownTimer.stopped(2, Duration.ofSeconds(1)), now);
        manifest = DispatchFixtures.widgetsAndGadget("S-1");
        complete = false;
        evaluator = new StatusEvaluator((m, tags) -> complete);
    }

    @Test
    void noManifestNoTagsIsIdle() {
        assertEquals(SystemState.IDLE, evaluator.evaluate(idle));
    }

    @Test
    void tagsWithoutManifestAreExtra() {
        assertEquals(SystemState.EXTRA_TAGS,
                evaluator.evaluate(idle.withTagsObserved(Set.of("E001"))));
    }

    @Test
    void incompleteShipmentIsDeparting() {
        MonitorState s = idle.withManifestInstalled(manifest).withTagsObserved(Set.of("E001"));
        assertEquals(SystemState.TRUCK_DEPARTING, evaluator.evaluate(s));
    }

    @Test
    void completeShipmentIsComplete() {
        complete = true;
        MonitorState s = idle.withManifestInstalled(manifest);
        assertEquals(SystemState.SHIPMENT_COMPLETE, evaluator.evaluate(s));
    }

    @Test
    void expiredCountdownWinsOverCompleteness() {
        complete = true;
        MonitorState s = idle.withManifestInstalled(manifest)
                .withCountdownDecremented()
                .withCountdownDecremented();

        assertEquals(0, s.departureTimer().currentValue());
        assertEquals(SystemState.MISSING_TAGS, evaluator.evaluate(s));
    }

    @Test
    void committedStateIsIgnored() {
        MonitorState s = idle.withSystemState(SystemState.SHIPMENT_COMPLETE, now);
        assertEquals(SystemState.IDLE, evaluator.evaluate(s));
    }
}
