package com.pantheon.dispatch.monitor;

import com.pantheon.dispatch.api.PreconditionViolationException;
import com.pantheon.dispatch.api.SystemState;
import com.pantheon.dispatch.monitor.internal.events.ManifestEvent;
import com.pantheon.dispatch.monitor.internal.events.TagEvent;
import com.pantheon.dispatch.monitor.internal.events.TickEvent;
import com.pantheon.dispatch.monitor.internal.exec.CountdownTicker;
import com.pantheon.dispatch.monitor.internal.exec.MonitorIntentExecutor;
import com.pantheon.dispatch.monitor.internal.state.CountdownTimer;
import com.pantheon.dispatch.monitor.internal.state.DispatchReducer;
import com.pantheon.dispatch.monitor.internal.state.MonitorState;
import com.pantheon.dispatch.monitor.internal.state.StatusEvaluator;
import com.pantheon.dispatch.monitor.internal.state.TagDatabaseCompletenessPredicate;
import com.pantheon.dispatch.monitor.internal.state.TransitionAnomaly;
import com.pantheon.dispatch.monitor.internal.time.WallClock;
import com.pantheon.dispatch.monitor.notify.DispatchNotification;
import com.pantheon.dispatch.monitor.notify.RecordingNotificationPublisher;
import com.pantheon.dispatch.monitor.observability.DispatchAnomalyEvent;
import com.pantheon.dispatch.monitor.observability.DispatchErrorEvent;
import com.pantheon.dispatch.monitor.observability.DispatchObservabilitySink;
import com.pantheon.dispatch.monitor.observability.DispatchStateTransitionEvent;
import com.pantheon.dispatch.monitor.observability.ManifestRejectedEvent;
import com.pantheon.dispatch.monitor.observability.RecordingObservabilitySink;
import com.pantheon.dispatch.monitor.reader.FakeReaderDriver;
import com.pantheon.dispatch.monitor.testing.DispatchFixtures;
import com.pantheon.dispatch.monitor.time.DeterministicScheduler;
import com.pantheon.dispatch.monitor.time.ManualMonotonicClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DispatchControllerTest
 * -----------------------------------------------------------------------------
 * Drives the controller with the production intent executor over a
 * deterministic scheduler. Time only moves when a test advances it.
 */
class DispatchControllerTest {

    private static final Duration COUNTDOWN_PERIOD = Duration.ofSeconds(1);
    private static final long STARTING_COUNTDOWN = 3;

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private WallClock wallClock;
    private RecordingNotificationPublisher publisher;
    private RecordingObservabilitySink sink;
    private FakeReaderDriver reader;
    private CountdownTicker countdownTicker;
    private DispatchController controller;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        Instant epoch = Instant.parse("2026-03-02T08:00:00Z");
        wallClock = () -> epoch.plusNanos(clock.nowNanos());
        publisher = new RecordingNotificationPublisher();
        sink = new RecordingObservabilitySink();
        reader = new FakeReaderDriver();

        countdownTicker = new CountdownTicker(
                event -> controller.submit(event), scheduler, clock, wallClock, COUNTDOWN_PERIOD);

        controller = new DispatchController(
                MonitorState.idle(CountdownTimer.stopped(STARTING_COUNTDOWN, COUNTDOWN_PERIOD), wallClock.now()),
                new DispatchReducer(new StatusEvaluator(
                        new TagDatabaseCompletenessPredicate(DispatchFixtures.tagDatabase()))),
                new MonitorIntentExecutor(countdownTicker, publisher, reader, wallClock),
                sink,
                wallClock);
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private CompletableFuture<Void> submitManifest(String shipmentId) {
        ManifestEvent.ManifestSubmitted event = new ManifestEvent.ManifestSubmitted(
                wallClock.now(), DispatchFixtures.widgetsAndGadget(shipmentId));
        controller.submit(event);
        controller.drain();
        return event.reply();
    }

    private void readTags(String... ids) {
        controller.submit(new TagEvent.TagsObserved(wallClock.now(), Set.of(ids)));
        controller.drain();
    }

    private void decide() {
        controller.submit(new TickEvent.DecisionTick(wallClock.now()));
        controller.drain();
    }

    private void elapse(long seconds) {
        for (long i = 0; i < seconds; i++) {
            clock.advanceMillis(1000);
            scheduler.runDueTasks();
            controller.drain();
        }
    }

    // ---------------------------------------------------------------------
    // Tests
    // ---------------------------------------------------------------------

    @Test
    void stepOnEmptyQueueReturnsFalse() {
        assertFalse(controller.step());
        assertEquals(0, controller.queuedEventCount());
    }

    @Test
    void eventsWaitUntilStepped() {
        controller.submit(new TagEvent.TagsObserved(wallClock.now(), Set.of("E001")));

        assertEquals(1, controller.queuedEventCount());
        assertTrue(controller.peekNextEvent().isPresent());
        assertTrue(controller.state().tagsRead().isEmpty());

        assertTrue(controller.step());
        assertEquals(Set.of("E001"), controller.state().tagsRead());
    }

    @Test
    void acceptedManifestCompletesReplyAndStartsCountdown() {
        CompletableFuture<Void> reply = submitManifest("S-1");

        assertTrue(reply.isDone());
        assertFalse(reply.isCompletedExceptionally());
        assertTrue(countdownTicker.isRunning());

        elapse(1);
        assertEquals(STARTING_COUNTDOWN - 1, controller.state().departureTimer().currentValue());
    }

    @Test
    void rejectedManifestFailsReplyAndIsObserved() {
        submitManifest("S-1");
        MonitorState before = controller.state();

        CompletableFuture<Void> reply = submitManifest("S-2");

        ExecutionException failure = assertThrows(ExecutionException.class, reply::get);
        PreconditionViolationException violation =
                assertInstanceOf(PreconditionViolationException.class, failure.getCause());
        assertEquals(PreconditionViolationException.Reason.MANIFEST_ACTIVE, violation.reason());

        assertSame(before, controller.state());
        assertEquals("S-2", sink.getRejections().get(0).shipmentId());
    }

    @Test
    void completeShipmentIsNotifiedOnceAndCycleEnds() {
        submitManifest("S-1");
        decide();
        readTags("E001", "E002");
        elapse(1);
        readTags("E101");
        decide();

        assertEquals(SystemState.SHIPMENT_COMPLETE, controller.state().systemState());
        assertFalse(countdownTicker.isRunning());

        List<DispatchNotification> notifications = publisher.published();
        assertEquals(1, notifications.size());
        DispatchNotification done = notifications.get(0);
        assertEquals(DispatchNotification.Kind.SHIPMENT_COMPLETE, done.kind());
        assertEquals("S-1", done.manifest().orElseThrow().shipmentId());
        assertEquals(Set.of("E001", "E002", "E101"), done.tagsRead());

        decide();
        decide();
        assertEquals(SystemState.IDLE, controller.state().systemState());
        assertEquals(1, publisher.published().size());
        assertTrue(sink.getAnomalies().isEmpty());
    }

    @Test
    void departureWindowExpiryReportsMissingTags() {
        submitManifest("S-1");
        decide();
        readTags("E001");

        elapse(STARTING_COUNTDOWN);
        assertEquals(0, controller.state().departureTimer().currentValue());

        decide();
        assertEquals(SystemState.MISSING_TAGS, controller.state().systemState());
        assertEquals(List.of(DispatchNotification.Kind.MISSING_TAGS), publisher.kinds());
        assertFalse(countdownTicker.isRunning());
        assertEquals(0, scheduler.pendingTaskCount());

        decide();
        assertEquals(SystemState.IDLE, controller.state().systemState());
        assertEquals(STARTING_COUNTDOWN, controller.state().departureTimer().currentValue());
    }

    @Test
    void illegalTransitionHardResetsAndResyncsReader() {
        readTags("E001");
        decide();

        assertEquals(SystemState.IDLE, controller.state().systemState());
        assertTrue(controller.state().tagsRead().isEmpty());
        assertEquals(1, reader.resyncCount());
        assertTrue(publisher.published().isEmpty());

        TransitionAnomaly anomaly = sink.getAnomalies().get(0).anomaly();
        assertEquals(TransitionAnomaly.Kind.ILLEGAL_TRANSITION, anomaly.kind());
        assertEquals(SystemState.EXTRA_TAGS, anomaly.to());
        assertEquals(Set.of("E001"), sink.getAnomalies().get(0).snapshot().tagsRead());
    }

    @Test
    void nextCycleIgnoresTicksOfThePreviousOne() {
        submitManifest("S-1");
        long firstGeneration = controller.state().departureTimer().generation();
        decide();
        readTags("E001", "E002", "E101");
        decide();
        decide();
        assertEquals(SystemState.IDLE, controller.state().systemState());

        submitManifest("S-2");
        controller.submit(new TickEvent.CountdownTick(wallClock.now(), firstGeneration));
        controller.drain();

        assertEquals(STARTING_COUNTDOWN, controller.state().departureTimer().currentValue());
        assertEquals("S-2", controller.state().manifest().orElseThrow().shipmentId());
    }

    @Test
    void everyAppliedEventIsObserved() {
        submitManifest("S-1");
        readTags("E001");
        decide();

        assertEquals(3, sink.getStateTransitions().size());
        assertTrue(sink.getStateTransitions().get(0).isCycleChange());
        assertTrue(sink.getStateTransitions().get(2).isSystemStateChange());
    }

    @Test
    void executorFailureIsReportedAndStateStillCommitted() {
        DispatchController failing = new DispatchController(
                controller.state(),
                new DispatchReducer(new StatusEvaluator((m, tags) -> false)),
                intents -> { throw new IllegalStateException("boom"); },
                sink,
                wallClock);

        ManifestEvent.ManifestSubmitted event = new ManifestEvent.ManifestSubmitted(
                wallClock.now(), DispatchFixtures.widgetsAndGadget("S-1"));
        failing.submit(event);
        failing.drain();

        assertTrue(failing.state().hasManifest());
        assertFalse(event.reply().isCompletedExceptionally());
        assertEquals("boom", sink.getErrors().get(0).cause().getMessage());
    }

    @Test
    void throwingSinkDoesNotStallTheCycle() {
        ThrowingSink throwing = new ThrowingSink(false);
        DispatchController guarded = controllerWithSink(throwing);

        ManifestEvent.ManifestSubmitted event = new ManifestEvent.ManifestSubmitted(
                wallClock.now(), DispatchFixtures.widgetsAndGadget("S-1"));
        guarded.submit(event);
        guarded.drain();

        assertTrue(event.reply().isDone());
        assertFalse(event.reply().isCompletedExceptionally());
        assertTrue(countdownTicker.isRunning());
        assertFalse(throwing.errors.isEmpty());

        guarded.submit(new TickEvent.DecisionTick(wallClock.now()));
        guarded.drain();
        for (long i = 0; i < STARTING_COUNTDOWN; i++) {
            clock.advanceMillis(1000);
            scheduler.runDueTasks();
            guarded.drain();
        }
        assertEquals(0, guarded.state().departureTimer().currentValue());

        guarded.submit(new TickEvent.DecisionTick(wallClock.now()));
        guarded.drain();

        assertEquals(SystemState.MISSING_TAGS, guarded.state().systemState());
        assertEquals(List.of(DispatchNotification.Kind.MISSING_TAGS), publisher.kinds());
        assertFalse(countdownTicker.isRunning());
    }

    @Test
    void sinkFailingOnErrorStillLetsIntentsRun() {
        DispatchController guarded = controllerWithSink(new ThrowingSink(true));

        ManifestEvent.ManifestSubmitted event = new ManifestEvent.ManifestSubmitted(
                wallClock.now(), DispatchFixtures.widgetsAndGadget("S-1"));
        guarded.submit(event);
        guarded.drain();

        assertTrue(event.reply().isDone());
        assertTrue(guarded.state().hasManifest());
        assertTrue(countdownTicker.isRunning());
    }

    private DispatchController controllerWithSink(DispatchObservabilitySink observer) {
        DispatchController[] ref = new DispatchController[1];
        countdownTicker = new CountdownTicker(
                e -> ref[0].submit(e), scheduler, clock, wallClock, COUNTDOWN_PERIOD);
        ref[0] = new DispatchController(
                MonitorState.idle(CountdownTimer.stopped(STARTING_COUNTDOWN, COUNTDOWN_PERIOD), wallClock.now()),
                new DispatchReducer(new StatusEvaluator(
                        new TagDatabaseCompletenessPredicate(DispatchFixtures.tagDatabase()))),
                new MonitorIntentExecutor(countdownTicker, publisher, reader, wallClock),
                observer,
                wallClock);
        return ref[0];
    }

    private static final class ThrowingSink implements DispatchObservabilitySink {
        private final boolean failOnError;
        private final List<DispatchErrorEvent> errors = new ArrayList<>();

        ThrowingSink(boolean failOnError) {
            this.failOnError = failOnError;
        }

        @Override
        public void onStateTransition(DispatchStateTransitionEvent event) {
            throw new IllegalStateException("status callback failed");
        }

        @Override
        public void onAnomaly(DispatchAnomalyEvent event) {
            throw new IllegalStateException("anomaly callback failed");
        }

        @Override
        public void onManifestRejected(ManifestRejectedEvent event) {
            throw new IllegalStateException("rejection callback failed");
        }

        @Override
        public void onError(DispatchErrorEvent event) {
            if (failOnError) {
                throw new IllegalStateException("error callback failed");
            }
            errors.add(event);
        }
    }
}
