package com.pantheon.dispatch.monitor.runtime;

import com.pantheon.dispatch.api.DispatchMonitor;
import com.pantheon.dispatch.api.MonitorStatus;
import com.pantheon.dispatch.api.PreconditionViolationException;
import com.pantheon.dispatch.api.ShipmentManifest;
import com.pantheon.dispatch.monitor.DispatchController;
import com.pantheon.dispatch.monitor.config.DispatchRuntimeConfig;
import com.pantheon.dispatch.monitor.internal.events.ManifestEvent;
import com.pantheon.dispatch.monitor.internal.events.TagEvent;
import com.pantheon.dispatch.monitor.internal.events.TickEvent;
import com.pantheon.dispatch.monitor.internal.exec.CountdownTicker;
import com.pantheon.dispatch.monitor.internal.exec.DispatchOperationalDriver;
import com.pantheon.dispatch.monitor.internal.exec.DispatchTimingPolicy;
import com.pantheon.dispatch.monitor.internal.exec.MonitorIntentExecutor;
import com.pantheon.dispatch.monitor.internal.state.CountdownTimer;
import com.pantheon.dispatch.monitor.internal.state.DispatchReducer;
import com.pantheon.dispatch.monitor.internal.state.MonitorState;
import com.pantheon.dispatch.monitor.internal.state.StatusEvaluator;
import com.pantheon.dispatch.monitor.internal.state.TagDatabaseCompletenessPredicate;
import com.pantheon.dispatch.monitor.internal.time.FixedRateTicker;
import com.pantheon.dispatch.monitor.internal.time.MonotonicClock;
import com.pantheon.dispatch.monitor.internal.time.MonotonicScheduler;
import com.pantheon.dispatch.monitor.internal.time.ScheduledExecutorScheduler;
import com.pantheon.dispatch.monitor.internal.time.SystemMonotonicClock;
import com.pantheon.dispatch.monitor.internal.time.SystemWallClock;
import com.pantheon.dispatch.monitor.internal.time.WallClock;
import com.pantheon.dispatch.monitor.notify.AsyncNotificationPublisher;
import com.pantheon.dispatch.monitor.notify.NotificationPublisher;
import com.pantheon.dispatch.monitor.notify.Slf4jNotificationPublisher;
import com.pantheon.dispatch.monitor.observability.DispatchAnomalyEvent;
import com.pantheon.dispatch.monitor.observability.DispatchErrorEvent;
import com.pantheon.dispatch.monitor.observability.DispatchObservabilitySink;
import com.pantheon.dispatch.monitor.observability.DispatchStateTransitionEvent;
import com.pantheon.dispatch.monitor.observability.ManifestRejectedEvent;
import com.pantheon.dispatch.monitor.observability.Slf4jDispatchObservabilitySink;
import com.pantheon.dispatch.monitor.reader.ReaderDriver;
import com.pantheon.dispatch.monitor.reader.TagReportDecoder;
import com.pantheon.dispatch.monitor.reader.UdpTagReportReader;
import com.pantheon.dispatch.monitor.tagdb.TagDatabase;
import com.pantheon.dispatch.monitor.transport.udp.netty.NettyUdpDatagramEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * DispatchProductionRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the production dispatch monitor.
 *
 * <p>Wires the reader, the serialized event loop, the departure countdown, the
 * periodic decision ticker and the outbound notification path, and exposes the
 * result as a {@link DispatchMonitor}.</p>
 */
public final class DispatchProductionRuntime implements DispatchMonitor {
    private static final Logger log = LoggerFactory.getLogger(DispatchProductionRuntime.class);

    private final DispatchOperationalDriver driver;
    private final ReaderDriver readerDriver;
    private final FixedRateTicker decisionTicker;
    private final CountdownTicker countdownTicker;
    private final AsyncNotificationPublisher publisher;
    private final ScheduledExecutorService schedulerExecutor;
    private final DispatchObservabilitySink observabilitySink;
    private final WallClock wallClock;

    private DispatchProductionRuntime(
            DispatchOperationalDriver driver,
            ReaderDriver readerDriver,
            FixedRateTicker decisionTicker,
            CountdownTicker countdownTicker,
            AsyncNotificationPublisher publisher,
            ScheduledExecutorService schedulerExecutor,
            DispatchObservabilitySink observabilitySink,
            WallClock wallClock) {
        this.driver = driver;
        this.readerDriver = readerDriver;
        this.decisionTicker = decisionTicker;
        this.countdownTicker = countdownTicker;
        this.publisher = publisher;
        this.schedulerExecutor = schedulerExecutor;
        this.observabilitySink = observabilitySink;
        this.wallClock = wallClock;
    }

    public void start() {
        driver.start();
        readerDriver.start();
        decisionTicker.start();
        log.info("Dispatch monitor started");
    }

    /**
     * Stops the decision loop and the reader, processes events already
     * accepted, then releases timers and the notification thread.
     */
    public void stop() {
        decisionTicker.stop();
        readerDriver.stop();
        driver.stop();
        countdownTicker.stop();
        publisher.close();

        schedulerExecutor.shutdown();
        try {
            if (!schedulerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                schedulerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            schedulerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Dispatch monitor stopped");
    }

    // -------------------------------------------------------------------------
    // DispatchMonitor
    // -------------------------------------------------------------------------

    /**
     * {@inheritDoc}
     *
     * <p>Fails immediately with {@link PreconditionViolationException.Reason#READER_INACTIVE}
     * when the reader is not active; nothing is queued in that case.</p>
     */
    @Override
    public CompletableFuture<Void> installManifest(ShipmentManifest manifest) {
        Objects.requireNonNull(manifest, "manifest");

        if (!readerDriver.isActive()) {
            PreconditionViolationException violation = new PreconditionViolationException(
                    PreconditionViolationException.Reason.READER_INACTIVE,
                    "RFID reader is not active");
            observabilitySink.onManifestRejected(
                    new ManifestRejectedEvent(wallClock.now(), manifest.shipmentId(), violation));
            return CompletableFuture.failedFuture(violation);
        }

        ManifestEvent.ManifestSubmitted event = new ManifestEvent.ManifestSubmitted(wallClock.now(), manifest);
        if (!driver.submitEvent(event)) {
            event.reply().completeExceptionally(new IllegalStateException("Dispatch monitor is not running"));
        }
        return event.reply();
    }

    @Override
    public MonitorStatus getStatus() {
        return driver.currentState().toStatus();
    }

    public MonitorState currentState() {
        return driver.currentState();
    }

    public boolean isRunning() {
        return driver.isRunning();
    }

    private void onTagsObserved(Set<String> tagIds) {
        driver.submitEvent(new TagEvent.TagsObserved(wallClock.now(), tagIds));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private DispatchRuntimeConfig config = DispatchRuntimeConfig.defaults();
        private TagDatabase tagDatabase;
        private ReaderDriver readerDriver;
        private NotificationPublisher notificationPublisher = new Slf4jNotificationPublisher();
        private DispatchObservabilitySink observabilitySink = new Slf4jDispatchObservabilitySink();
        private Consumer<MonitorStatus> statusCallback;

        public Builder withConfig(DispatchRuntimeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withTimingPolicy(DispatchTimingPolicy policy) {
            this.config = new DispatchRuntimeConfig(
                    policy, config.readerBindAddress(), config.readerControlAddress());
            return this;
        }

        public Builder withTagDatabase(TagDatabase tagDatabase) {
            this.tagDatabase = tagDatabase;
            return this;
        }

        /**
         * Replaces the UDP reader built from the configuration.
         */
        public Builder withReaderDriver(ReaderDriver readerDriver) {
            this.readerDriver = readerDriver;
            return this;
        }

        public Builder withNotificationPublisher(NotificationPublisher publisher) {
            this.notificationPublisher = publisher;
            return this;
        }

        public Builder withObservabilitySink(DispatchObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withStatusCallback(Consumer<MonitorStatus> callback) {
            this.statusCallback = callback;
            return this;
        }

        public DispatchProductionRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(tagDatabase, "tagDatabase");
            Objects.requireNonNull(notificationPublisher, "notificationPublisher");
            Objects.requireNonNull(observabilitySink, "observabilitySink");

            DispatchTimingPolicy timing = config.timingPolicy();

            // 1. Core dependencies
            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            WallClock wallClock = SystemWallClock.INSTANCE;
            ScheduledExecutorService schedulerExec = Executors.newScheduledThreadPool(1, r -> {
                Thread t = new Thread(r, "dispatch-timers");
                t.setDaemon(true);
                return t;
            });
            MonotonicScheduler scheduler = new ScheduledExecutorScheduler(schedulerExec, clock);

            StatusEvaluator evaluator = new StatusEvaluator(new TagDatabaseCompletenessPredicate(tagDatabase));
            DispatchReducer reducer = new DispatchReducer(evaluator);

            MonitorState initialState = MonitorState.idle(
                    CountdownTimer.stopped(timing.startingCountdown(), timing.countdownPeriod()),
                    wallClock.now());

            // 2. Reader
            ReaderDriver reader = readerDriver;
            if (reader == null) {
                reader = new UdpTagReportReader(
                        new NettyUdpDatagramEndpoint(config.readerBindAddress()),
                        new TagReportDecoder(),
                        config.readerControlAddress().orElse(null));
            }

            // 3. Observability, with the status callback folded in
            DispatchObservabilitySink effectiveSink = observabilitySink;
            if (statusCallback != null) {
                DispatchObservabilitySink delegate = observabilitySink;
                Consumer<MonitorStatus> callback = statusCallback;
                effectiveSink = new DispatchObservabilitySink() {
                    @Override
                    public void onStateTransition(DispatchStateTransitionEvent event) {
                        delegate.onStateTransition(event);
                        if (event.isSystemStateChange()) {
                            callback.accept(event.newState().toStatus());
                        }
                    }

                    @Override public void onAnomaly(DispatchAnomalyEvent event) { delegate.onAnomaly(event); }
                    @Override public void onManifestRejected(ManifestRejectedEvent event) { delegate.onManifestRejected(event); }
                    @Override public void onError(DispatchErrorEvent event) { delegate.onError(event); }
                };
            }

            // 4. Event loop. The countdown ticker and the executor feed events back
            //    through the driver, which only exists once the controller does.
            AsyncNotificationPublisher publisher = new AsyncNotificationPublisher(notificationPublisher);
            DispatchOperationalDriver[] driverRef = new DispatchOperationalDriver[1];

            CountdownTicker countdownTicker = new CountdownTicker(
                    event -> driverRef[0].submitEvent(event),
                    scheduler,
                    clock,
                    wallClock,
                    timing.countdownPeriod());

            MonitorIntentExecutor executor = new MonitorIntentExecutor(
                    countdownTicker, publisher, reader, wallClock);

            DispatchController controller = new DispatchController(
                    initialState, reducer, executor, effectiveSink, wallClock);

            DispatchOperationalDriver driver = new DispatchOperationalDriver(controller);
            driverRef[0] = driver;

            // 5. Decision loop
            FixedRateTicker decisionTicker = new FixedRateTicker(
                    scheduler, clock, timing.decisionPeriod(),
                    () -> driver.submitEvent(new TickEvent.DecisionTick(wallClock.now())));

            DispatchProductionRuntime runtime = new DispatchProductionRuntime(
                    driver, reader, decisionTicker, countdownTicker, publisher,
                    schedulerExec, effectiveSink, wallClock);

            reader.setTagSink(runtime::onTagsObserved);
            return runtime;
        }
    }
}
