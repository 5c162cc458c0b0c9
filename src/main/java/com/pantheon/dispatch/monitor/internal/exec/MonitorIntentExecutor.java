package com.pantheon.dispatch.monitor.internal.exec;

import com.pantheon.dispatch.monitor.internal.state.DispatchIntents;
import com.pantheon.dispatch.monitor.internal.state.MonitorState;
import com.pantheon.dispatch.monitor.internal.time.WallClock;
import com.pantheon.dispatch.monitor.notify.DispatchNotification;
import com.pantheon.dispatch.monitor.notify.NotificationPublisher;
import com.pantheon.dispatch.monitor.reader.ReaderDriver;

import java.util.Objects;

/**
 * MonitorIntentExecutor
 * =============================================================================
 * Production {@link DispatchIntentExecutor}.
 *
 * <p>Intents are realised in a fixed order: stop the countdown, start it,
 * publish notifications, re-synchronise the reader. A reset that also starts a
 * new run therefore leaves the countdown running.</p>
 */
public final class MonitorIntentExecutor implements DispatchIntentExecutor
{
    private final CountdownTicker countdownTicker;
    private final NotificationPublisher publisher;
    private final ReaderDriver readerDriver;
    private final WallClock wallClock;

    public MonitorIntentExecutor(CountdownTicker countdownTicker,
                                 NotificationPublisher publisher,
                                 ReaderDriver readerDriver,
                                 WallClock wallClock)
    {
        this.countdownTicker = Objects.requireNonNull(countdownTicker, "countdownTicker");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.readerDriver = Objects.requireNonNull(readerDriver, "readerDriver");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    @Override
    public void execute(DispatchIntents intents)
    {
        Objects.requireNonNull(intents, "intents");
        if (intents.isEmpty()) {
            return;
        }

        if (intents.contains(DispatchIntents.Kind.STOP_COUNTDOWN)) {
            countdownTicker.stop();
        }

        if (intents.contains(DispatchIntents.Kind.START_COUNTDOWN)) {
            long generation = intents.countdownGeneration()
                    .orElseThrow(() -> new IllegalArgumentException("START_COUNTDOWN without a generation"));
            countdownTicker.start(generation);
        }

        if (intents.contains(DispatchIntents.Kind.NOTIFY_MISSING_TAGS)) {
            publish(DispatchNotification.Kind.MISSING_TAGS, intents);
        }
        if (intents.contains(DispatchIntents.Kind.NOTIFY_EXTRA_TAGS)) {
            publish(DispatchNotification.Kind.EXTRA_TAGS, intents);
        }
        if (intents.contains(DispatchIntents.Kind.NOTIFY_SHIPMENT_COMPLETE)) {
            publish(DispatchNotification.Kind.SHIPMENT_COMPLETE, intents);
        }

        if (intents.contains(DispatchIntents.Kind.RESYNC_READER)) {
            readerDriver.resynchronize();
        }
    }

    private void publish(DispatchNotification.Kind kind, DispatchIntents intents)
    {
        MonitorState subject = intents.subject()
                .orElseThrow(() -> new IllegalArgumentException(kind + " notification without a subject"));

        publisher.publish(new DispatchNotification(
                kind,
                wallClock.now(),
                subject.manifest(),
                subject.tagsRead()));
    }
}
