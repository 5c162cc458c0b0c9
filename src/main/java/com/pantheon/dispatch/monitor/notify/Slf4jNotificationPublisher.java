package com.pantheon.dispatch.monitor.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link NotificationPublisher} that writes notifications to the log. Used when
 * no delivery channel is configured.
 */
public final class Slf4jNotificationPublisher implements NotificationPublisher
{
    private static final Logger log = LoggerFactory.getLogger(Slf4jNotificationPublisher.class);

    @Override
    public void publish(DispatchNotification notification) {
        String shipment = notification.manifest()
                .map(m -> m.shipmentId())
                .orElse("none");

        switch (notification.kind()) {
            case SHIPMENT_COMPLETE -> log.info("Shipment {} complete: {} tags read",
                    shipment, notification.tagsRead().size());
            case MISSING_TAGS -> log.warn("Shipment {} departed with missing tags: {} of {} read",
                    shipment,
                    notification.tagsRead().size(),
                    notification.manifest().map(m -> m.expectedItemCount()).orElse(0));
            case EXTRA_TAGS -> log.warn("Unexpected tags read with no active shipment: {}",
                    notification.tagsRead());
        }
    }
}
