package com.pantheon.dispatch.monitor.notify;

/**
 * Port to whatever delivers dispatch notifications (SMS gateway, email, a
 * message queue).
 *
 * <p>Delivery is fire-and-forget from the monitor's point of view. The monitor
 * calls {@link #publish} from its event loop and never inspects the outcome, so
 * implementations that talk to the network should be wrapped in an
 * {@link AsyncNotificationPublisher}.</p>
 */
public interface NotificationPublisher
{
    void publish(DispatchNotification notification);
}
