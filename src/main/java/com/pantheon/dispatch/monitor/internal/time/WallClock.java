package com.pantheon.dispatch.monitor.internal.time;

import java.time.Instant;

/**
 * Wall-clock source for event, notification and status timestamps.
 *
 * <p>May jump with NTP or manual adjustment. Never used to measure periods.</p>
 */
public interface WallClock
{
    Instant now();
}
