package com.pantheon.dispatch.monitor.internal.exec;

import com.pantheon.dispatch.monitor.internal.state.DispatchIntents;

/**
 * DispatchIntentExecutor
 * -----------------------------------------------------------------------------
 * Boundary between the pure dispatch state machine and the side-effecting world
 * of timers, notifications and the reader.
 *
 * <p>It is the only layer allowed to start or stop the departure countdown,
 * hand notifications to the outbound publisher, and talk to the reader driver.
 * Everything above it is deterministic.</p>
 *
 * <p>Execution must be non-blocking: it runs on the monitor's event loop. Any
 * consequence that should affect state (a countdown tick, for example) comes
 * back as a new event.</p>
 */
public interface DispatchIntentExecutor
{
    void execute(DispatchIntents intents);
}
