package com.pantheon.dispatch.api;

import java.util.Objects;

/**
 * Raised when a shipment manifest is offered to the monitor at a time it cannot
 * accept one. A rejected manifest leaves the monitor state untouched.
 */
public final class PreconditionViolationException extends RuntimeException
{
    /**
     * Why the manifest was rejected.
     */
    public enum Reason {
        /** The RFID reader is not running, so the shipment could never be observed. */
        READER_INACTIVE,

        /** A dispatch cycle is already in progress. */
        MANIFEST_ACTIVE,

        /** The previous cycle has not yet been reset to idle. */
        CYCLE_NOT_RESET
    }

    private final Reason reason;

    public PreconditionViolationException(Reason reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public Reason reason() {
        return reason;
    }
}
