package com.pantheon.dispatch.api;

/**
 * SystemState
 * -----------------------------------------------------------------------------
 * The closed set of states of the dispatch monitor. Exactly one holds at any
 * instant.
 */
public enum SystemState
{
    /** No tags read, no shipment expected. */
    IDLE,

    /** Manifest installed, departure window still open, shipment not yet complete. */
    TRUCK_DEPARTING,

    /** Departure window closed before the shipment was complete. */
    MISSING_TAGS,

    /** Tags were read with no active shipment to explain them. */
    EXTRA_TAGS,

    /** Tags read exactly match the active manifest. */
    SHIPMENT_COMPLETE,

    /** The monitor's own bookkeeping is inconsistent; recovered by a hard reset. */
    INVALID
}
