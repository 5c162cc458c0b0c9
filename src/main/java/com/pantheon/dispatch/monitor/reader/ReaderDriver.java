package com.pantheon.dispatch.monitor.reader;

/**
 * ReaderDriver
 * -----------------------------------------------------------------------------
 * Port to the physical RFID reader.
 *
 * <p>The driver turns radio reports into sets of tag identifiers and pushes them
 * into the registered {@link TagIngestionSink}. The monitor consumes only what
 * is declared here: whether the reader is active (a precondition for accepting
 * a manifest) and a request to re-synchronise after a protocol fault.</p>
 */
public interface ReaderDriver
{
    /**
     * Registers the sink for decoded tag batches. Must be called before
     * {@link #start()}.
     */
    void setTagSink(TagIngestionSink sink);

    void start();

    void stop();

    /**
     * Whether the reader is currently delivering reports.
     */
    boolean isActive();

    /**
     * Asks the reader to drop its own buffered state and report afresh. Called
     * by the monitor on a hard reset. Must not block.
     */
    void resynchronize();
}
