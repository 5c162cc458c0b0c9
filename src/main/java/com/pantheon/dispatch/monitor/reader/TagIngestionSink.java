package com.pantheon.dispatch.monitor.reader;

import java.util.Set;

/**
 * Callback surface the reader driver invokes with every decoded batch of tag
 * identifiers.
 *
 * <p>Implementations must be safe to call from the driver's own threads at any
 * rate, and must not block the driver. The monitor's implementation only
 * enqueues the batch.</p>
 */
@FunctionalInterface
public interface TagIngestionSink
{
    void onTagsObserved(Set<String> tagIds);
}
