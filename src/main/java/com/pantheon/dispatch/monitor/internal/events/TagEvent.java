package com.pantheon.dispatch.monitor.internal.events;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * TagEvent
 * -----------------------------------------------------------------------------
 * Events originating from the RFID reader driver.
 */
public sealed interface TagEvent extends DispatchEvent
        permits TagEvent.TagsObserved
{
    /**
     * A batch of tag identifiers was decoded from one reader report.
     *
     * <p>Duplicates across batches are expected; the reader reports a tag every
     * time it passes an antenna.</p>
     */
    final class TagsObserved extends DispatchEvent.Base implements TagEvent {
        private final Set<String> tagIds;

        public TagsObserved(Instant timestamp, Set<String> tagIds) {
            super(timestamp);
            this.tagIds = Set.copyOf(Objects.requireNonNull(tagIds, "tagIds"));
        }

        public Set<String> tagIds() {
            return tagIds;
        }
    }
}
