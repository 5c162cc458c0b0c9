package com.pantheon.dispatch.monitor.tagdb;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * TagDatabase
 * -----------------------------------------------------------------------------
 * Port to the store that maps tag identifiers to product records.
 *
 * <p>The monitor only reads from it, once per tag per decision, to check a
 * shipment for completeness. Implementations decide their own caching. Lookups
 * happen on the monitor's event loop, so a remote implementation should answer
 * from memory rather than block on the network.</p>
 *
 * <p>Tag identifiers are compared in canonical form, see
 * {@link #canonicalTagId(String)}. Readers report the same form.</p>
 */
public interface TagDatabase
{
    /**
     * Stores (or replaces) the document for {@code tagId}.
     */
    void put(String tagId, TagDocument document);

    /**
     * Returns the document for {@code tagId}, or empty when the tag is unknown.
     */
    Optional<TagDocument> get(String tagId);

    /**
     * Removes the document for {@code tagId}, if present.
     */
    void delete(String tagId);

    /**
     * Canonical form of an EPC identifier: trimmed and upper-cased.
     */
    static String canonicalTagId(String tagId) {
        return Objects.requireNonNull(tagId, "tagId").trim().toUpperCase(Locale.ROOT);
    }
}
