package com.pantheon.dispatch.monitor.tagdb;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link TagDatabase} held entirely in memory. Safe for concurrent use.
 * Keys are stored in canonical form, so lookups ignore case.
 */
public final class InMemoryTagDatabase implements TagDatabase
{
    private final ConcurrentHashMap<String, TagDocument> store = new ConcurrentHashMap<>();

    @Override
    public void put(String tagId, TagDocument document) {
        String key = TagDatabase.canonicalTagId(tagId);
        Objects.requireNonNull(document, "document");
        if (!key.equals(TagDatabase.canonicalTagId(document.tagId()))) {
            throw new IllegalArgumentException(
                    "Document for " + document.tagId() + " cannot be stored under " + tagId);
        }
        store.put(key, document);
    }

    @Override
    public Optional<TagDocument> get(String tagId) {
        return Optional.ofNullable(store.get(TagDatabase.canonicalTagId(tagId)));
    }

    @Override
    public void delete(String tagId) {
        store.remove(TagDatabase.canonicalTagId(tagId));
    }

    public int size() {
        return store.size();
    }
}
