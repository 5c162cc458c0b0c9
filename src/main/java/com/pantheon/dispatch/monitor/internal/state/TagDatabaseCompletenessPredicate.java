package com.pantheon.dispatch.monitor.internal.state;

import com.pantheon.dispatch.api.ShipmentManifest;
import com.pantheon.dispatch.monitor.tagdb.TagDatabase;
import com.pantheon.dispatch.monitor.tagdb.TagDocument;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * {@link CompletenessPredicate} that resolves each tag read to its product code
 * through the {@link TagDatabase} and compares the result against the manifest.
 *
 * <p>Complete means every tag resolves, and the number of tags per product code
 * equals the manifest's expected quantity for every code, with no code the
 * manifest does not mention. An unknown tag is never part of a complete
 * shipment.</p>
 */
public final class TagDatabaseCompletenessPredicate implements CompletenessPredicate
{
    private final TagDatabase tagDatabase;

    public TagDatabaseCompletenessPredicate(TagDatabase tagDatabase) {
        this.tagDatabase = Objects.requireNonNull(tagDatabase, "tagDatabase");
    }

    @Override
    public boolean isComplete(ShipmentManifest manifest, Set<String> tagsRead) {
        Map<String, Integer> expected = manifest.expectedQuantities();

        // Cheap reject before touching the database.
        if (tagsRead.size() != manifest.expectedItemCount()) {
            return false;
        }

        Map<String, Integer> observed = new HashMap<>();
        for (String tagId : tagsRead) {
            Optional<TagDocument> document = tagDatabase.get(tagId);
            if (document.isEmpty()) {
                return false;
            }
            observed.merge(document.get().productCode(), 1, Integer::sum);
        }
        return observed.equals(expected);
    }
}
