package com.pantheon.dispatch.monitor.internal.state;

import com.pantheon.dispatch.api.ShipmentManifest;
import com.pantheon.dispatch.monitor.tagdb.InMemoryTagDatabase;
import com.pantheon.dispatch.monitor.tagdb.TagDocument;
import com.pantheon.dispatch.monitor.testing.DispatchFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TagDatabaseCompletenessPredicateTest {

    private InMemoryTagDatabase db;
    private TagDatabaseCompletenessPredicate predicate;
    private ShipmentManifest manifest;

    @BeforeEach
    void setUp() {
        db = DispatchFixtures.tagDatabase();
        predicate = new TagDatabaseCompletenessPredicate(db);
        manifest = DispatchFixtures.widgetsAndGadget("S-1");
    }

    @Test
    void exactProductCountsAreComplete() {
        assertTrue(predicate.isComplete(manifest, Set.of("E001", "E002", "E101")));
        assertTrue(predicate.isComplete(manifest, Set.of("E001", "E003", "E102")));
    }

    @Test
    void missingItemIsIncomplete() {
        assertFalse(predicate.isComplete(manifest, Set.of("E001", "E101")));
    }

    @Test
    void surplusItemIsIncomplete() {
        assertFalse(predicate.isComplete(manifest, Set.of("E001", "E002", "E003", "E101")));
    }

    @Test
    void wrongProductMixIsIncomplete() {
        assertFalse(predicate.isComplete(manifest, Set.of("E001", "E101", "E102")));
    }

    @Test
    void unknownTagIsIncomplete() {
        assertFalse(predicate.isComplete(manifest, Set.of("E001", "E002", "FFFF")));
    }

    @Test
    void seesTagDatabaseUpdates() {
        Set<String> tags = Set.of("E001", "E002", "E200");
        assertFalse(predicate.isComplete(manifest, tags));

        db.put("E200", new TagDocument("E200", "GADGET", "Gadget, late registration"));
        assertTrue(predicate.isComplete(manifest, tags));
    }

    @Test
    void lowerCaseDatabaseEntriesResolveDecodedReads() {
        db.delete("E001");
        db.put("e0ab", new TagDocument("e0ab", "WIDGET", "Widget"));

        assertTrue(predicate.isComplete(manifest, Set.of("E0AB", "E002", "E101")));
    }
}
