package com.pantheon.dispatch.monitor.tagdb;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryTagDatabaseTest {

    private InMemoryTagDatabase db;

    @BeforeEach
    void setUp() {
        db = new InMemoryTagDatabase();
    }

    @Test
    void putThenGet() {
        TagDocument doc = new TagDocument("E001", "WIDGET", "Widget");
        db.put("E001", doc);

        assertEquals(doc, db.get("E001").orElseThrow());
        assertEquals(1, db.size());
    }

    @Test
    void putReplaces() {
        db.put("E001", new TagDocument("E001", "WIDGET", "Widget"));
        db.put("E001", new TagDocument("E001", "GADGET", "Relabelled"));

        assertEquals("GADGET", db.get("E001").orElseThrow().productCode());
        assertEquals(1, db.size());
    }

    @Test
    void unknownTagIsAbsent() {
        assertTrue(db.get("FFFF").isEmpty());
    }

    @Test
    void deleteRemoves() {
        db.put("E001", new TagDocument("E001", "WIDGET", "Widget"));
        db.delete("E001");
        db.delete("E001");

        assertTrue(db.get("E001").isEmpty());
        assertEquals(0, db.size());
    }

    @Test
    void documentMustDescribeTheSameTag() {
        assertThrows(IllegalArgumentException.class,
                () -> db.put("E001", new TagDocument("E002", "WIDGET", "Widget")));
    }

    @Test
    void lowerCaseKeysMatchReaderReports() {
        db.put("e0a1", new TagDocument("e0a1", "WIDGET", "Widget"));

        assertEquals("WIDGET", db.get("E0A1").orElseThrow().productCode());
        assertTrue(db.get(" e0A1 ").isPresent());

        db.delete("E0A1");
        assertEquals(0, db.size());
    }
}
