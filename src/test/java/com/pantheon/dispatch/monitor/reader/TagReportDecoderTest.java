package com.pantheon.dispatch.monitor.reader;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TagReportDecoderTest {

    private final TagReportDecoder decoder = new TagReportDecoder();

    private Optional<Set<String>> decode(String report) {
        return decoder.decode(report.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void acceptsMixedSeparators() {
        assertEquals(Set.of("E001", "E002", "E003", "E004"),
                decode("E001 E002,E003;\nE004\n").orElseThrow());
    }

    @Test
    void normalisesToUpperCase() {
        assertEquals(Set.of("3000ABCD"), decode("3000abcd").orElseThrow());
    }

    @Test
    void collapsesDuplicatesWithinAReport() {
        assertEquals(Set.of("E001"), decode("E001 e001 E001").orElseThrow());
    }

    @Test
    void dropsNonHexTokens() {
        assertEquals(Set.of("E001"), decode("READER-7 E001 ok").orElseThrow());
    }

    @Test
    void reportWithoutIdentifiersIsEmpty() {
        assertTrue(decode("").isEmpty());
        assertTrue(decode("   \n").isEmpty());
        assertTrue(decode("heartbeat").isEmpty());
    }
}
