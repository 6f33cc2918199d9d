package com.aejis.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProcessingResultTest {

    @Test
    void builderDeduplicatesFindings() {
        var result = ProcessingResult.builder("text")
                .behavior("SENSITIVE_DATA: password")
                .behavior("SENSITIVE_DATA: password")
                .indicator("HIGH_ENTROPY: 7.9")
                .build();

        assertEquals(List.of("SENSITIVE_DATA: password"), result.behaviors());
        assertTrue(result.success());
        assertTrue(result.secureProcessing());
    }

    @Test
    void scoreIsClamped() {
        var result = ProcessingResult.builder("text").build();

        assertEquals(0, result.withBehavioralScore(-20).behavioralScore());
        assertEquals(100, result.withBehavioralScore(250).behavioralScore());
    }

    @Test
    void nullFieldsGetDefaults() {
        var result = new ProcessingResult(true, null, null, null, null, null, null, 50, 0, null, true, null, null);

        assertEquals("unknown", result.previewType());
        assertEquals("", result.content());
        assertEquals(Map.of(), result.metadata());
        assertEquals(List.of(), result.behaviors());
    }

    @Test
    void mergeFindingsNestsMetadata() {
        var outer = ProcessingResult.builder("archive").metadata("entries", 2)
                .behavior("ARCHIVE_RISK: nested").build();
        var inner = ProcessingResult.builder("text").metadata("lines", 4)
                .behavior("SENSITIVE_DATA: api key").build();

        var merged = outer.mergeFindings("a.txt", inner);

        assertEquals("archive", merged.previewType());
        assertEquals(Map.of("lines", 4), merged.metadata().get("a.txt"));
        assertEquals(2, merged.behaviors().size());
    }

    @Test
    void failureIsUnsuccessful() {
        var result = ProcessingResult.failure("pdf", "broken", "MALFORMED");

        assertFalse(result.success());
        assertEquals("MALFORMED", result.errorCode());
    }
}
