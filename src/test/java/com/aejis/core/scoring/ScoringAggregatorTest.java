package com.aejis.core.scoring;

import com.aejis.core.model.ProcessingResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScoringAggregatorTest {

    private final ScoringAggregator scoring = new ScoringAggregator();

    @Test
    @DisplayName("no findings scores 100")
    void cleanIsHundred() {
        assertEquals(100, scoring.score(List.of(), List.of()));
        assertEquals(100, scoring.score(null, null));
    }

    @Test
    void weightsAreSubtracted() {
        int score = scoring.score(
                List.of("SENSITIVE_DATA: password", "MACRO_CONTENT: vbaProject.bin"),
                List.of("EXECUTABLE_CONTENT: PE executable"));

        assertEquals(100 - 10 - 20 - 15, score);
    }

    @Test
    @DisplayName("a finding in both lists counts once")
    void duplicatesCountOnce() {
        String finding = "MALWARE_KEYWORD: ransomware";

        assertEquals(75, scoring.score(List.of(finding), List.of(finding)));
    }

    @Test
    @DisplayName("untagged and INFO findings cost nothing")
    void infoIsFree() {
        assertEquals(100, scoring.score(List.of("INFO: script file", "plain note", "UNKNOWN_TAG: x"), List.of()));
    }

    @Test
    void flooredAtZero() {
        var many = List.of(
                "MALWARE_KEYWORD: a", "MALWARE_KEYWORD: b", "MALWARE_KEYWORD: c",
                "MALWARE_KEYWORD: d", "MALWARE_KEYWORD: e");

        assertEquals(0, scoring.score(many, List.of()));
    }

    @Test
    void categoryPrefixIsCaseInsensitive() {
        assertEquals(SignalCategory.HIGH_ENTROPY, SignalCategory.of("high_entropy: packed"));
        assertEquals(SignalCategory.INFO, SignalCategory.of(":leading colon"));
        assertEquals(SignalCategory.INFO, SignalCategory.of(null));
    }

    @Test
    @DisplayName("rescore ignores the score the container reported")
    void rescoreOverridesReportedScore() {
        ProcessingResult reported = ProcessingResult.builder("text")
                .behavior("NETWORK_EXPLOIT: DDE link")
                .build()
                .withBehavioralScore(100);

        assertEquals(80, scoring.rescore(reported).behavioralScore());
    }

    @Test
    void breakdownCountsDistinctFindings() {
        Map<SignalCategory, Integer> breakdown = scoring.breakdown(
                List.of("ARCHIVE_RISK: a", "ARCHIVE_RISK: b", "INFO: c"),
                List.of("ARCHIVE_RISK: a"));

        assertEquals(2, breakdown.get(SignalCategory.ARCHIVE_RISK));
        assertEquals(1, breakdown.get(SignalCategory.INFO));
    }
}
