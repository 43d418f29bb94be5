package com.logx.analyzer.detection;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ThreatScoreAggregatorTest {

    private ThreatScoreAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new ThreatScoreAggregator();
    }

    @Test
    void shouldScoreZeroWithoutMatches() {
        ThreatScore score = aggregator.aggregate(List.of());

        assertEquals(0, score.score());
        assertEquals(Severity.LOW, score.severity());
        assertEquals(0, aggregator.aggregate(null).score());
    }

    @Test
    void shouldScoreSingleLowMatchAs25() {
        ThreatScore score = aggregator.aggregate(List.of(match(Severity.LOW, 1, 1.0)));

        assertEquals(25, score.score());
        assertEquals("low", score.severity().getLabel());
    }

    @Test
    void shouldScoreSingleCriticalMatchAs100() {
        ThreatScore score = aggregator.aggregate(List.of(match(Severity.CRITICAL, 1, 1.0)));

        assertEquals(100, score.score());
        assertEquals("critical", score.severity().getLabel());
    }

    @Test
    void shouldWeightByMatchCount() {
        // (100 * 1 + 25 * 3) / 4 = 43.75
        ThreatScore score = aggregator.aggregate(List.of(
                match(Severity.CRITICAL, 1, 1.0),
                match(Severity.LOW, 3, 1.0)));

        assertEquals(43, score.score());
        assertEquals(Severity.MEDIUM, score.severity());
    }

    @Test
    void shouldWeightByConfidence() {
        ThreatScore score = aggregator.aggregate(List.of(match(Severity.HIGH, 1, 0.5)));

        assertEquals(37, score.score());
        assertEquals(Severity.MEDIUM, score.severity());
    }

    @Test
    void shouldScoreInfoMatchesWithFallbackBase() {
        ThreatScore score = aggregator.aggregate(List.of(match(Severity.INFO, 2, 1.0)));

        assertEquals(10, score.score());
        assertEquals(Severity.LOW, score.severity());
    }

    @Test
    void shouldBeMonotonicInConfidenceAndSeverity() {
        int previous = -1;
        for (double confidence = 0.0; confidence <= 1.0; confidence += 0.1) {
            int score = aggregator.aggregate(List.of(match(Severity.HIGH, 2, confidence))).score();
            assertTrue(score >= previous, "score dropped at confidence " + confidence);
            previous = score;
        }

        int low = aggregator.aggregate(List.of(match(Severity.LOW, 1, 0.8))).score();
        int medium = aggregator.aggregate(List.of(match(Severity.MEDIUM, 1, 0.8))).score();
        int high = aggregator.aggregate(List.of(match(Severity.HIGH, 1, 0.8))).score();
        int critical = aggregator.aggregate(List.of(match(Severity.CRITICAL, 1, 0.8))).score();
        assertTrue(low <= medium && medium <= high && high <= critical);
    }

    @Test
    void shouldNeverExceed100() {
        ThreatScore score = aggregator.aggregate(List.of(
                match(Severity.CRITICAL, 50, 1.0),
                match(Severity.CRITICAL, 7, 1.0)));

        assertEquals(100, score.score());
    }

    @Test
    void shouldMapScoreBoundariesToSeverity() {
        assertEquals(Severity.CRITICAL, Severity.fromScore(80));
        assertEquals(Severity.HIGH, Severity.fromScore(79));
        assertEquals(Severity.HIGH, Severity.fromScore(60));
        assertEquals(Severity.MEDIUM, Severity.fromScore(59));
        assertEquals(Severity.MEDIUM, Severity.fromScore(30));
        assertEquals(Severity.LOW, Severity.fromScore(29));
    }

    @Test
    void shouldClampMatchCountAndConfidence() {
        RuleMatchResult result = new RuleMatchResult("r1", "Rule", RuleType.SIGMA, Severity.HIGH,
                0, 1.7, null, null, null);

        assertEquals(1, result.matchCount());
        assertEquals(1.0, result.confidence());
        assertTrue(result.matches().isEmpty());
    }

    private static RuleMatchResult match(Severity severity, int count, double confidence) {
        return new RuleMatchResult("rule-" + severity.getLabel(), "Rule " + severity.getLabel(),
                RuleType.SIGMA, severity, count, confidence, List.of(), List.of(), null);
    }
}
