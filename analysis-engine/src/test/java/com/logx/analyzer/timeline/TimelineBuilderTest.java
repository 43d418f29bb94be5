package com.logx.analyzer.timeline;

import com.logx.analyzer.analysis.AnalysisCancelledException;
import com.logx.analyzer.analysis.CancellationToken;
import com.logx.analyzer.detection.MatchDetail;
import com.logx.analyzer.detection.RuleMatchResult;
import com.logx.analyzer.detection.RuleType;
import com.logx.analyzer.detection.Severity;
import com.logx.analyzer.event.FieldValue;
import com.logx.analyzer.event.LogEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class TimelineBuilderTest {

    private static final Instant BASE = Instant.parse("2024-03-01T10:15:00Z");

    private TimelineBuilder builder;
    private CancellationToken token;

    @BeforeEach
    void setUp() {
        builder = new TimelineBuilder();
        token = CancellationToken.create();
    }

    @Test
    void shouldEmitOneEntryPerEventAndPerMatchDetail() {
        List<LogEvent> events = List.of(event(0, "INFO", "a"), event(60, "ERROR", "b"), event(120, "WARN", "c"));
        List<RuleMatchResult> matches = List.of(
                ruleMatch("r1", Severity.HIGH, detail(30), detail(90)),
                ruleMatch("r2", Severity.LOW, detail(150)));

        Timeline timeline = builder.build(events, matches, token);

        assertEquals(events.size() + 3, timeline.events().size());
        assertEquals(6, timeline.statistics().totalEvents());
        assertEquals(3, timeline.statistics().anomalousEvents());
    }

    @Test
    void shouldSortAscendingForAnyInputOrder() {
        List<LogEvent> events = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            events.add(event(i * 45, "INFO", "line " + i));
        }
        Collections.shuffle(events, new Random(42));
        List<RuleMatchResult> matches = List.of(ruleMatch("r1", Severity.MEDIUM, detail(500), detail(10)));

        Timeline timeline = builder.build(events, matches, token);

        List<TimelineEvent> entries = timeline.events();
        for (int i = 1; i < entries.size(); i++) {
            assertFalse(entries.get(i).timestamp().isBefore(entries.get(i - 1).timestamp()));
        }
        assertEquals(entries.get(0).timestamp(), timeline.statistics().firstEvent());
        assertEquals(entries.get(entries.size() - 1).timestamp(), timeline.statistics().lastEvent());
    }

    @Test
    void shouldKeepLogEventsAheadOfRuleMatchesOnEqualTimestamps() {
        Timeline timeline = builder.build(
                List.of(event(0, "INFO", "first"), event(0, "INFO", "second")),
                List.of(ruleMatch("r1", Severity.HIGH, detail(0))),
                token);

        List<TimelineEvent> entries = timeline.events();
        assertEquals("first", entries.get(0).title());
        assertEquals("second", entries.get(1).title());
        assertEquals(TimelineEventType.RULE_MATCH, entries.get(2).type());
    }

    @Test
    void shouldDeriveSeverityFromLogLevel() {
        assertEquals("critical", TimelineBuilder.severityForLevel("CRITICAL"));
        assertEquals("critical", TimelineBuilder.severityForLevel("fatal"));
        assertEquals("high", TimelineBuilder.severityForLevel("Error"));
        assertEquals("medium", TimelineBuilder.severityForLevel("warning"));
        assertEquals("medium", TimelineBuilder.severityForLevel("WARN"));
        assertEquals("low", TimelineBuilder.severityForLevel("info"));
        assertEquals("info", TimelineBuilder.severityForLevel("debug"));
        assertEquals("info", TimelineBuilder.severityForLevel("TRACE"));
        assertEquals("info", TimelineBuilder.severityForLevel("notice"));
        assertEquals("info", TimelineBuilder.severityForLevel(null));
    }

    @Test
    void shouldDescribeLogEvents() {
        TimelineEvent entry = builder.build(List.of(event(0, "ERROR", "disk full")), List.of(), token)
                .events().get(0);

        assertEquals(TimelineEventType.LOG_EVENT, entry.type());
        assertEquals("disk full", entry.title());
        assertEquals("disk full", entry.description());
        assertEquals("high", entry.severity());
        assertEquals("sshd", entry.source());
        assertEquals("log", entry.category());
        assertEquals(List.of("error"), entry.tags());
        assertFalse(entry.anomalous());
        assertEquals(1, entry.lineNumber());
        assertEquals(FieldValue.of("root"), entry.fields().get("user"));
    }

    @Test
    void shouldDescribeRuleMatches() {
        RuleMatchResult match = new RuleMatchResult("sigma-42", "Suspicious Shell", RuleType.SIGMA,
                Severity.CRITICAL, 1, 0.9,
                List.of(new MatchDetail("bash -i", 10L, 7, "exec bash -i", Map.of(), BASE, 1.0)),
                List.of("T1059.004"), Map.of());

        TimelineEvent entry = builder.build(List.of(), List.of(match), token).events().get(0);

        assertEquals(TimelineEventType.RULE_MATCH, entry.type());
        assertEquals("Rule Match: Suspicious Shell", entry.title());
        assertEquals("bash -i", entry.description());
        assertEquals("critical", entry.severity());
        assertEquals("rule_engine", entry.source());
        assertEquals("detection", entry.category());
        assertTrue(entry.anomalous());
        assertEquals(0.9, entry.confidence(), 1e-9);
        assertEquals(List.of("sigma", "T1059.004"), entry.tags());
        assertEquals(List.of("T1059.004"), entry.mitreAttackIds());
        assertEquals(7, entry.lineNumber());
        assertEquals(FieldValue.of("sigma-42"), entry.fields().get("rule_id"));
        assertEquals(FieldValue.of("Suspicious Shell"), entry.fields().get("rule_name"));
        assertEquals(FieldValue.of("sigma"), entry.fields().get("rule_type"));
        assertEquals(FieldValue.of(0.9), entry.fields().get("confidence"));
        assertEquals(FieldValue.of("exec bash -i"), entry.fields().get("context"));
    }

    @Test
    void shouldPlaceUntimedMatchesAtBuildTime() {
        Instant before = Instant.now();
        RuleMatchResult match = ruleMatch("r1", Severity.HIGH, MatchDetail.of("x", 1, null));

        TimelineEvent entry = builder.build(List.of(), List.of(match), token).events().get(0);

        assertFalse(entry.timestamp().isBefore(before));
        assertFalse(entry.timestamp().isAfter(Instant.now()));
    }

    @Test
    void shouldComputeStatistics() {
        List<LogEvent> events = List.of(
                event(0, "INFO", "a"),
                event(1800, "ERROR", "b"),
                new LogEvent(BASE.plusSeconds(3700), "INFO", "", "c", 3, "c", Map.of()));
        List<RuleMatchResult> matches = List.of(ruleMatch("r1", Severity.HIGH, detail(60)));

        TimelineStatistics stats = builder.build(events, matches, token).statistics();

        assertEquals(4, stats.totalEvents());
        assertEquals(BASE, stats.firstEvent());
        assertEquals(BASE.plusSeconds(3700), stats.lastEvent());
        assertEquals(Duration.ofSeconds(3700), stats.timeRange());
        assertEquals(3L, stats.eventsByType().get("log_event"));
        assertEquals(1L, stats.eventsByType().get("rule_match"));
        assertEquals(2L, stats.eventsBySeverity().get("high"));
        assertEquals(2L, stats.eventsBySource().get("sshd"));
        assertEquals(1L, stats.eventsBySource().get("rule_engine"));
        assertFalse(stats.eventsBySource().containsKey(""));
        assertEquals(3L, stats.eventsByCategory().get("log"));
        assertEquals(3L, stats.eventsByHour().get(Instant.parse("2024-03-01T10:00:00Z")));
        assertEquals(1L, stats.eventsByHour().get(Instant.parse("2024-03-01T11:00:00Z")));
        assertEquals("info", stats.topTags().get(0));
        assertEquals(1L, stats.anomalousEvents());
    }

    @Test
    void shouldLimitTopTagsToTen() {
        List<RuleMatchResult> matches = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            matches.add(new RuleMatchResult("r" + i, "Rule " + i, RuleType.YARA, Severity.LOW, 1, 1.0,
                    List.of(detail(i)), List.of(String.format("T%04d", 1000 + i)), Map.of()));
        }

        TimelineStatistics stats = builder.build(List.of(), matches, token).statistics();

        assertEquals(10, stats.topTags().size());
        assertEquals("yara", stats.topTags().get(0));
    }

    @Test
    void shouldReturnEmptyTimelineForNoInput() {
        Timeline timeline = builder.build(List.of(), List.of(), token);

        assertTrue(timeline.events().isEmpty());
        assertEquals(0, timeline.statistics().totalEvents());
        assertNull(timeline.statistics().firstEvent());
        assertEquals(Duration.ZERO, timeline.statistics().timeRange());
    }

    @Test
    void shouldAbortWhenCancelled() {
        token.cancel();

        assertThrows(AnalysisCancelledException.class,
                () -> builder.build(List.of(event(0, "INFO", "a")), List.of(), token));
    }

    private static LogEvent event(int offsetSeconds, String level, String message) {
        return new LogEvent(BASE.plusSeconds(offsetSeconds), level, "sshd", message, 1, message,
                Map.of("user", FieldValue.of("root")));
    }

    private static MatchDetail detail(int offsetSeconds) {
        return MatchDetail.of("match at " + offsetSeconds, 1, BASE.plusSeconds(offsetSeconds));
    }

    private static RuleMatchResult ruleMatch(String id, Severity severity, MatchDetail... details) {
        return new RuleMatchResult(id, "Rule " + id, RuleType.SIGMA, severity, details.length, 1.0,
                List.of(details), List.of(), Map.of());
    }
}
