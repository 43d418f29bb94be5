package com.logx.analyzer.analysis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.logx.analyzer.detection.MatchDetail;
import com.logx.analyzer.detection.RuleMatchResult;
import com.logx.analyzer.detection.RuleType;
import com.logx.analyzer.detection.Severity;
import com.logx.analyzer.detection.ThreatScore;
import com.logx.analyzer.event.FieldValue;
import com.logx.analyzer.event.LogEvent;
import com.logx.analyzer.timeline.Timeline;
import com.logx.analyzer.timeline.TimelineBuilder;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    @Test
    void shouldStartPending() {
        Analysis analysis = Analysis.create("u1");

        assertNotNull(analysis.getId());
        assertEquals("u1", analysis.getUploadId());
        assertEquals(AnalysisStatus.PENDING, analysis.getStatus());
        assertEquals("low", analysis.getSeverity());
        assertNotNull(analysis.getStartTime());
        assertNull(analysis.getCompletionTime());
        assertTrue(analysis.getRuleMatches().isEmpty());
    }

    @Test
    void shouldMoveForwardOnly() {
        Analysis analysis = Analysis.create("u1");
        assertTrue(analysis.markProcessing());
        assertTrue(analysis.complete());

        assertFalse(analysis.fail(AnalysisErrorKind.INTERNAL, "late"));
        assertFalse(analysis.cancel("late"));
        assertFalse(analysis.complete());
        assertThrows(IllegalStateException.class, analysis::markProcessing);
        assertEquals(AnalysisStatus.COMPLETED, analysis.getStatus());
        assertNull(analysis.getErrorMessage());
    }

    @Test
    void shouldNotStartOnceCancelled() {
        Analysis analysis = Analysis.create("u1");
        assertTrue(analysis.cancel("stop"));

        assertFalse(analysis.markProcessing());
        assertEquals(AnalysisStatus.CANCELLED, analysis.getStatus());
        assertEquals(AnalysisErrorKind.CANCELLED, analysis.getErrorKind());
        assertEquals("stop", analysis.getErrorMessage());
    }

    @Test
    void shouldIgnorePhaseOutputAfterTerminalStatus() {
        Analysis analysis = Analysis.create("u1");
        analysis.markProcessing();
        analysis.updateProgress(30);
        analysis.fail(AnalysisErrorKind.PARSE_FAILURE, "Parsing failed: bad");

        analysis.updateProgress(90);
        analysis.attachEventCount(12);
        analysis.attachRuleMatches(List.of(match()));
        analysis.attachThreatScore(new ThreatScore(90, Severity.CRITICAL));
        analysis.attachSummary("too late");
        analysis.recordParser("line");

        assertEquals(30, analysis.getProgress());
        assertEquals(0, analysis.getEventCount());
        assertTrue(analysis.getRuleMatches().isEmpty());
        assertEquals(0, analysis.getThreatScore());
        assertEquals("low", analysis.getSeverity());
        assertNull(analysis.getSummary());
        assertNull(analysis.getParserId());
    }

    @Test
    void shouldNeverDecreaseProgress() {
        Analysis analysis = Analysis.create("u1");
        analysis.markProcessing();

        analysis.updateProgress(50);
        analysis.updateProgress(20);
        analysis.updateProgress(150);

        assertEquals(100, analysis.getProgress());
    }

    @Test
    void shouldTakeSnapshotUnaffectedByLaterPhases() {
        Analysis analysis = Analysis.create("u1");
        analysis.markProcessing();
        analysis.updateProgress(60);

        Analysis snapshot = analysis.snapshot();
        LogEvent event = new LogEvent(T0, "INFO", "sshd", "session opened", 1, "INFO session opened", Map.of());
        analysis.attachTimeline(new TimelineBuilder().build(List.of(event), List.of(), CancellationToken.create()));
        analysis.updateProgress(80);
        analysis.complete();

        assertEquals(analysis.getId(), snapshot.getId());
        assertEquals(AnalysisStatus.PROCESSING, snapshot.getStatus());
        assertEquals(60, snapshot.getProgress());
        assertTrue(snapshot.getTimeline().isEmpty());
        assertEquals(0, snapshot.getTimelineStatistics().totalEvents());
        assertNull(snapshot.getCompletionTime());

        assertEquals(1, analysis.getTimeline().size());
        assertEquals(1, analysis.getTimelineStatistics().totalEvents());
    }

    @Test
    void shouldSurviveJsonRoundTrip() throws Exception {
        ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        Analysis analysis = Analysis.create("u1");
        analysis.markProcessing();
        analysis.recordFile("auth.log", 42, "LOG", "ab".repeat(32));
        analysis.recordParser("line");
        analysis.attachEventCount(1);
        List<RuleMatchResult> matches = List.of(match());
        analysis.attachRuleMatches(matches);
        analysis.attachThreatScore(new ThreatScore(75, Severity.HIGH));
        LogEvent event = new LogEvent(T0, "ERROR", "sshd", "Failed password", 1, "ERROR Failed password",
                Map.of("port", FieldValue.of(22), "user", FieldValue.of("root")));
        Timeline timeline = new TimelineBuilder().build(List.of(event), matches, CancellationToken.create());
        analysis.attachTimeline(timeline);
        analysis.attachSummary("summary");
        analysis.complete();

        Analysis restored = mapper.readValue(mapper.writeValueAsString(analysis), Analysis.class);

        assertEquals(analysis.getId(), restored.getId());
        assertEquals("u1", restored.getUploadId());
        assertEquals("auth.log", restored.getFileName());
        assertEquals(42, restored.getFileSize());
        assertEquals("LOG", restored.getFileType());
        assertEquals(analysis.getFileHash(), restored.getFileHash());
        assertEquals("line", restored.getParserId());
        assertEquals(AnalysisStatus.COMPLETED, restored.getStatus());
        assertEquals(100, restored.getProgress());
        assertEquals(75, restored.getThreatScore());
        assertEquals("high", restored.getSeverity());
        assertEquals("summary", restored.getSummary());
        assertEquals(analysis.getStartTime(), restored.getStartTime());
        assertEquals(analysis.getCompletionTime(), restored.getCompletionTime());
        assertEquals(1, restored.getEventCount());

        assertEquals(matches, restored.getRuleMatches());
        assertEquals(2, restored.getTimeline().size());
        assertEquals(timeline.events(), restored.getTimeline());
        assertEquals(2, restored.getTimelineStatistics().totalEvents());
        assertEquals(FieldValue.of(22), restored.getTimeline().get(0).fields().get("port"));
    }

    private static RuleMatchResult match() {
        return new RuleMatchResult("r1", "Failed login", RuleType.SIGMA, Severity.HIGH, 1, 0.9,
                List.of(MatchDetail.of("Failed password", 1, T0.plusSeconds(5))),
                List.of("T1110"), Map.of("author", FieldValue.of("soc")));
    }
}
