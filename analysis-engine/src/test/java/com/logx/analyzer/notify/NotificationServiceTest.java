package com.logx.analyzer.notify;

import com.logx.analyzer.analysis.AnalysisStatus;
import com.logx.analyzer.detection.RuleMatchResult;
import com.logx.analyzer.detection.RuleType;
import com.logx.analyzer.detection.Severity;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NotificationServiceTest {

    private SimpleMeterRegistry registry;
    private RecordingNotifier recorder;
    private NotificationService service;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        recorder = new RecordingNotifier();
        service = new NotificationService(List.of(new FailingNotifier(), recorder), registry);
    }

    @Test
    void shouldDeliverProgressDespiteFailingChannel() {
        service.progress("a1", 30, "File parsed successfully");

        assertEquals(1, recorder.progress.size());
        ProgressUpdate update = recorder.progress.get(0);
        assertEquals("a1", update.analysisId());
        assertEquals(30, update.percent());
        assertEquals("File parsed successfully", update.message());
        assertNotNull(update.timestamp());

        assertEquals(1.0, registry.get("logx.notify.sent").counter().count());
        assertEquals(1.0, registry.get("logx.notify.failed").counter().count());
    }

    @Test
    void shouldBuildRuleMatchNotice() {
        RuleMatchResult match = new RuleMatchResult("sigma-7", "Brute force", RuleType.SIGMA, Severity.HIGH,
                12, 0.8, List.of(), List.of("T1110"), null);

        service.ruleMatch("a1", match);

        RuleMatchNotice notice = recorder.ruleMatches.get(0);
        assertEquals("a1", notice.analysisId());
        assertEquals("sigma-7", notice.ruleId());
        assertEquals("sigma", notice.ruleType());
        assertEquals("high", notice.severity());
        assertEquals(12, notice.matchCount());
        assertEquals(List.of("T1110"), notice.mitreAttackIds());
    }

    @Test
    void shouldDeliverCompletionAndErrors() {
        AnalysisCompletedPayload payload = new AnalysisCompletedPayload("a1", "auth.log", "abc",
                AnalysisStatus.COMPLETED, 75, "high", Instant.now(), 3);

        service.completed(payload);
        service.error("a2", "Parsing failed: bad header");

        assertEquals(List.of(payload), recorder.completed);
        assertEquals(List.of("a2: Parsing failed: bad header"), recorder.errors);
        assertEquals(2.0, registry.get("logx.notify.failed").counter().count());
    }

    @Test
    void shouldClampProgressPercent() {
        assertEquals(100, ProgressUpdate.of("a1", 140, "x").percent());
        assertEquals(0, ProgressUpdate.of("a1", -5, "x").percent());
    }

    static class RecordingNotifier implements ProgressNotifier {
        final List<ProgressUpdate> progress = new ArrayList<>();
        final List<RuleMatchNotice> ruleMatches = new ArrayList<>();
        final List<AnalysisCompletedPayload> completed = new ArrayList<>();
        final List<String> errors = new ArrayList<>();

        @Override
        public void onProgress(ProgressUpdate update) {
            progress.add(update);
        }

        @Override
        public void onRuleMatch(RuleMatchNotice notice) {
            ruleMatches.add(notice);
        }

        @Override
        public void onCompleted(AnalysisCompletedPayload payload) {
            completed.add(payload);
        }

        @Override
        public void onError(String analysisId, String message) {
            errors.add(analysisId + ": " + message);
        }
    }

    static class FailingNotifier implements ProgressNotifier {
        @Override
        public void onProgress(ProgressUpdate update) {
            throw new IllegalStateException("channel down");
        }

        @Override
        public void onRuleMatch(RuleMatchNotice notice) {
            throw new IllegalStateException("channel down");
        }

        @Override
        public void onCompleted(AnalysisCompletedPayload payload) {
            throw new IllegalStateException("channel down");
        }

        @Override
        public void onError(String analysisId, String message) {
            throw new IllegalStateException("channel down");
        }
    }
}
