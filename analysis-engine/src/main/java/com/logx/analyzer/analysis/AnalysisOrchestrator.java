package com.logx.analyzer.analysis;

import com.logx.analyzer.config.AnalyzerProperties;
import com.logx.analyzer.detection.RuleEngine;
import com.logx.analyzer.detection.RuleMatchResult;
import com.logx.analyzer.detection.Severity;
import com.logx.analyzer.detection.ThreatScoreAggregator;
import com.logx.analyzer.event.LogEvent;
import com.logx.analyzer.mitre.MitreMapper;
import com.logx.analyzer.mitre.MitreMappingResult;
import com.logx.analyzer.notify.AnalysisCompletedPayload;
import com.logx.analyzer.notify.NotificationService;
import com.logx.analyzer.parser.LogParser;
import com.logx.analyzer.parser.ParseResult;
import com.logx.analyzer.parser.ParserResolver;
import com.logx.analyzer.storage.EvidenceStorage;
import com.logx.analyzer.timeline.TimelineBuilder;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.EnumMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Central analysis pipeline.
 *
 * <p>
 * Runs one uploaded evidence file through a strictly sequential set of
 * phases, reporting progress before moving on:
 * </p>
 * <ol>
 * <li>resolve the evidence file (5%)</li>
 * <li>read it and compute its SHA-256 (10%)</li>
 * <li>select a parser (15%)</li>
 * <li>parse log events (30%)</li>
 * <li>evaluate detection rules (50%)</li>
 * <li>aggregate the threat score (60%)</li>
 * <li>map to MITRE ATT&amp;CK, if enabled (70%)</li>
 * <li>build the timeline, if enabled (80%)</li>
 * <li>write the summary (90%)</li>
 * <li>finalize, persist and announce (100%)</li>
 * </ol>
 *
 * <p>
 * Expected conditions (missing upload, unknown format, parser or rule-engine
 * errors) end the run as {@code failed} with an {@link AnalysisErrorKind};
 * they are returned, not thrown. Every terminal record is persisted except
 * for a missing upload. Cancellation is cooperative: the run token is checked
 * between phases and inside the mapper and timeline loops, and a cancelled
 * run never writes a summary.
 * </p>
 *
 * @author Naveed Gung
 */
@Service
public class AnalysisOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(AnalysisOrchestrator.class);

    private final EvidenceStorage storage;
    private final AnalysisStore store;
    private final ParserResolver parserResolver;
    private final RuleEngine ruleEngine;
    private final ThreatScoreAggregator scoreAggregator;
    private final MitreMapper mitreMapper;
    private final TimelineBuilder timelineBuilder;
    private final NotificationService notifications;
    private final AnalyzerProperties.Analysis defaults;

    private final Map<String, ActiveRun> activeRuns = new ConcurrentHashMap<>();
    private final ExecutorService workers;

    private final Counter analysesStarted;
    private final Counter analysesCompleted;
    private final Counter analysesFailed;
    private final Counter analysesCancelled;
    private final Timer analysisDuration;

    public AnalysisOrchestrator(
            EvidenceStorage storage,
            AnalysisStore store,
            ParserResolver parserResolver,
            RuleEngine ruleEngine,
            ThreatScoreAggregator scoreAggregator,
            MitreMapper mitreMapper,
            TimelineBuilder timelineBuilder,
            NotificationService notifications,
            AnalyzerProperties properties,
            MeterRegistry meterRegistry) {
        this.storage = storage;
        this.store = store;
        this.parserResolver = parserResolver;
        this.ruleEngine = ruleEngine;
        this.scoreAggregator = scoreAggregator;
        this.mitreMapper = mitreMapper;
        this.timelineBuilder = timelineBuilder;
        this.notifications = notifications;
        this.defaults = properties.getAnalysis();

        AtomicInteger threadIndex = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(defaults.getWorkerThreads(), r -> {
            Thread t = new Thread(r, "analysis-worker-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        analysesStarted = Counter.builder("logx.analysis.started")
                .description("Analyses that entered processing")
                .register(meterRegistry);
        analysesCompleted = Counter.builder("logx.analysis.completed")
                .description("Analyses completed successfully")
                .register(meterRegistry);
        analysesFailed = Counter.builder("logx.analysis.failed")
                .description("Analyses that ended failed")
                .register(meterRegistry);
        analysesCancelled = Counter.builder("logx.analysis.cancelled")
                .description("Analyses cancelled on request or by timeout")
                .register(meterRegistry);
        analysisDuration = Timer.builder("logx.analysis.duration")
                .description("Wall time of one analysis run")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);

        log.info("Analysis orchestrator initialized with {} workers (maxEvents={}, timeout={} min)",
                defaults.getWorkerThreads(), defaults.getMaxEvents(), defaults.getTimeoutMinutes());
    }

    /**
     * Run an analysis on the calling thread.
     *
     * @param uploadId upload holding the evidence file
     * @param options  caller options, null for configured defaults
     * @return the finalized analysis and, unless it completed, the error kind
     */
    public AnalysisOutcome run(String uploadId, AnalysisOptions options) {
        AnalysisOptions resolved = resolve(options);
        return run(uploadId, resolved, Duration.ofMinutes(resolved.timeoutMinutes()));
    }

    /** Synchronous run with an explicit deadline instead of the configured minutes. */
    AnalysisOutcome run(String uploadId, AnalysisOptions resolved, Duration timeout) {
        ActiveRun activeRun = register(Analysis.create(uploadId), timeout);
        return execute(activeRun, resolved);
    }

    /**
     * Submit an analysis to the worker pool.
     *
     * <p>
     * The upload is checked up front so a missing upload is reported
     * immediately; otherwise the returned analysis is still {@code pending}.
     * </p>
     */
    public AnalysisOutcome start(String uploadId, AnalysisOptions options) {
        AnalysisOptions resolved = resolve(options);
        Analysis analysis = Analysis.create(uploadId);

        try {
            if (storage.listFiles(uploadId).isEmpty()) {
                String message = "No files found for upload " + uploadId;
                analysis.fail(AnalysisErrorKind.NOT_FOUND, message);
                return AnalysisOutcome.failure(analysis, AnalysisErrorKind.NOT_FOUND, message);
            }
        } catch (IOException e) {
            String message = "Failed to read upload " + uploadId + ": " + e.getMessage();
            log.error(message, e);
            analysis.fail(AnalysisErrorKind.INTERNAL, message);
            return AnalysisOutcome.failure(analysis, AnalysisErrorKind.INTERNAL, message);
        }

        ActiveRun activeRun = register(analysis, Duration.ofMinutes(resolved.timeoutMinutes()));
        try {
            workers.execute(() -> execute(activeRun, resolved));
        } catch (RejectedExecutionException e) {
            activeRuns.remove(analysis.getId());
            String message = "Analysis could not be scheduled: " + e.getMessage();
            analysis.fail(AnalysisErrorKind.INTERNAL, message);
            return AnalysisOutcome.failure(analysis, AnalysisErrorKind.INTERNAL, message);
        }
        log.info("Analysis {} queued for upload {}", analysis.getId(), uploadId);
        return AnalysisOutcome.success(analysis.snapshot());
    }

    /**
     * Cancel a pending or running analysis.
     *
     * <p>
     * The record turns {@code cancelled} at once; the running phase stops at
     * its next cancellation check. Already persisted output is not undone.
     * </p>
     *
     * @return the cancelled analysis, or empty if no run with that id is active
     */
    public Optional<Analysis> cancel(String analysisId) {
        ActiveRun activeRun = activeRuns.get(analysisId);
        if (activeRun == null) {
            return Optional.empty();
        }
        cancel(activeRun);
        return Optional.of(activeRun.analysis().snapshot());
    }

    /** A snapshot of an active run, otherwise the persisted record. */
    public Optional<Analysis> find(String analysisId) throws IOException {
        ActiveRun activeRun = activeRuns.get(analysisId);
        if (activeRun != null) {
            return Optional.of(activeRun.analysis().snapshot());
        }
        return store.find(analysisId);
    }

    /**
     * Delete an analysis together with its upload and results.
     *
     * <p>
     * An active run is cancelled and marked deleted first; it then finishes
     * without persisting, so the record cannot reappear after this call.
     * </p>
     *
     * @return false if nothing was known under that id
     */
    public boolean delete(String analysisId) throws IOException {
        ActiveRun activeRun = activeRuns.get(analysisId);
        if (activeRun == null) {
            return store.delete(analysisId);
        }
        synchronized (activeRun) {
            activeRun.deleted = true;
        }
        cancel(activeRun);
        store.delete(analysisId);
        purge(activeRun.analysis());
        return true;
    }

    /** Number of runs currently pending or processing. */
    public int activeCount() {
        return activeRuns.size();
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down analysis workers ({} active)", activeRuns.size());
        activeRuns.values().forEach(run -> run.token().cancel());
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }

    private void cancel(ActiveRun activeRun) {
        activeRun.token().cancel();
        Analysis analysis = activeRun.analysis();
        if (analysis.cancel("Analysis was cancelled")) {
            log.info("Analysis {} cancelled", analysis.getId());
            notifications.progress(analysis.getId(), analysis.getProgress(), "Analysis cancelled");
        }
    }

    private void purge(Analysis analysis) throws IOException {
        storage.deleteWorkingDirectory(analysis.getId());
        String uploadId = analysis.getUploadId();
        if (uploadId != null && !uploadId.isBlank()) {
            storage.deleteWorkingDirectory(uploadId);
        }
    }

    // --- pipeline ---

    private AnalysisOutcome execute(ActiveRun activeRun, AnalysisOptions options) {
        Analysis analysis = activeRun.analysis();
        CancellationToken token = activeRun.token();
        String analysisId = analysis.getId();
        long started = System.nanoTime();

        try {
            if (!analysis.markProcessing()) {
                return finish(activeRun);
            }
            analysesStarted.increment();
            log.info("Analysis {} started for upload {}", analysisId, analysis.getUploadId());
            progress(analysis, 5, "Starting analysis");

            // 1. resolve evidence
            List<String> files = storage.listFiles(analysis.getUploadId());
            if (files.isEmpty()) {
                String message = "No files found for upload " + analysis.getUploadId();
                analysis.fail(AnalysisErrorKind.NOT_FOUND, message);
                analysesFailed.increment();
                notifications.error(analysisId, message);
                log.warn("Analysis {} failed: {}", analysisId, message);
                return AnalysisOutcome.failure(analysis, AnalysisErrorKind.NOT_FOUND, message);
            }
            String fileName = files.get(0);

            // 2. read and hash
            byte[] bytes;
            try (InputStream in = storage.openFile(analysis.getUploadId(), fileName)) {
                bytes = in.readAllBytes();
            }
            analysis.recordFile(fileName, bytes.length, fileTypeOf(fileName), sha256(bytes));
            progress(analysis, 10, "File loaded");
            token.throwIfCancellationRequested();

            // 3. select parser
            String content = new String(bytes, StandardCharsets.UTF_8);
            Optional<LogParser> parser = parserResolver.resolve(fileName, content, options.preferredParserId());
            if (parser.isEmpty()) {
                return fail(activeRun, AnalysisErrorKind.UNSUPPORTED_FORMAT,
                        "No suitable parser found for file " + fileName);
            }
            analysis.recordParser(parser.get().id());
            progress(analysis, 15, "Parser selected");
            token.throwIfCancellationRequested();

            // 4. parse
            ParseResult parsed;
            try {
                parsed = parser.get().parse(fileName, content, token);
            } catch (AnalysisCancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("Parser {} crashed on {}: {}", parser.get().id(), fileName, e.getMessage(), e);
                return fail(activeRun, AnalysisErrorKind.PARSE_FAILURE, "Parsing failed: " + e.getMessage());
            }
            if (!parsed.success()) {
                return fail(activeRun, AnalysisErrorKind.PARSE_FAILURE, "Parsing failed: " + parsed.errorMessage());
            }
            List<LogEvent> events = limit(analysisId, parsed.events(), options.maxEvents());
            analysis.attachEventCount(events.size());
            progress(analysis, 30, "File parsed successfully");
            token.throwIfCancellationRequested();

            // 5. rules
            List<RuleMatchResult> matches;
            try {
                matches = ruleEngine.evaluate(analysisId, events, content, token);
            } catch (AnalysisCancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("Rule evaluation failed for analysis {}: {}", analysisId, e.getMessage(), e);
                return fail(activeRun, AnalysisErrorKind.RULE_ENGINE_FAILURE,
                        "Rule evaluation failed: " + e.getMessage());
            }
            matches = matches == null ? List.of() : List.copyOf(matches);
            analysis.attachRuleMatches(matches);
            for (RuleMatchResult match : matches) {
                notifications.ruleMatch(analysisId, match);
            }
            progress(analysis, 50, "Rule analysis completed");
            token.throwIfCancellationRequested();

            // 6. score
            analysis.attachThreatScore(scoreAggregator.aggregate(matches));
            progress(analysis, 60, "Threat score calculated");
            token.throwIfCancellationRequested();

            // 7. MITRE
            if (Boolean.TRUE.equals(options.mapToMitre())) {
                analysis.attachMitreMapping(mitreMapper.map(matches, token));
                progress(analysis, 70, "MITRE ATT&CK mapping completed");
                token.throwIfCancellationRequested();
            }

            // 8. timeline
            if (Boolean.TRUE.equals(options.buildTimeline())) {
                analysis.attachTimeline(timelineBuilder.build(events, matches, token));
                progress(analysis, 80, "Timeline built");
                token.throwIfCancellationRequested();
            }

            // 9. summary
            analysis.attachSummary(summarize(analysis, matches));
            progress(analysis, 90, "Summary generated");
            token.throwIfCancellationRequested();

            // 10. finalize
            if (analysis.complete()) {
                notifications.progress(analysisId, 100, "Analysis completed");
            }
            return finish(activeRun);

        } catch (AnalysisCancelledException e) {
            if (analysis.cancel(e.getMessage())) {
                log.info("Analysis {} cancelled: {}", analysisId, e.getMessage());
                notifications.progress(analysisId, analysis.getProgress(), e.getMessage());
            }
            return finish(activeRun);
        } catch (IOException e) {
            log.error("Storage error in analysis {}: {}", analysisId, e.getMessage(), e);
            return fail(activeRun, AnalysisErrorKind.INTERNAL, "Storage error: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Analysis {} failed unexpectedly: {}", analysisId, e.getMessage(), e);
            return fail(activeRun, AnalysisErrorKind.INTERNAL, "Analysis failed: " + e.getMessage());
        } finally {
            activeRuns.remove(analysisId);
            analysisDuration.record(Duration.ofNanos(System.nanoTime() - started));
        }
    }

    private AnalysisOutcome fail(ActiveRun activeRun, AnalysisErrorKind kind, String message) {
        Analysis analysis = activeRun.analysis();
        if (analysis.fail(kind, message)) {
            log.warn("Analysis {} failed ({}): {}", analysis.getId(), kind, message);
        }
        return finish(activeRun);
    }

    /**
     * Persist and announce a terminal analysis; the outcome reflects the
     * status the record actually ended in.
     */
    private AnalysisOutcome finish(ActiveRun activeRun) {
        Analysis analysis = activeRun.analysis();
        AnalysisStatus status = analysis.getStatus();
        switch (status) {
            case COMPLETED -> analysesCompleted.increment();
            case CANCELLED -> analysesCancelled.increment();
            default -> analysesFailed.increment();
        }
        if (status == AnalysisStatus.FAILED) {
            notifications.error(analysis.getId(), analysis.getErrorMessage());
        }

        try {
            // delete() flips the flag under the same lock, so a record is
            // either saved before the delete removes it or never saved
            synchronized (activeRun) {
                if (activeRun.deleted) {
                    purge(analysis);
                    log.info("Analysis {} was deleted while running; result discarded", analysis.getId());
                } else {
                    store.save(analysis);
                }
            }
        } catch (IOException e) {
            log.error("Failed to persist analysis {}: {}", analysis.getId(), e.getMessage(), e);
            return AnalysisOutcome.failure(analysis, AnalysisErrorKind.INTERNAL,
                    "Failed to persist analysis: " + e.getMessage());
        }

        notifications.completed(AnalysisCompletedPayload.from(analysis));
        log.info("Analysis {} finished: status={} score={} severity={}",
                analysis.getId(), status.getLabel(), analysis.getThreatScore(), analysis.getSeverity());

        if (status == AnalysisStatus.COMPLETED) {
            return AnalysisOutcome.success(analysis);
        }
        AnalysisErrorKind kind = analysis.getErrorKind() != null
                ? analysis.getErrorKind()
                : AnalysisErrorKind.INTERNAL;
        return AnalysisOutcome.failure(analysis, kind, analysis.getErrorMessage());
    }

    private void progress(Analysis analysis, int percent, String message) {
        analysis.updateProgress(percent);
        notifications.progress(analysis.getId(), percent, message);
    }

    private ActiveRun register(Analysis analysis, Duration timeout) {
        ActiveRun activeRun = new ActiveRun(analysis, CancellationToken.withTimeout(timeout));
        activeRuns.put(analysis.getId(), activeRun);
        return activeRun;
    }

    private AnalysisOptions resolve(AnalysisOptions options) {
        return (options == null ? AnalysisOptions.defaults() : options).withDefaults(defaults);
    }

    private static List<LogEvent> limit(String analysisId, List<LogEvent> events, Integer maxEvents) {
        if (maxEvents == null || maxEvents <= 0 || events.size() <= maxEvents) {
            return events;
        }
        log.warn("Analysis {} produced {} events, keeping the first {}", analysisId, events.size(), maxEvents);
        return List.copyOf(events.subList(0, maxEvents));
    }

    static String sha256(byte[] bytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static String fileTypeOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return "UNKNOWN";
        }
        return fileName.substring(dot + 1).toUpperCase(Locale.ROOT);
    }

    static String summarize(Analysis analysis, List<RuleMatchResult> matches) {
        StringBuilder summary = new StringBuilder();
        summary.append("Analysis of ").append(analysis.getFileName()).append(" completed.\n");
        summary.append("File size: ").append(analysis.getFileSize()).append(" bytes\n");
        summary.append("File hash: ").append(analysis.getFileHash()).append("\n\n");
        summary.append("Parsed ").append(analysis.getEventCount()).append(" events.\n");

        if (matches.isEmpty()) {
            summary.append("No rule matches found.\n");
        } else {
            Map<Severity, Integer> bySeverity = new EnumMap<>(Severity.class);
            for (RuleMatchResult match : matches) {
                bySeverity.merge(match.severity(), 1, Integer::sum);
            }
            summary.append("Found ").append(matches.size()).append(" rule matches:\n");
            for (Map.Entry<Severity, Integer> entry : bySeverity.entrySet()) {
                summary.append("- ").append(entry.getValue()).append(' ')
                        .append(entry.getKey().getLabel()).append(" severity matches\n");
            }
        }

        MitreMappingResult mapping = analysis.getMitreMapping();
        if (!mapping.techniques().isEmpty()) {
            summary.append("Mapped to ").append(mapping.techniques().size())
                    .append(" MITRE ATT&CK techniques across ").append(mapping.tactics().size())
                    .append(" tactics.\n");
        }

        summary.append('\n');
        summary.append("Threat score: ").append(analysis.getThreatScore()).append("/100\n");
        summary.append("Severity: ").append(analysis.getSeverity().toUpperCase(Locale.ROOT));
        return summary.toString();
    }

    private static final class ActiveRun {

        private final Analysis analysis;
        private final CancellationToken token;

        // guarded by this
        private boolean deleted;

        ActiveRun(Analysis analysis, CancellationToken token) {
            this.analysis = analysis;
            this.token = token;
        }

        Analysis analysis() {
            return analysis;
        }

        CancellationToken token() {
            return token;
        }
    }
}
