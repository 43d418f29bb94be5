package com.logx.analyzer.analysis;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.logx.analyzer.detection.RuleMatchResult;
import com.logx.analyzer.detection.ThreatScore;
import com.logx.analyzer.mitre.MitreMappingResult;
import com.logx.analyzer.timeline.Timeline;
import com.logx.analyzer.timeline.TimelineEvent;
import com.logx.analyzer.timeline.TimelineStatistics;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Aggregate root of one evidence analysis.
 *
 * <p>
 * Created once when a run starts, mutated in place by each pipeline phase and
 * frozen once its status leaves {@code processing}. Status only moves
 * forward; every mutator is ignored after a terminal status has been
 * reached, so a late phase cannot alter a cancelled or failed record.
 * </p>
 *
 * <p>
 * Phase outputs are attached in a single assignment each: readers see either
 * the complete output of a phase or none of it.
 * </p>
 *
 * @author Naveed Gung
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class Analysis {

    private String id;
    private String uploadId;

    private volatile String fileName;
    private volatile long fileSize;
    private volatile String fileType;
    private volatile String fileHash;
    private volatile String parserId;

    private volatile AnalysisStatus status = AnalysisStatus.PENDING;
    private volatile int progress;
    private volatile int threatScore;
    private volatile String severity = "low";
    private volatile String summary;
    private volatile String errorMessage;
    private volatile AnalysisErrorKind errorKind;

    private volatile Instant startTime;
    private volatile Instant completionTime;

    private volatile int eventCount;
    private volatile List<RuleMatchResult> ruleMatches = List.of();
    private volatile Timeline timeline = Timeline.empty();
    private volatile MitreMappingResult mitreMapping = MitreMappingResult.empty();

    private Analysis() {
    }

    /**
     * Start a new pending analysis for an upload.
     */
    public static Analysis create(String uploadId) {
        Analysis analysis = new Analysis();
        analysis.id = UUID.randomUUID().toString();
        analysis.uploadId = uploadId;
        analysis.startTime = Instant.now();
        return analysis;
    }

    // --- transitions ---

    /**
     * Move from pending to processing.
     *
     * @return false if the analysis was cancelled before it started
     * @throws IllegalStateException for any other current status
     */
    public synchronized boolean markProcessing() {
        if (status == AnalysisStatus.CANCELLED) {
            return false;
        }
        if (status != AnalysisStatus.PENDING) {
            throw new IllegalStateException("Cannot move analysis " + id + " from " + status.getLabel()
                    + " to processing");
        }
        status = AnalysisStatus.PROCESSING;
        return true;
    }

    /** @return false if the analysis already reached a terminal status */
    public synchronized boolean complete() {
        if (status.isTerminal()) {
            return false;
        }
        status = AnalysisStatus.COMPLETED;
        progress = 100;
        completionTime = Instant.now();
        return true;
    }

    /** @return false if the analysis already reached a terminal status */
    public synchronized boolean fail(AnalysisErrorKind kind, String message) {
        if (status.isTerminal()) {
            return false;
        }
        status = AnalysisStatus.FAILED;
        errorKind = kind;
        errorMessage = message;
        completionTime = Instant.now();
        return true;
    }

    /** @return false if the analysis already reached a terminal status */
    public synchronized boolean cancel(String message) {
        if (status.isTerminal()) {
            return false;
        }
        status = AnalysisStatus.CANCELLED;
        errorKind = AnalysisErrorKind.CANCELLED;
        errorMessage = message;
        completionTime = Instant.now();
        return true;
    }

    // --- phase outputs ---

    public synchronized void recordFile(String fileName, long fileSize, String fileType, String fileHash) {
        if (status.isTerminal()) {
            return;
        }
        this.fileName = fileName;
        this.fileSize = fileSize;
        this.fileType = fileType;
        this.fileHash = fileHash;
    }

    public synchronized void recordParser(String parserId) {
        if (!status.isTerminal()) {
            this.parserId = parserId;
        }
    }

    /** Progress never decreases. */
    public synchronized void updateProgress(int percent) {
        if (!status.isTerminal()) {
            progress = Math.max(progress, Math.max(0, Math.min(100, percent)));
        }
    }

    public synchronized void attachEventCount(int eventCount) {
        if (!status.isTerminal()) {
            this.eventCount = eventCount;
        }
    }

    public synchronized void attachRuleMatches(List<RuleMatchResult> matches) {
        if (!status.isTerminal()) {
            ruleMatches = List.copyOf(matches);
        }
    }

    public synchronized void attachThreatScore(ThreatScore score) {
        if (status.isTerminal()) {
            return;
        }
        threatScore = score.score();
        severity = score.severity().getLabel();
    }

    public synchronized void attachMitreMapping(MitreMappingResult mapping) {
        if (!status.isTerminal()) {
            mitreMapping = mapping;
        }
    }

    public synchronized void attachTimeline(Timeline built) {
        if (status.isTerminal()) {
            return;
        }
        timeline = built;
    }

    public synchronized void attachSummary(String summary) {
        if (!status.isTerminal()) {
            this.summary = summary;
        }
    }

    /**
     * Copy of the current state, taken under the same lock as every
     * transition and phase output. Readers of a running analysis serialize
     * the copy so they never see half of a phase's output.
     */
    public synchronized Analysis snapshot() {
        Analysis copy = new Analysis();
        copy.id = id;
        copy.uploadId = uploadId;
        copy.fileName = fileName;
        copy.fileSize = fileSize;
        copy.fileType = fileType;
        copy.fileHash = fileHash;
        copy.parserId = parserId;
        copy.status = status;
        copy.progress = progress;
        copy.threatScore = threatScore;
        copy.severity = severity;
        copy.summary = summary;
        copy.errorMessage = errorMessage;
        copy.errorKind = errorKind;
        copy.startTime = startTime;
        copy.completionTime = completionTime;
        copy.eventCount = eventCount;
        copy.ruleMatches = ruleMatches;
        copy.timeline = timeline;
        copy.mitreMapping = mitreMapping;
        return copy;
    }

    // --- accessors ---

    public String getId() {
        return id;
    }

    public String getUploadId() {
        return uploadId;
    }

    public String getFileName() {
        return fileName;
    }

    public long getFileSize() {
        return fileSize;
    }

    public String getFileType() {
        return fileType;
    }

    public String getFileHash() {
        return fileHash;
    }

    public String getParserId() {
        return parserId;
    }

    public AnalysisStatus getStatus() {
        return status;
    }

    public int getProgress() {
        return progress;
    }

    public int getThreatScore() {
        return threatScore;
    }

    public String getSeverity() {
        return severity;
    }

    public String getSummary() {
        return summary;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public AnalysisErrorKind getErrorKind() {
        return errorKind;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getCompletionTime() {
        return completionTime;
    }

    public int getEventCount() {
        return eventCount;
    }

    public List<RuleMatchResult> getRuleMatches() {
        return ruleMatches;
    }

    public List<TimelineEvent> getTimeline() {
        return timeline.events();
    }

    public TimelineStatistics getTimelineStatistics() {
        return timeline.statistics();
    }

    public MitreMappingResult getMitreMapping() {
        return mitreMapping;
    }

    @Override
    public String toString() {
        return "Analysis[id=" + id + ", uploadId=" + uploadId + ", status=" + status.getLabel()
                + ", progress=" + progress + ", threatScore=" + threatScore + "]";
    }
}
