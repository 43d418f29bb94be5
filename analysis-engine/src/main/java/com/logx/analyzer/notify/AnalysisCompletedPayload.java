package com.logx.analyzer.notify;

import com.logx.analyzer.analysis.Analysis;
import com.logx.analyzer.analysis.AnalysisStatus;

import java.time.Instant;

/**
 * Final notice of an analysis run, emitted whatever its terminal status.
 *
 * @author Naveed Gung
 */
public record AnalysisCompletedPayload(
        String analysisId,
        String fileName,
        String fileHash,
        AnalysisStatus status,
        int threatScore,
        String severity,
        Instant completionTime,
        int ruleMatchCount) {

    /**
     * Build the payload from a finalized analysis.
     */
    public static AnalysisCompletedPayload from(Analysis analysis) {
        return new AnalysisCompletedPayload(
                analysis.getId(),
                analysis.getFileName(),
                analysis.getFileHash(),
                analysis.getStatus(),
                analysis.getThreatScore(),
                analysis.getSeverity(),
                analysis.getCompletionTime(),
                analysis.getRuleMatches().size());
    }
}
