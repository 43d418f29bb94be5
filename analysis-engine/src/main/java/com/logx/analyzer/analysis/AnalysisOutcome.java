package com.logx.analyzer.analysis;

/**
 * Result of an orchestrator call: the analysis plus, when it did not
 * complete, the kind of error and a message.
 *
 * @param analysis  the analysis, never null
 * @param errorKind null on success
 * @param message   error description, null on success
 *
 * @author Naveed Gung
 */
public record AnalysisOutcome(Analysis analysis, AnalysisErrorKind errorKind, String message) {

    public static AnalysisOutcome success(Analysis analysis) {
        return new AnalysisOutcome(analysis, null, null);
    }

    public static AnalysisOutcome failure(Analysis analysis, AnalysisErrorKind kind, String message) {
        return new AnalysisOutcome(analysis, kind, message);
    }

    public boolean isSuccess() {
        return errorKind == null;
    }
}
