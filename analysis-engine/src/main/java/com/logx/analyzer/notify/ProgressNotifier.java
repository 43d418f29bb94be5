package com.logx.analyzer.notify;

/**
 * A notification channel for analysis progress.
 *
 * <p>
 * Delivery is best effort. Implementations must return quickly; anything slow
 * (network calls) has to be dispatched asynchronously. Exceptions thrown here
 * are contained by {@link NotificationService} and never reach the pipeline.
 * </p>
 *
 * @author Naveed Gung
 */
public interface ProgressNotifier {

    void onProgress(ProgressUpdate update);

    void onRuleMatch(RuleMatchNotice notice);

    void onCompleted(AnalysisCompletedPayload payload);

    void onError(String analysisId, String message);
}
