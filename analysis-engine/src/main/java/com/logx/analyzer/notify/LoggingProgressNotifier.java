package com.logx.analyzer.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Always-on channel that writes notifications to the application log.
 *
 * @author Naveed Gung
 */
@Component
public class LoggingProgressNotifier implements ProgressNotifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingProgressNotifier.class);

    @Override
    public void onProgress(ProgressUpdate update) {
        log.debug("[{}] {}% {}", update.analysisId(), update.percent(), update.message());
    }

    @Override
    public void onRuleMatch(RuleMatchNotice notice) {
        log.info("[{}] Rule matched: {} ({}, severity={}, matches={}, mitre={})",
                notice.analysisId(), notice.ruleName(), notice.ruleType(), notice.severity(),
                notice.matchCount(), notice.mitreAttackIds());
    }

    @Override
    public void onCompleted(AnalysisCompletedPayload payload) {
        log.info("[{}] Analysis {} for {}: score={} severity={} ruleMatches={}",
                payload.analysisId(), payload.status().getLabel(), payload.fileName(),
                payload.threatScore(), payload.severity(), payload.ruleMatchCount());
    }

    @Override
    public void onError(String analysisId, String message) {
        log.warn("[{}] Analysis failed: {}", analysisId, message);
    }
}
