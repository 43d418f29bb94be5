package com.logx.analyzer.notify;

import com.logx.analyzer.detection.RuleMatchResult;

import java.util.List;

/**
 * Announcement of a single matching rule, sent once rule evaluation finished.
 *
 * @author Naveed Gung
 */
public record RuleMatchNotice(
        String analysisId,
        String ruleId,
        String ruleName,
        String ruleType,
        String severity,
        int matchCount,
        double confidence,
        List<String> mitreAttackIds) {

    public RuleMatchNotice {
        mitreAttackIds = mitreAttackIds == null ? List.of() : List.copyOf(mitreAttackIds);
    }

    public static RuleMatchNotice from(String analysisId, RuleMatchResult match) {
        return new RuleMatchNotice(
                analysisId,
                match.ruleId(),
                match.ruleName(),
                match.ruleType().getLabel(),
                match.severity().getLabel(),
                match.matchCount(),
                match.confidence(),
                match.mitreAttackIds());
    }
}
