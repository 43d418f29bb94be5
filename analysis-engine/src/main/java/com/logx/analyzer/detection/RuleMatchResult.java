package com.logx.analyzer.detection;

import com.logx.analyzer.event.FieldValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one rule that matched at least once against an artifact.
 *
 * @param ruleId         rule identifier
 * @param ruleName       rule display name
 * @param ruleType       rule format
 * @param severity       severity declared by the rule
 * @param matchCount     number of hits, at least 1
 * @param confidence     confidence in [0.0, 1.0]
 * @param matches        individual hit locations
 * @param mitreAttackIds ATT&amp;CK technique ids attached to the rule
 * @param metadata       free-form rule metadata
 *
 * @author Naveed Gung
 */
public record RuleMatchResult(
        String ruleId,
        String ruleName,
        RuleType ruleType,
        Severity severity,
        int matchCount,
        double confidence,
        List<MatchDetail> matches,
        List<String> mitreAttackIds,
        Map<String, FieldValue> metadata) {

    public RuleMatchResult {
        ruleId = ruleId == null ? "" : ruleId;
        ruleName = ruleName == null ? "" : ruleName;
        ruleType = ruleType == null ? RuleType.CUSTOM : ruleType;
        severity = severity == null ? Severity.INFO : severity;
        matchCount = Math.max(1, matchCount);
        confidence = Math.min(1.0, Math.max(0.0, confidence));
        matches = matches == null ? List.of() : List.copyOf(matches);
        mitreAttackIds = mitreAttackIds == null ? List.of() : List.copyOf(mitreAttackIds);
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
