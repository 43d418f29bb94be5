package com.logx.analyzer.detection;

import com.logx.analyzer.analysis.CancellationToken;
import com.logx.analyzer.event.LogEvent;

import java.util.List;

/**
 * Executes the loaded detection rule set (YARA, Sigma, ...) against an artifact.
 *
 * <p>
 * Implementations must treat their rule set as a snapshot for the duration of
 * one {@link #evaluate} call; a concurrent {@link #reloadRules()} only affects
 * later evaluations.
 * </p>
 *
 * @author Naveed Gung
 */
public interface RuleEngine {

    /**
     * Evaluate all active rules.
     *
     * @param analysisId the analysis the evaluation belongs to
     * @param events     parsed events of the artifact
     * @param rawContent the artifact's full text
     * @param token      cancellation signal
     * @return one result per matching rule (never null)
     * @throws RuleEngineException if the engine cannot evaluate the rule set
     */
    List<RuleMatchResult> evaluate(String analysisId, List<LogEvent> events, String rawContent,
            CancellationToken token);

    /** Reload the rule set from its source. */
    void reloadRules();
}
