package com.logx.analyzer.detection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;

/**
 * Folds rule matches into one bounded threat score.
 *
 * <p>
 * Each match contributes {@code baseScore(severity) * matchCount * confidence};
 * the sum is divided by the total match count and truncated to an integer in
 * [0, 100]. The severity label is then derived from the score:
 * </p>
 * <ul>
 * <li>{@code >= 80} critical</li>
 * <li>{@code >= 60} high</li>
 * <li>{@code >= 30} medium</li>
 * <li>otherwise low</li>
 * </ul>
 *
 * @author Naveed Gung
 */
@Component
public class ThreatScoreAggregator {

    private static final Logger log = LoggerFactory.getLogger(ThreatScoreAggregator.class);

    /**
     * Score a set of rule matches.
     *
     * @param matches the matches of one analysis, may be empty or null
     * @return the score and its severity label (never null)
     */
    public ThreatScore aggregate(Collection<RuleMatchResult> matches) {
        if (matches == null || matches.isEmpty()) {
            return ThreatScore.none();
        }

        double weighted = 0.0;
        long totalMatches = 0;
        for (RuleMatchResult match : matches) {
            weighted += (double) match.severity().getBaseScore() * match.matchCount() * match.confidence();
            totalMatches += match.matchCount();
        }

        int score = (int) (weighted / Math.max(1L, totalMatches));
        score = Math.min(100, Math.max(0, score));

        Severity severity = Severity.fromScore(score);
        log.debug("Threat score {} ({}) from {} rule matches", score, severity.getLabel(), matches.size());
        return new ThreatScore(score, severity);
    }
}
