package com.logx.analyzer.detection;

/**
 * Aggregate threat score of an analysis.
 *
 * @param score    score in [0, 100]
 * @param severity severity label derived from the score
 *
 * @author Naveed Gung
 */
public record ThreatScore(int score, Severity severity) {

    public static ThreatScore none() {
        return new ThreatScore(0, Severity.LOW);
    }
}
