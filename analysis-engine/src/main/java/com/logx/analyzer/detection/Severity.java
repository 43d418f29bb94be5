package com.logx.analyzer.detection;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity assigned by a detection rule.
 *
 * <p>
 * {@link #INFO} doubles as the bucket for severities the scoring table does
 * not know.
 * </p>
 *
 * @author Naveed Gung
 */
public enum Severity {

    CRITICAL("critical", 100),
    HIGH("high", 75),
    MEDIUM("medium", 50),
    LOW("low", 25),
    INFO("info", 10);

    private final String label;
    private final int baseScore;

    Severity(String label, int baseScore) {
        this.label = label;
        this.baseScore = baseScore;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /** Score contribution of one fully confident match of this severity. */
    public int getBaseScore() {
        return baseScore;
    }

    /**
     * Decode a severity label, case-insensitively.
     *
     * @param label label such as "High" or "critical"
     * @return the matching severity, or {@link #INFO} for anything unknown
     */
    @JsonCreator
    public static Severity fromLabel(String label) {
        if (label == null) {
            return INFO;
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (Severity severity : values()) {
            if (severity.label.equals(normalized)) {
                return severity;
            }
        }
        return INFO;
    }

    /**
     * Map an aggregate 0-100 threat score onto a severity label.
     */
    public static Severity fromScore(int score) {
        if (score >= 80) {
            return CRITICAL;
        }
        if (score >= 60) {
            return HIGH;
        }
        if (score >= 30) {
            return MEDIUM;
        }
        return LOW;
    }
}
