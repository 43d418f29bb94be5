package com.logx.analyzer.detection;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Rule formats understood by the rule engine.
 *
 * @author Naveed Gung
 */
public enum RuleType {

    YARA("yara"),
    SIGMA("sigma"),
    STIX("stix"),
    CUSTOM("custom");

    private final String label;

    RuleType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static RuleType fromLabel(String label) {
        if (label != null) {
            String normalized = label.trim().toLowerCase(Locale.ROOT);
            for (RuleType type : values()) {
                if (type.label.equals(normalized)) {
                    return type;
                }
            }
        }
        return CUSTOM;
    }
}
