package com.logx.analyzer.timeline;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Origin of a {@link TimelineEvent}.
 *
 * @author Naveed Gung
 */
public enum TimelineEventType {

    LOG_EVENT("log_event"),
    RULE_MATCH("rule_match");

    private final String label;

    TimelineEventType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static TimelineEventType fromLabel(String label) {
        for (TimelineEventType type : values()) {
            if (type.label.equalsIgnoreCase(label) || type.name().equalsIgnoreCase(label)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown timeline event type: " + label);
    }
}
