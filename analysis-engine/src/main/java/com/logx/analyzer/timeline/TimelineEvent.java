package com.logx.analyzer.timeline;

import com.logx.analyzer.event.FieldValue;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One chronologically placed entry of an analysis timeline, derived either
 * from a parsed log line or from a single rule-match hit.
 *
 * @param id             random UUID
 * @param timestamp      when the event happened
 * @param type           origin of the entry
 * @param title          short headline
 * @param description    longer text, usually the log message or matched content
 * @param severity       lower-case severity label
 * @param source         producing source, may be empty
 * @param category       grouping category, may be empty
 * @param fields         ordered field map
 * @param tags           free-form tags
 * @param mitreAttackIds related ATT&amp;CK technique ids
 * @param confidence     confidence in [0.0, 1.0]
 * @param anomalous      true for rule-match entries
 * @param lineNumber     source line, if known
 * @param rawData        raw text, may be empty
 *
 * @author Naveed Gung
 */
public record TimelineEvent(
        String id,
        Instant timestamp,
        TimelineEventType type,
        String title,
        String description,
        String severity,
        String source,
        String category,
        Map<String, FieldValue> fields,
        List<String> tags,
        List<String> mitreAttackIds,
        double confidence,
        boolean anomalous,
        Integer lineNumber,
        String rawData) {

    public TimelineEvent {
        source = source == null ? "" : source;
        category = category == null ? "" : category;
        rawData = rawData == null ? "" : rawData;
        fields = fields == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        tags = tags == null ? List.of() : List.copyOf(tags);
        mitreAttackIds = mitreAttackIds == null ? List.of() : List.copyOf(mitreAttackIds);
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }
}
