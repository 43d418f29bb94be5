package com.logx.analyzer.detection;

import com.logx.analyzer.event.FieldValue;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single location where a rule matched.
 *
 * @param matchedContent the matched text
 * @param fileOffset     byte offset in the artifact, or {@code null}
 * @param lineNumber     1-based line, or {@code null}
 * @param context        surrounding text
 * @param fields         fields of the matched event
 * @param timestamp      time of the matched event, or {@code null} if unknown
 * @param confidence     confidence in [0.0, 1.0]
 *
 * @author Naveed Gung
 */
public record MatchDetail(
        String matchedContent,
        Long fileOffset,
        Integer lineNumber,
        String context,
        Map<String, FieldValue> fields,
        Instant timestamp,
        double confidence) {

    public MatchDetail {
        matchedContent = matchedContent == null ? "" : matchedContent;
        context = context == null ? "" : context;
        fields = fields == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        confidence = Math.min(1.0, Math.max(0.0, confidence));
    }

    /** Factory for a fully confident match on one line. */
    public static MatchDetail of(String matchedContent, Integer lineNumber, Instant timestamp) {
        return new MatchDetail(matchedContent, null, lineNumber, "", Map.of(), timestamp, 1.0);
    }
}
