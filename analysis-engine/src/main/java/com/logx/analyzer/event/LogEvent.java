package com.logx.analyzer.event;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One parsed log line, as produced by a {@code LogParser}.
 *
 * @param timestamp  event time
 * @param level      log level as written in the source (e.g. "ERROR", "warn")
 * @param source     emitting host, service or channel
 * @param message    human-readable message
 * @param lineNumber 1-based line in the artifact, or {@code null} if unknown
 * @param rawData    the unparsed line
 * @param fields     extracted fields in source order
 *
 * @author Naveed Gung
 */
public record LogEvent(
        Instant timestamp,
        String level,
        String source,
        String message,
        Integer lineNumber,
        String rawData,
        Map<String, FieldValue> fields) {

    public LogEvent {
        level = level == null ? "" : level;
        source = source == null ? "" : source;
        message = message == null ? "" : message;
        rawData = rawData == null ? "" : rawData;
        fields = fields == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }
}
