package com.logx.analyzer.timeline;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Summary figures over a timeline.
 *
 * @param totalEvents        number of entries
 * @param firstEvent         earliest timestamp, null when empty
 * @param lastEvent          latest timestamp, null when empty
 * @param timeRange          {@code lastEvent - firstEvent}, zero when empty
 * @param eventsByType       type label to count
 * @param eventsBySeverity   severity label to count
 * @param eventsBySource     non-empty source to count
 * @param eventsByCategory   non-empty category to count
 * @param eventsByHour       hour bucket (timestamp floored to the hour) to count, ascending
 * @param topTags            up to 10 most frequent tags
 * @param anomalousEvents    number of anomalous entries
 *
 * @author Naveed Gung
 */
public record TimelineStatistics(
        int totalEvents,
        Instant firstEvent,
        Instant lastEvent,
        Duration timeRange,
        Map<String, Long> eventsByType,
        Map<String, Long> eventsBySeverity,
        Map<String, Long> eventsBySource,
        Map<String, Long> eventsByCategory,
        Map<Instant, Long> eventsByHour,
        List<String> topTags,
        long anomalousEvents) {

    public TimelineStatistics {
        timeRange = timeRange == null ? Duration.ZERO : timeRange;
        eventsByType = eventsByType == null ? Map.of() : eventsByType;
        eventsBySeverity = eventsBySeverity == null ? Map.of() : eventsBySeverity;
        eventsBySource = eventsBySource == null ? Map.of() : eventsBySource;
        eventsByCategory = eventsByCategory == null ? Map.of() : eventsByCategory;
        eventsByHour = eventsByHour == null ? Map.of() : eventsByHour;
        topTags = topTags == null ? List.of() : List.copyOf(topTags);
    }

    public static TimelineStatistics empty() {
        return new TimelineStatistics(0, null, null, Duration.ZERO,
                Map.of(), Map.of(), Map.of(), Map.of(), Map.of(), List.of(), 0);
    }
}
