package com.logx.analyzer.timeline;

import java.util.List;

/**
 * Sorted timeline of one analysis together with its statistics.
 *
 * @param events     entries in ascending timestamp order
 * @param statistics summary figures over {@code events}
 *
 * @author Naveed Gung
 */
public record Timeline(List<TimelineEvent> events, TimelineStatistics statistics) {

    public Timeline {
        events = events == null ? List.of() : List.copyOf(events);
        statistics = statistics == null ? TimelineStatistics.empty() : statistics;
    }

    public static Timeline empty() {
        return new Timeline(List.of(), TimelineStatistics.empty());
    }
}
