package com.logx.analyzer.timeline;

import com.logx.analyzer.analysis.CancellationToken;
import com.logx.analyzer.detection.MatchDetail;
import com.logx.analyzer.detection.RuleMatchResult;
import com.logx.analyzer.event.FieldValue;
import com.logx.analyzer.event.LogEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Function;

/**
 * Merges parsed log events and rule-match hits into one timeline sorted by
 * timestamp.
 *
 * <p>
 * Log events are converted first, then every {@link MatchDetail} of every
 * rule match becomes its own entry. The merged list is sorted with a stable
 * sort, so entries sharing a timestamp keep log events ahead of rule matches.
 * Hits without a timestamp are placed at the moment the build started.
 * </p>
 *
 * <p>
 * The cancellation token is checked before each conversion; a cancelled
 * build throws and never returns a partial timeline.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class TimelineBuilder {

    private static final Logger log = LoggerFactory.getLogger(TimelineBuilder.class);

    static final int TOP_TAGS = 10;

    static final String LOG_CATEGORY = "log";
    static final String DETECTION_CATEGORY = "detection";
    static final String RULE_ENGINE_SOURCE = "rule_engine";

    private static final Map<String, String> LEVEL_SEVERITY = Map.of(
            "critical", "critical",
            "fatal", "critical",
            "error", "high",
            "warning", "medium",
            "warn", "medium",
            "info", "low",
            "debug", "info",
            "trace", "info");

    /**
     * Build the timeline of one analysis.
     *
     * @param events      parsed log events, in parser order
     * @param ruleMatches rule matches of the same analysis
     * @param token       cancellation signal
     * @return sorted timeline and its statistics
     * @throws com.logx.analyzer.analysis.AnalysisCancelledException if cancelled mid-way
     */
    public Timeline build(List<LogEvent> events, List<RuleMatchResult> ruleMatches, CancellationToken token) {
        Instant builtAt = Instant.now();
        List<TimelineEvent> timeline = new ArrayList<>();

        if (events != null) {
            for (LogEvent event : events) {
                token.throwIfCancellationRequested();
                timeline.add(fromLogEvent(event, builtAt));
            }
        }

        if (ruleMatches != null) {
            for (RuleMatchResult match : ruleMatches) {
                for (MatchDetail detail : match.matches()) {
                    token.throwIfCancellationRequested();
                    timeline.add(fromRuleMatch(match, detail, builtAt));
                }
            }
        }

        timeline.sort(Comparator.comparing(TimelineEvent::timestamp));
        TimelineStatistics statistics = statistics(timeline);

        log.info("Built timeline with {} entries ({} anomalous)",
                statistics.totalEvents(), statistics.anomalousEvents());
        return new Timeline(timeline, statistics);
    }

    /** Map a log level onto a severity label; unknown levels become "info". */
    static String severityForLevel(String level) {
        if (level == null) {
            return "info";
        }
        return LEVEL_SEVERITY.getOrDefault(level.trim().toLowerCase(Locale.ROOT), "info");
    }

    private static TimelineEvent fromLogEvent(LogEvent event, Instant builtAt) {
        List<String> tags = new ArrayList<>();
        if (!event.level().isBlank()) {
            tags.add(event.level().trim().toLowerCase(Locale.ROOT));
        }
        return new TimelineEvent(
                UUID.randomUUID().toString(),
                event.timestamp() != null ? event.timestamp() : builtAt,
                TimelineEventType.LOG_EVENT,
                event.message(),
                event.message(),
                severityForLevel(event.level()),
                event.source(),
                LOG_CATEGORY,
                event.fields(),
                tags,
                List.of(),
                1.0,
                false,
                event.lineNumber(),
                event.rawData());
    }

    private static TimelineEvent fromRuleMatch(RuleMatchResult match, MatchDetail detail, Instant builtAt) {
        Map<String, FieldValue> fields = new LinkedHashMap<>();
        fields.put("rule_id", FieldValue.of(match.ruleId()));
        fields.put("rule_name", FieldValue.of(match.ruleName()));
        fields.put("rule_type", FieldValue.of(match.ruleType().getLabel()));
        fields.put("confidence", FieldValue.of(match.confidence()));
        fields.put("context", FieldValue.of(detail.context()));

        List<String> tags = new ArrayList<>();
        tags.add(match.ruleType().getLabel());
        tags.addAll(match.mitreAttackIds());

        return new TimelineEvent(
                UUID.randomUUID().toString(),
                detail.timestamp() != null ? detail.timestamp() : builtAt,
                TimelineEventType.RULE_MATCH,
                "Rule Match: " + match.ruleName(),
                detail.matchedContent(),
                match.severity().getLabel(),
                RULE_ENGINE_SOURCE,
                DETECTION_CATEGORY,
                fields,
                tags,
                match.mitreAttackIds(),
                match.confidence(),
                true,
                detail.lineNumber(),
                detail.matchedContent());
    }

    static TimelineStatistics statistics(List<TimelineEvent> timeline) {
        if (timeline.isEmpty()) {
            return TimelineStatistics.empty();
        }

        Instant first = timeline.get(0).timestamp();
        Instant last = timeline.get(timeline.size() - 1).timestamp();

        Map<String, Long> byType = countBy(timeline, e -> e.type().getLabel());
        Map<String, Long> bySeverity = countBy(timeline, TimelineEvent::severity);
        Map<String, Long> bySource = countBy(timeline, TimelineEvent::source);
        Map<String, Long> byCategory = countBy(timeline, TimelineEvent::category);

        Map<Instant, Long> byHour = new TreeMap<>();
        Map<String, Long> tagCounts = new LinkedHashMap<>();
        long anomalous = 0;
        for (TimelineEvent event : timeline) {
            byHour.merge(event.timestamp().truncatedTo(ChronoUnit.HOURS), 1L, Long::sum);
            for (String tag : event.tags()) {
                tagCounts.merge(tag, 1L, Long::sum);
            }
            if (event.anomalous()) {
                anomalous++;
            }
        }

        List<Map.Entry<String, Long>> sortedTags = new ArrayList<>(tagCounts.entrySet());
        sortedTags.sort(Map.Entry.<String, Long>comparingByValue().reversed());
        List<String> topTags = sortedTags.stream()
                .limit(TOP_TAGS)
                .map(Map.Entry::getKey)
                .toList();

        return new TimelineStatistics(
                timeline.size(),
                first,
                last,
                Duration.between(first, last),
                byType,
                bySeverity,
                bySource,
                byCategory,
                byHour,
                topTags,
                anomalous);
    }

    // empty keys are skipped
    private static Map<String, Long> countBy(List<TimelineEvent> timeline, Function<TimelineEvent, String> key) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (TimelineEvent event : timeline) {
            String value = key.apply(event);
            if (value != null && !value.isEmpty()) {
                counts.merge(value, 1L, Long::sum);
            }
        }
        return counts;
    }
}
