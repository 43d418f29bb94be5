package com.logx.analyzer.analysis;

import com.logx.analyzer.config.AnalyzerProperties;
import jakarta.validation.constraints.Min;

/**
 * Caller options for one analysis run. Null values fall back to the
 * configured {@code logx.analysis.*} defaults.
 *
 * @param preferredParserId parser to try first
 * @param mapToMitre        run the ATT&amp;CK mapping phase
 * @param buildTimeline     run the timeline phase
 * @param maxEvents         cap on parsed events kept; {@code <= 0} means no cap
 * @param timeoutMinutes    cancel the run after this many minutes; {@code 0} means never
 *
 * @author Naveed Gung
 */
public record AnalysisOptions(
        String preferredParserId,
        Boolean mapToMitre,
        Boolean buildTimeline,
        Integer maxEvents,
        @Min(0) Integer timeoutMinutes) {

    /** Options that take every value from configuration. */
    public static AnalysisOptions defaults() {
        return new AnalysisOptions(null, null, null, null, null);
    }

    /** Fill unset values from configuration. */
    public AnalysisOptions withDefaults(AnalyzerProperties.Analysis config) {
        return new AnalysisOptions(
                preferredParserId,
                mapToMitre != null ? mapToMitre : config.isMapToMitre(),
                buildTimeline != null ? buildTimeline : config.isBuildTimeline(),
                maxEvents != null ? maxEvents : config.getMaxEvents(),
                timeoutMinutes != null ? timeoutMinutes : config.getTimeoutMinutes());
    }
}
