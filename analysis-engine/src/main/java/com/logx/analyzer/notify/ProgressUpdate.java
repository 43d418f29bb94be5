package com.logx.analyzer.notify;

import java.time.Instant;

/**
 * One progress step of an analysis run.
 *
 * @param analysisId analysis the step belongs to
 * @param percent    0-100
 * @param message    what the pipeline is doing
 * @param timestamp  when the step was reported
 *
 * @author Naveed Gung
 */
public record ProgressUpdate(String analysisId, int percent, String message, Instant timestamp) {

    public ProgressUpdate {
        percent = Math.max(0, Math.min(100, percent));
    }

    public static ProgressUpdate of(String analysisId, int percent, String message) {
        return new ProgressUpdate(analysisId, percent, message, Instant.now());
    }
}
