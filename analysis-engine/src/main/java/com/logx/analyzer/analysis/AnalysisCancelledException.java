package com.logx.analyzer.analysis;

/**
 * Raised when a phase observes a cancelled {@link CancellationToken}.
 *
 * <p>
 * Only the orchestrator catches it; the phase that raised it leaves no
 * partial output behind.
 * </p>
 *
 * @author Naveed Gung
 */
public class AnalysisCancelledException extends RuntimeException {

    private final boolean timedOut;

    public AnalysisCancelledException(String message, boolean timedOut) {
        super(message);
        this.timedOut = timedOut;
    }

    public boolean isTimedOut() {
        return timedOut;
    }
}
