package com.logx.analyzer.analysis;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal for one analysis run.
 *
 * <p>
 * Checked between orchestrator phases and inside the per-item loops of the
 * mapper and timeline builder. A token may also carry a deadline, after which
 * it reports itself as timed out.
 * </p>
 *
 * @author Naveed Gung
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Duration timeout;
    private final long deadlineNanos;

    private CancellationToken(Duration timeout) {
        this.timeout = timeout;
        this.deadlineNanos = timeout == null ? 0L : System.nanoTime() + timeout.toNanos();
    }

    /** A token that is only cancelled explicitly. */
    public static CancellationToken create() {
        return new CancellationToken(null);
    }

    /** A token that also cancels itself once {@code timeout} has elapsed. */
    public static CancellationToken withTimeout(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return create();
        }
        return new CancellationToken(timeout);
    }

    /** Request cancellation. Idempotent. */
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancellationRequested() {
        return cancelled.get() || isTimedOut();
    }

    public boolean isTimedOut() {
        return timeout != null && System.nanoTime() - deadlineNanos >= 0;
    }

    /**
     * Abort the current phase if cancellation was requested.
     *
     * @throws AnalysisCancelledException if cancelled or past the deadline
     */
    public void throwIfCancellationRequested() {
        if (cancelled.get()) {
            throw new AnalysisCancelledException("Analysis was cancelled", false);
        }
        if (isTimedOut()) {
            throw new AnalysisCancelledException(
                    "Analysis timed out after " + timeout.toMinutes() + " minutes", true);
        }
    }
}
