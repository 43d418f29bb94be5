package com.logx.analyzer.notify;

import com.logx.analyzer.detection.RuleMatchResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.function.Consumer;

/**
 * Central notification dispatch.
 *
 * <p>
 * Routes pipeline notifications to every configured {@link ProgressNotifier}
 * with per-channel error isolation: a failing channel is counted and logged,
 * and neither the other channels nor the analysis are affected.
 * </p>
 *
 * @author Naveed Gung
 */
@Service
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    private final List<ProgressNotifier> notifiers;

    private final Counter notificationsSent;
    private final Counter notificationsFailed;

    public NotificationService(List<ProgressNotifier> notifiers, MeterRegistry meterRegistry) {
        this.notifiers = List.copyOf(notifiers);
        this.notificationsSent = Counter.builder("logx.notify.sent")
                .description("Notifications delivered to channels")
                .register(meterRegistry);
        this.notificationsFailed = Counter.builder("logx.notify.failed")
                .description("Notification delivery failures")
                .register(meterRegistry);

        log.info("Notification service initialized with {} channels: {}",
                this.notifiers.size(),
                this.notifiers.stream().map(n -> n.getClass().getSimpleName()).toList());
    }

    public void progress(String analysisId, int percent, String message) {
        ProgressUpdate update = ProgressUpdate.of(analysisId, percent, message);
        dispatch("progress", n -> n.onProgress(update));
    }

    public void ruleMatch(String analysisId, RuleMatchResult match) {
        RuleMatchNotice notice = RuleMatchNotice.from(analysisId, match);
        dispatch("rule-match", n -> n.onRuleMatch(notice));
    }

    public void completed(AnalysisCompletedPayload payload) {
        dispatch("completion", n -> n.onCompleted(payload));
    }

    public void error(String analysisId, String message) {
        dispatch("error", n -> n.onError(analysisId, message));
    }

    private void dispatch(String kind, Consumer<ProgressNotifier> delivery) {
        for (ProgressNotifier notifier : notifiers) {
            try {
                delivery.accept(notifier);
                notificationsSent.increment();
            } catch (Exception e) {
                notificationsFailed.increment();
                log.warn("Delivery of {} notification failed for {}: {}",
                        kind, notifier.getClass().getSimpleName(), e.getMessage());
            }
        }
    }
}
