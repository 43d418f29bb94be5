package com.logx.analyzer.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.logx.analyzer.config.AnalyzerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP webhook channel.
 *
 * <p>
 * Posts every notification as a JSON envelope
 * {@code {"event": ..., "analysisId": ..., "timestamp": ..., "data": ...}}.
 * Requests are fire-and-forget with a bounded timeout so a slow receiver
 * never holds up an analysis.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
@ConditionalOnProperty(prefix = "logx.notifier.webhook", name = "enabled", havingValue = "true")
public class WebhookProgressNotifier implements ProgressNotifier {

    private static final Logger log = LoggerFactory.getLogger(WebhookProgressNotifier.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public WebhookProgressNotifier(AnalyzerProperties properties, ObjectMapper objectMapper) {
        this(WebClient.builder()
                        .baseUrl(properties.getNotifier().getWebhook().getUrl())
                        .defaultHeader("Content-Type", MediaType.APPLICATION_JSON_VALUE)
                        .build(),
                objectMapper,
                Duration.ofMillis(properties.getNotifier().getWebhook().getTimeoutMs()));
    }

    WebhookProgressNotifier(WebClient webClient, ObjectMapper objectMapper, Duration timeout) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.timeout = timeout;
    }

    @Override
    public void onProgress(ProgressUpdate update) {
        post("progress", update.analysisId(), update);
    }

    @Override
    public void onRuleMatch(RuleMatchNotice notice) {
        post("rule_match", notice.analysisId(), notice);
    }

    @Override
    public void onCompleted(AnalysisCompletedPayload payload) {
        post("completed", payload.analysisId(), payload);
    }

    @Override
    public void onError(String analysisId, String message) {
        post("error", analysisId, Map.of("message", message == null ? "" : message));
    }

    private void post(String event, String analysisId, Object data) {
        try {
            Map<String, Object> envelope = new LinkedHashMap<>();
            envelope.put("event", event);
            envelope.put("analysisId", analysisId);
            envelope.put("timestamp", Instant.now());
            envelope.put("data", data);

            String body = objectMapper.writeValueAsString(envelope);

            webClient.post()
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .subscribe(
                            resp -> log.debug("Webhook accepted {} for {}", event, analysisId),
                            e -> log.warn("Webhook rejected {} for {}: {}", event, analysisId, e.getMessage()));

        } catch (Exception e) {
            log.error("Failed to send {} notification for {} to webhook: {}", event, analysisId, e.getMessage());
            throw new IllegalStateException("Webhook delivery failed", e);
        }
    }
}
