package com.logx.analyzer.metrics;

import com.logx.analyzer.analysis.AnalysisOrchestrator;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Exposes analyzer-wide gauges via Micrometer/Prometheus.
 *
 * <p>
 * Registered metrics (in addition to the orchestrator and notification
 * counters):
 * </p>
 * <ul>
 * <li>{@code logx.analysis.active} - Analyses pending or processing</li>
 * <li>{@code logx.uptime_seconds} - Analyzer uptime</li>
 * </ul>
 *
 * @author Naveed Gung
 */
@Component
public class AnalyzerMetrics {

    private static final Logger log = LoggerFactory.getLogger(AnalyzerMetrics.class);

    private final AnalysisOrchestrator orchestrator;
    private final MeterRegistry meterRegistry;

    private final long startTime = System.currentTimeMillis();

    public AnalyzerMetrics(AnalysisOrchestrator orchestrator, MeterRegistry meterRegistry) {
        this.orchestrator = orchestrator;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void registerGauges() {
        Gauge.builder("logx.analysis.active", orchestrator, AnalysisOrchestrator::activeCount)
                .description("Number of analyses pending or processing")
                .register(meterRegistry);

        Gauge.builder("logx.uptime_seconds", this, m -> (System.currentTimeMillis() - m.startTime) / 1000.0)
                .description("Analyzer uptime in seconds")
                .register(meterRegistry);

        log.info("Analyzer metrics registered");
    }
}
