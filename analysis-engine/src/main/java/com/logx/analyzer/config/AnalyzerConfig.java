package com.logx.analyzer.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.logx.analyzer.analysis.CancellationToken;
import com.logx.analyzer.detection.RuleEngine;
import com.logx.analyzer.detection.RuleMatchResult;
import com.logx.analyzer.event.LogEvent;
import com.logx.analyzer.mitre.ReferenceData;
import com.logx.analyzer.mitre.StaticReferenceData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Beans for the external collaborators of the analysis pipeline.
 *
 * @author Naveed Gung
 */
@Configuration
public class AnalyzerConfig {

    private static final Logger log = LoggerFactory.getLogger(AnalyzerConfig.class);

    /**
     * ATT&amp;CK reference tables, loaded once at startup.
     */
    @Bean
    @ConditionalOnMissingBean(ReferenceData.class)
    public ReferenceData referenceData(AnalyzerProperties properties, ResourceLoader resourceLoader,
            ObjectMapper objectMapper) {
        String location = properties.getMitre().getReferenceData();
        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            return StaticReferenceData.load(in, objectMapper);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load MITRE reference data from " + location, e);
        }
    }

    /**
     * Stand-in used when no rule engine is deployed: evaluates nothing, so
     * every analysis scores 0.
     */
    @Bean
    @ConditionalOnMissingBean(RuleEngine.class)
    public RuleEngine noRuleEngine() {
        log.warn("No rule engine configured; analyses will report no rule matches");
        return new RuleEngine() {
            @Override
            public List<RuleMatchResult> evaluate(String analysisId,
                    List<LogEvent> events, String rawContent,
                    CancellationToken token) {
                return List.of();
            }

            @Override
            public void reloadRules() {
                log.debug("No rules to reload");
            }
        };
    }
}
