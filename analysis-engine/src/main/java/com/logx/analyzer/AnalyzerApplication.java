package com.logx.analyzer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * LogX Analysis Engine.
 *
 * <p>
 * Spring Boot application that analyzes uploaded evidence artifacts: parses
 * them into log events, runs detection rules, scores the matches, maps them to
 * MITRE ATT&amp;CK and builds an annotated timeline.
 * </p>
 *
 * @author Naveed Gung
 */
@SpringBootApplication
@EnableScheduling
public class AnalyzerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnalyzerApplication.class, args);
    }
}
