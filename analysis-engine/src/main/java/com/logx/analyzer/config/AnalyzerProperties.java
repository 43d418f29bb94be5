package com.logx.analyzer.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Analyzer configuration, bound from the {@code logx.*} namespace.
 *
 * @author Naveed Gung
 */
@Configuration
@ConfigurationProperties(prefix = "logx")
@Validated
public class AnalyzerProperties {

    @Valid
    private Storage storage = new Storage();

    @Valid
    private Analysis analysis = new Analysis();

    @Valid
    private Mitre mitre = new Mitre();

    @Valid
    private Notifier notifier = new Notifier();

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage;
    }

    public Analysis getAnalysis() {
        return analysis;
    }

    public void setAnalysis(Analysis analysis) {
        this.analysis = analysis;
    }

    public Mitre getMitre() {
        return mitre;
    }

    public void setMitre(Mitre mitre) {
        this.mitre = mitre;
    }

    public Notifier getNotifier() {
        return notifier;
    }

    public void setNotifier(Notifier notifier) {
        this.notifier = notifier;
    }

    /** File system layout for uploads and result blobs. */
    public static class Storage {

        @NotBlank
        private String basePath = "./data";

        @NotBlank
        private String uploadsDir = "Uploads";

        @NotBlank
        private String resultsDir = "Results";

        @Min(1)
        private int retentionDays = 30;

        private boolean cleanupEnabled = true;

        @NotBlank
        private String cleanupCron = "0 0 3 * * *";

        public String getBasePath() {
            return basePath;
        }

        public void setBasePath(String basePath) {
            this.basePath = basePath;
        }

        public String getUploadsDir() {
            return uploadsDir;
        }

        public void setUploadsDir(String uploadsDir) {
            this.uploadsDir = uploadsDir;
        }

        public String getResultsDir() {
            return resultsDir;
        }

        public void setResultsDir(String resultsDir) {
            this.resultsDir = resultsDir;
        }

        public int getRetentionDays() {
            return retentionDays;
        }

        public void setRetentionDays(int retentionDays) {
            this.retentionDays = retentionDays;
        }

        public boolean isCleanupEnabled() {
            return cleanupEnabled;
        }

        public void setCleanupEnabled(boolean cleanupEnabled) {
            this.cleanupEnabled = cleanupEnabled;
        }

        public String getCleanupCron() {
            return cleanupCron;
        }

        public void setCleanupCron(String cleanupCron) {
            this.cleanupCron = cleanupCron;
        }
    }

    /** Pipeline defaults; callers may override most of them per run. */
    public static class Analysis {

        @Min(1)
        private int workerThreads = 4;

        private int maxEvents = 100_000;

        @Min(0)
        private int timeoutMinutes = 30;

        private boolean mapToMitre = true;

        private boolean buildTimeline = true;

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }

        public int getMaxEvents() {
            return maxEvents;
        }

        public void setMaxEvents(int maxEvents) {
            this.maxEvents = maxEvents;
        }

        public int getTimeoutMinutes() {
            return timeoutMinutes;
        }

        public void setTimeoutMinutes(int timeoutMinutes) {
            this.timeoutMinutes = timeoutMinutes;
        }

        public boolean isMapToMitre() {
            return mapToMitre;
        }

        public void setMapToMitre(boolean mapToMitre) {
            this.mapToMitre = mapToMitre;
        }

        public boolean isBuildTimeline() {
            return buildTimeline;
        }

        public void setBuildTimeline(boolean buildTimeline) {
            this.buildTimeline = buildTimeline;
        }
    }

    public static class Mitre {

        @NotBlank
        private String referenceData = "classpath:mitre/attack-reference.json";

        public String getReferenceData() {
            return referenceData;
        }

        public void setReferenceData(String referenceData) {
            this.referenceData = referenceData;
        }
    }

    public static class Notifier {

        @Valid
        private Webhook webhook = new Webhook();

        public Webhook getWebhook() {
            return webhook;
        }

        public void setWebhook(Webhook webhook) {
            this.webhook = webhook;
        }
    }

    /** Outbound HTTP channel for progress and completion notices. */
    public static class Webhook {

        private boolean enabled = false;

        private String url = "";

        @Min(1)
        private int timeoutMs = 5000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }
}
