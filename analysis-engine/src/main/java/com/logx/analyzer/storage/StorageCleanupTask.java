package com.logx.analyzer.storage;

import com.logx.analyzer.config.AnalyzerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;

/**
 * Daily purge of upload and result directories past the retention period.
 *
 * @author Naveed Gung
 */
@Component
@ConditionalOnProperty(prefix = "logx.storage", name = "cleanup-enabled", havingValue = "true", matchIfMissing = true)
public class StorageCleanupTask {

    private static final Logger log = LoggerFactory.getLogger(StorageCleanupTask.class);

    private final EvidenceStorage storage;
    private final Duration retention;

    public StorageCleanupTask(EvidenceStorage storage, AnalyzerProperties properties) {
        this.storage = storage;
        this.retention = Duration.ofDays(properties.getStorage().getRetentionDays());
    }

    @Scheduled(cron = "${logx.storage.cleanup-cron:0 0 3 * * *}")
    public void purgeExpired() {
        try {
            int removed = storage.purgeOlderThan(retention);
            log.info("Storage cleanup finished: {} directories removed (retention={} days)",
                    removed, retention.toDays());
        } catch (IOException e) {
            log.error("Storage cleanup failed: {}", e.getMessage(), e);
        }
    }
}
