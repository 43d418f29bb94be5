package com.logx.analyzer.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.logx.analyzer.config.AnalyzerProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class StorageCleanupTaskTest {

    @TempDir
    Path baseDir;

    @Test
    void shouldPurgeUsingConfiguredRetention() throws IOException {
        AnalyzerProperties properties = new AnalyzerProperties();
        properties.getStorage().setRetentionDays(1);
        LocalEvidenceStorage storage = new LocalEvidenceStorage(baseDir, "Uploads", "Results", new ObjectMapper());

        Path stale = Files.createDirectories(baseDir.resolve("Uploads/stale"));
        Files.setLastModifiedTime(stale, FileTime.from(Instant.now().minus(Duration.ofDays(3))));
        Files.createDirectories(baseDir.resolve("Uploads/recent"));

        new StorageCleanupTask(storage, properties).purgeExpired();

        assertFalse(Files.exists(stale));
        assertTrue(Files.exists(baseDir.resolve("Uploads/recent")));
    }
}
