package com.logx.analyzer.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.logx.analyzer.config.AnalyzerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * {@link EvidenceStorage} on the local file system.
 *
 * <p>
 * Directory structure:
 * </p>
 *
 * <pre>
 * {base-path}/
 *   {uploads-dir}/
 *     {upload-id}/
 *       {file}            - Uploaded evidence
 *   {results-dir}/
 *     {analysis-id}/
 *       {result-type}.json
 * </pre>
 *
 * @author Naveed Gung
 */
@Component
public class LocalEvidenceStorage implements EvidenceStorage {

    private static final Logger log = LoggerFactory.getLogger(LocalEvidenceStorage.class);

    private final Path uploadsRoot;
    private final Path resultsRoot;
    private final ObjectMapper objectMapper;

    @Autowired
    public LocalEvidenceStorage(AnalyzerProperties properties, ObjectMapper objectMapper) throws IOException {
        this(Path.of(properties.getStorage().getBasePath()),
                properties.getStorage().getUploadsDir(),
                properties.getStorage().getResultsDir(),
                objectMapper);
    }

    public LocalEvidenceStorage(Path basePath, String uploadsDir, String resultsDir, ObjectMapper objectMapper)
            throws IOException {
        this.uploadsRoot = basePath.resolve(uploadsDir);
        this.resultsRoot = basePath.resolve(resultsDir);
        this.objectMapper = objectMapper;

        Files.createDirectories(uploadsRoot);
        Files.createDirectories(resultsRoot);
        log.info("Evidence storage at {} (uploads={}, results={})", basePath, uploadsDir, resultsDir);
    }

    @Override
    public List<String> listFiles(String uploadId) throws IOException {
        Path dir = uploadsRoot.resolve(checkId(uploadId));
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<String> names = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir, Files::isRegularFile)) {
            for (Path entry : entries) {
                names.add(entry.getFileName().toString());
            }
        }
        names.sort(Comparator.naturalOrder());
        return names;
    }

    @Override
    public InputStream openFile(String uploadId, String fileName) throws IOException {
        return Files.newInputStream(uploadsRoot.resolve(checkId(uploadId)).resolve(checkId(fileName)));
    }

    @Override
    public void saveResult(String analysisId, String resultType, Object result) throws IOException {
        Path dir = resultsRoot.resolve(checkId(analysisId));
        Files.createDirectories(dir);
        Path target = dir.resolve(checkId(resultType) + ".json");
        Path tmp = dir.resolve(resultType + ".json.tmp");

        objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), result);
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        log.debug("Saved {} result for {} at {}", resultType, analysisId, target);
    }

    @Override
    public <T> Optional<T> findResult(String analysisId, String resultType, Class<T> type) throws IOException {
        Path file = resultsRoot.resolve(checkId(analysisId)).resolve(checkId(resultType) + ".json");
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return Optional.of(objectMapper.readValue(file.toFile(), type));
    }

    @Override
    public boolean deleteResult(String analysisId, String resultType) throws IOException {
        Path file = resultsRoot.resolve(checkId(analysisId)).resolve(checkId(resultType) + ".json");
        return Files.deleteIfExists(file);
    }

    @Override
    public boolean deleteWorkingDirectory(String id) throws IOException {
        String checked = checkId(id);
        boolean uploads = deleteTree(uploadsRoot.resolve(checked));
        boolean results = deleteTree(resultsRoot.resolve(checked));
        if (uploads || results) {
            log.info("Deleted working directories for {}", id);
        }
        return uploads || results;
    }

    @Override
    public int purgeOlderThan(Duration age) throws IOException {
        FileTime cutoff = FileTime.from(Instant.now().minus(age));
        int removed = purge(uploadsRoot, cutoff) + purge(resultsRoot, cutoff);
        if (removed > 0) {
            log.info("Purged {} directories older than {} days", removed, age.toDays());
        }
        return removed;
    }

    private int purge(Path root, FileTime cutoff) throws IOException {
        int removed = 0;
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(root, Files::isDirectory)) {
            for (Path entry : entries) {
                if (Files.getLastModifiedTime(entry).compareTo(cutoff) < 0 && deleteTree(entry)) {
                    removed++;
                }
            }
        }
        return removed;
    }

    private static boolean deleteTree(Path root) throws IOException {
        if (!Files.exists(root)) {
            return false;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(root)) {
            paths = walk.sorted(Comparator.reverseOrder()).toList();
        }
        for (Path path : paths) {
            try {
                Files.delete(path);
            } catch (NoSuchFileException e) {
                log.debug("Already removed: {}", path);
            }
        }
        return true;
    }

    // ids and names become path segments
    private static String checkId(String value) {
        if (value == null || value.isBlank() || value.contains("/") || value.contains("\\")
                || value.equals(".") || value.equals("..")) {
            throw new IllegalArgumentException("Invalid storage key: " + value);
        }
        return value;
    }
}
