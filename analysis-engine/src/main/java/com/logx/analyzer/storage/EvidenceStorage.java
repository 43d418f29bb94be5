package com.logx.analyzer.storage;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Storage for uploaded evidence files and JSON result blobs.
 *
 * <p>
 * Evidence is addressed by upload id and file name; results by analysis id
 * and result type. Implementations must be safe for concurrent use by
 * independent analyses.
 * </p>
 *
 * @author Naveed Gung
 */
public interface EvidenceStorage {

    /**
     * Names of the files uploaded under an id, sorted.
     *
     * @return empty when the upload does not exist
     */
    List<String> listFiles(String uploadId) throws IOException;

    /** Open an uploaded file for reading. The caller closes the stream. */
    InputStream openFile(String uploadId, String fileName) throws IOException;

    /** Serialize {@code result} as JSON under {@code analysisId/resultType}. */
    void saveResult(String analysisId, String resultType, Object result) throws IOException;

    /** Read a result blob back, or empty when none was saved. */
    <T> Optional<T> findResult(String analysisId, String resultType, Class<T> type) throws IOException;

    /** @return true if a blob was removed */
    boolean deleteResult(String analysisId, String resultType) throws IOException;

    /**
     * Remove everything kept for an id: its upload directory and its result
     * directory.
     *
     * @return true if anything was removed
     */
    boolean deleteWorkingDirectory(String id) throws IOException;

    /**
     * Remove upload and result directories not modified within {@code age}.
     *
     * @return number of directories removed
     */
    int purgeOlderThan(Duration age) throws IOException;
}
