package com.logx.analyzer.analysis;

import com.logx.analyzer.storage.EvidenceStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Optional;

/**
 * Persists {@link Analysis} records as result blobs of type
 * {@value #RESULT_TYPE}.
 *
 * @author Naveed Gung
 */
@Component
public class AnalysisStore {

    private static final Logger log = LoggerFactory.getLogger(AnalysisStore.class);

    static final String RESULT_TYPE = "analysis";

    private final EvidenceStorage storage;

    public AnalysisStore(EvidenceStorage storage) {
        this.storage = storage;
    }

    public void save(Analysis analysis) throws IOException {
        storage.saveResult(analysis.getId(), RESULT_TYPE, analysis);
        log.debug("Persisted analysis {} ({})", analysis.getId(), analysis.getStatus().getLabel());
    }

    public Optional<Analysis> find(String analysisId) throws IOException {
        return storage.findResult(analysisId, RESULT_TYPE, Analysis.class);
    }

    /**
     * Delete the record, the upload it was run on and its result directory.
     *
     * @return false if no record existed
     */
    public boolean delete(String analysisId) throws IOException {
        Optional<Analysis> existing = find(analysisId);
        if (existing.isEmpty()) {
            return false;
        }
        storage.deleteResult(analysisId, RESULT_TYPE);
        storage.deleteWorkingDirectory(analysisId);
        String uploadId = existing.get().getUploadId();
        if (uploadId != null && !uploadId.isBlank()) {
            storage.deleteWorkingDirectory(uploadId);
        }
        log.info("Deleted analysis {}", analysisId);
        return true;
    }
}
