package com.logx.analyzer.api;

import com.logx.analyzer.analysis.Analysis;
import com.logx.analyzer.analysis.AnalysisErrorKind;
import com.logx.analyzer.analysis.AnalysisOptions;
import com.logx.analyzer.analysis.AnalysisOrchestrator;
import com.logx.analyzer.analysis.AnalysisOutcome;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Locale;

/**
 * HTTP entry point for analyses.
 *
 * <p>
 * Storage access blocks, so every handler runs on the bounded-elastic
 * scheduler. Analyses themselves run on the orchestrator's worker pool.
 * </p>
 *
 * @author Naveed Gung
 */
@RestController
@RequestMapping("/api/analyses")
public class AnalysisController {

    private static final Logger log = LoggerFactory.getLogger(AnalysisController.class);

    private final AnalysisOrchestrator orchestrator;

    public AnalysisController(AnalysisOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /**
     * Start an analysis of an uploaded file.
     * POST /api/analyses/{uploadId}
     */
    @PostMapping("/{uploadId}")
    public Mono<ResponseEntity<Object>> start(@PathVariable String uploadId,
            @Valid @RequestBody(required = false) AnalysisOptions options) {
        return Mono.fromCallable(() -> {
            log.info("Analysis requested for upload {}", uploadId);
            AnalysisOutcome outcome = orchestrator.start(uploadId, options);
            if (outcome.isSuccess()) {
                return ResponseEntity.status(HttpStatus.ACCEPTED).<Object>body(outcome.analysis());
            }
            HttpStatus status = outcome.errorKind() == AnalysisErrorKind.NOT_FOUND
                    ? HttpStatus.NOT_FOUND
                    : HttpStatus.INTERNAL_SERVER_ERROR;
            return ResponseEntity.status(status)
                    .<Object>body(new ApiError(outcome.errorKind().name().toLowerCase(Locale.ROOT), outcome.message()));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * GET /api/analyses/{analysisId}
     */
    @GetMapping("/{analysisId}")
    public Mono<ResponseEntity<Analysis>> get(@PathVariable String analysisId) {
        return Mono.fromCallable(() -> orchestrator.find(analysisId)
                        .map(ResponseEntity::ok)
                        .orElseGet(() -> ResponseEntity.notFound().build()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * POST /api/analyses/{analysisId}/cancel
     */
    @PostMapping("/{analysisId}/cancel")
    public Mono<ResponseEntity<Analysis>> cancel(@PathVariable String analysisId) {
        return Mono.fromCallable(() -> orchestrator.cancel(analysisId)
                        .map(ResponseEntity::ok)
                        .orElseGet(() -> ResponseEntity.notFound().build()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * DELETE /api/analyses/{analysisId}
     */
    @DeleteMapping("/{analysisId}")
    public Mono<ResponseEntity<Void>> delete(@PathVariable String analysisId) {
        return Mono.fromCallable(() -> orchestrator.delete(analysisId)
                        ? ResponseEntity.noContent().<Void>build()
                        : ResponseEntity.notFound().<Void>build())
                .subscribeOn(Schedulers.boundedElastic());
    }
}
