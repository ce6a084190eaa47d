package com.autobal.controller;

import com.autobal.model.EpochMetrics;
import com.autobal.service.AnalysisService;
import com.autobal.service.BatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller accepting epochs for analysis.
 *
 * <pre>
 * POST /epochs        one {@link EpochRequest}  returns {@link EpochMetrics}
 * POST /epochs/batch  list of requests          returns {@link BatchResult}
 * </pre>
 */
@RestController
@RequestMapping("/epochs")
public class AnalysisController {

    private static final Logger log = LoggerFactory.getLogger(AnalysisController.class);

    private final AnalysisService analysisService;

    public AnalysisController(AnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    /**
     * Analyse a single epoch. Invalid input is mapped to an error response by {@link ApiExceptionHandler}.
     */
    @PostMapping
    public ResponseEntity<EpochMetrics> analyze(@RequestBody EpochRequest request) {
        log.info("Analysis request: source={} epoch={}", request.sourceId(), request.epoch());
        return ResponseEntity.ok(analysisService.analyze(request.toSpectrum()));
    }

    /**
     * Analyse many epochs in parallel. Always 200; failed epochs are reported in place.
     */
    @PostMapping("/batch")
    public ResponseEntity<BatchResult> analyzeBatch(@RequestBody List<EpochRequest> requests) {
        log.info("Batch analysis request: {} epochs", requests.size());
        return ResponseEntity.ok(analysisService.analyzeEach(
                requests, EpochRequest::toSpectrum, EpochRequest::epoch, EpochRequest::sourceId));
    }
}
