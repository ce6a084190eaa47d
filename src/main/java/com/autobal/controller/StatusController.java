package com.autobal.controller;

import com.autobal.generator.SyntheticSpectrumGenerator;
import com.autobal.model.DetectionSettings;
import com.autobal.service.AnalysisService;
import com.autobal.store.EpochMetricsStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Operational endpoints for health monitoring and service introspection.
 */
@RestController
public class StatusController {

    private final AnalysisService analysisService;
    private final EpochMetricsStore store;
    private final DetectionSettings settings;
    private final ObjectProvider<SyntheticSpectrumGenerator> generator;

    public StatusController(AnalysisService analysisService,
                            EpochMetricsStore store,
                            DetectionSettings settings,
                            ObjectProvider<SyntheticSpectrumGenerator> generator) {
        this.analysisService = analysisService;
        this.store = store;
        this.settings = settings;
        this.generator = generator;
    }

    /**
     * Simple liveness probe.
     * GET /ping → {"status": "ok"}
     */
    @GetMapping("/ping")
    public ResponseEntity<Map<String, String>> ping() {
        return ResponseEntity.ok(Map.of("status", "ok"));
    }

    /**
     * Service counters and the active detection settings.
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        SyntheticSpectrumGenerator gen = generator.getIfAvailable();
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "timestamp", Instant.now().getEpochSecond(),
                "epochsStored", store.totalEpochs(),
                "epochsAnalyzed", analysisService.getAnalyzedCount(),
                "epochsFailed", analysisService.getFailedCount(),
                "knownSources", store.knownSources(),
                "syntheticEpochsGenerated", gen == null ? 0L : gen.getEpochCount(),
                "detection", settings
        ));
    }

    /**
     * Lists all sources with stored metrics.
     * GET /sources → ["SDSS J4055-0596", ...]
     */
    @GetMapping("/sources")
    public ResponseEntity<List<String>> sources() {
        return ResponseEntity.ok(store.knownSources());
    }
}
