package com.autobal.controller;

import com.autobal.model.EpochMetrics;
import com.autobal.store.EpochMetricsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller exposing stored epoch metrics, grouped by source.
 *
 * <pre>
 * GET /metrics?sourceId=SDSS%20J4055-0596&amp;fromMjd=55000&amp;toMjd=56000
 * </pre>
 */
@RestController
@RequestMapping("/metrics")
@CrossOrigin(origins = "*")
public class MetricsController {

    private static final Logger log = LoggerFactory.getLogger(MetricsController.class);

    private final EpochMetricsStore store;

    public MetricsController(EpochMetricsStore store) {
        this.store = store;
    }

    /**
     * Fetch the metrics of one source, optionally limited to an inclusive MJD range.
     *
     * @param sourceId Object identifier
     * @param fromMjd  Earliest MJD (inclusive), unbounded if absent
     * @param toMjd    Latest MJD (inclusive), unbounded if absent
     */
    @GetMapping
    public ResponseEntity<MetricsResponse> getMetrics(
            @RequestParam String sourceId,
            @RequestParam(required = false) Double fromMjd,
            @RequestParam(required = false) Double toMjd
    ) {
        log.info("Metrics request: source={} fromMjd={} toMjd={}", sourceId, fromMjd, toMjd);

        if (sourceId.isBlank()) {
            return ResponseEntity.badRequest().body(MetricsResponse.error("sourceId must not be blank"));
        }

        double from = fromMjd == null ? Double.NEGATIVE_INFINITY : fromMjd;
        double to = toMjd == null ? Double.POSITIVE_INFINITY : toMjd;
        if (from > to) {
            return ResponseEntity.badRequest().body(MetricsResponse.error("'fromMjd' must be <= 'toMjd'"));
        }

        List<EpochMetrics> metrics = store.query(sourceId, from, to);
        if (metrics.isEmpty()) {
            log.debug("No metrics found for source={}", sourceId);
            return ResponseEntity.ok(MetricsResponse.noData(sourceId));
        }

        log.info("Returning {} epochs for source={}", metrics.size(), sourceId);
        return ResponseEntity.ok(MetricsResponse.ok(sourceId, metrics));
    }
}
