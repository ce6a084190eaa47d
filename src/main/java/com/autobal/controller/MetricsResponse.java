package com.autobal.controller;

import com.autobal.model.EpochMetrics;

import java.util.List;

/**
 * Response for metrics history queries.
 *
 * <pre>
 * {
 *   "status": "ok",
 *   "sourceId": "SDSS J4055-0596",
 *   "metrics": [ { "epoch": "...", "mjd": 55359, "ew": 12.41, ... }, ... ]
 * }
 * </pre>
 */
public record MetricsResponse(String status, String sourceId, List<EpochMetrics> metrics) {

    public static MetricsResponse ok(String sourceId, List<EpochMetrics> metrics) {
        return new MetricsResponse("ok", sourceId, List.copyOf(metrics));
    }

    public static MetricsResponse noData(String sourceId) {
        return new MetricsResponse("no_data", sourceId, List.of());
    }

    public static MetricsResponse error(String message) {
        return new MetricsResponse("error: " + message, null, List.of());
    }
}
