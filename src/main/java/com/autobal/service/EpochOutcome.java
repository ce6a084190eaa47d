package com.autobal.service;

import com.autobal.model.EpochMetrics;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Result of one epoch in a batch: either metrics, or the reason the epoch was rejected.
 *
 * @param epoch     Epoch label as submitted
 * @param sourceId  Source id as submitted
 * @param metrics   Metrics when the analysis succeeded, otherwise null
 * @param errorCode Failure code when the analysis failed, otherwise null
 * @param message   Failure detail when the analysis failed, otherwise null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EpochOutcome(String epoch, String sourceId, EpochMetrics metrics, String errorCode, String message) {

    public static EpochOutcome success(EpochMetrics metrics) {
        return new EpochOutcome(metrics.epoch(), metrics.sourceId(), metrics, null, null);
    }

    public static EpochOutcome failure(String epoch, String sourceId, String errorCode, String message) {
        return new EpochOutcome(epoch, sourceId, null, errorCode, message);
    }

    public boolean succeeded() {
        return metrics != null;
    }
}
