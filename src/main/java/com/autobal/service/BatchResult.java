package com.autobal.service;

import java.util.List;

/**
 * Per-epoch outcomes of a batch, in submission order.
 */
public record BatchResult(int succeeded, int failed, List<EpochOutcome> outcomes) {

    public static BatchResult of(List<EpochOutcome> outcomes) {
        int ok = (int) outcomes.stream().filter(EpochOutcome::succeeded).count();
        return new BatchResult(ok, outcomes.size() - ok, List.copyOf(outcomes));
    }
}
