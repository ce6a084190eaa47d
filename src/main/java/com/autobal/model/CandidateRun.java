package com.autobal.model;

/**
 * A maximal run of below-threshold transmission samples, closed by the segmenter.
 *
 * @param start    First index in the run (inclusive)
 * @param end      One past the last index in the run (exclusive)
 * @param minValue Lowest transmission seen in the run
 * @param minIndex Index of the first sample holding {@code minValue}
 */
public record CandidateRun(int start, int end, double minValue, int minIndex) {

    public CandidateRun {
        if (start < 0) throw new IllegalArgumentException("Run start must be non-negative");
        if (end <= start) throw new IllegalArgumentException("Run end must be after start");
        if (minIndex < start || minIndex >= end) throw new IllegalArgumentException("Run minimum must lie inside the run");
    }

    /** Number of samples in the run. */
    public int length() {
        return end - start;
    }
}
