package com.autobal.engine;

import com.autobal.model.CandidateRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Splits a transmission curve into maximal runs of absorbed samples.
 *
 * <p>A single ascending scan drives a two-state machine:
 * <ul>
 *   <li>{@link State#OUTSIDE} to {@link State#INSIDE} when a sample drops below the threshold,
 *       opening a run at that index</li>
 *   <li>{@link State#INSIDE} stays while samples remain below threshold, tracking the first
 *       occurrence of the lowest value</li>
 *   <li>{@link State#INSIDE} to {@link State#OUTSIDE} at the first sample at or above threshold,
 *       closing the run with that index as its exclusive end</li>
 * </ul>
 * A run still open after the last sample is closed with {@code end = length}, so troughs that
 * run off the end of the grid are reported like any other.
 */
public class TroughSegmenter {

    private static final Logger log = LoggerFactory.getLogger(TroughSegmenter.class);

    enum State { OUTSIDE, INSIDE }

    private final double threshold;

    public TroughSegmenter(double threshold) {
        this.threshold = threshold;
    }

    /**
     * Scan the curve and hand each closed run to {@code onRunClosed}, in scan order.
     */
    public void segment(double[] transmission, Consumer<CandidateRun> onRunClosed) {
        State state = State.OUTSIDE;
        OpenRun open = null;

        for (int i = 0; i < transmission.length; i++) {
            boolean absorbed = transmission[i] < threshold;
            switch (state) {
                case OUTSIDE -> {
                    if (absorbed) {
                        open = new OpenRun(i, transmission[i]);
                        state = State.INSIDE;
                    }
                }
                case INSIDE -> {
                    if (absorbed) {
                        open.update(i, transmission[i]);
                    } else {
                        close(open, i, onRunClosed);
                        open = null;
                        state = State.OUTSIDE;
                    }
                }
            }
        }

        if (state == State.INSIDE) {
            log.debug("Run starting at index {} reaches the end of the grid", open.start);
            close(open, transmission.length, onRunClosed);
        }
    }

    /**
     * Collect every closed run in scan order.
     */
    public List<CandidateRun> segment(double[] transmission) {
        List<CandidateRun> runs = new ArrayList<>();
        segment(transmission, runs::add);
        return runs;
    }

    public double getThreshold() {
        return threshold;
    }

    private static void close(OpenRun open, int end, Consumer<CandidateRun> onRunClosed) {
        CandidateRun run = open.close(end);
        log.debug("Closed run [{}, {}) min={} at {}", run.start(), run.end(), run.minValue(), run.minIndex());
        onRunClosed.accept(run);
    }

    /**
     * Accumulator for the run currently being scanned. Only lives inside one {@link #segment} call.
     */
    private static final class OpenRun {

        private final int start;
        private double minValue;
        private int minIndex;

        OpenRun(int start, double value) {
            this.start = start;
            this.minValue = value;
            this.minIndex = start;
        }

        void update(int index, double value) {
            // strict: ties keep the earlier index
            if (value < minValue) {
                minValue = value;
                minIndex = index;
            }
        }

        CandidateRun close(int end) {
            return new CandidateRun(start, end, minValue, minIndex);
        }
    }
}
