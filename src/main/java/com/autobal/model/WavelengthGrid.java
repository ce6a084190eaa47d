package com.autobal.model;

import java.util.Arrays;

/**
 * Ordered, strictly increasing rest-frame wavelength samples (Angstroms) with a constant step.
 *
 * <p>Every curve analysed against a grid has one value per sample. The step is the Δλ used by
 * all wavelength integrals; it is never re-measured locally.
 */
public final class WavelengthGrid {

    /** Smallest grid the 5-point smoothing kernel can run over. */
    public static final int MIN_LENGTH = 5;

    /** Allowed deviation of any sample spacing from the grid step, relative to the step. */
    private static final double SPACING_TOLERANCE = 1e-6;

    private final double[] samples;
    private final double step;

    private WavelengthGrid(double[] samples, double step) {
        this.samples = samples;
        this.step = step;
    }

    /**
     * Build a grid of {@code count} samples starting at {@code start}.
     */
    public static WavelengthGrid uniform(double start, double step, int count) {
        if (!Double.isFinite(start)) {
            throw new SpectrumShapeException("Grid start must be finite: " + start);
        }
        if (!Double.isFinite(step) || step <= 0) {
            throw new SpectrumShapeException("Grid step must be positive and finite: " + step);
        }
        if (count < MIN_LENGTH) {
            throw new SpectrumShapeException(
                    "Grid needs at least " + MIN_LENGTH + " samples, got " + count);
        }
        double[] samples = new double[count];
        for (int i = 0; i < count; i++) {
            samples[i] = start + i * step;
        }
        return new WavelengthGrid(samples, step);
    }

    /**
     * Build the inclusive grid {@code min, min + step, ..., <= max}.
     */
    public static WavelengthGrid range(double min, double max, double step) {
        if (!Double.isFinite(step) || step <= 0) {
            throw new SpectrumShapeException("Grid step must be positive and finite: " + step);
        }
        if (!(max > min)) {
            throw new SpectrumShapeException("Grid max must be greater than min: " + min + ".." + max);
        }
        int count = (int) Math.floor((max - min) / step + 1e-9) + 1;
        return uniform(min, step, count);
    }

    /**
     * Adopt an explicit sample array. The samples must be strictly increasing with constant spacing.
     * Δλ is derived from the endpoints as {@code (last - first) / (n - 1)}, so it may differ from
     * the nominal step in the last few bits; use {@link #of(double[], double)} to pin it.
     */
    public static WavelengthGrid of(double[] wavelengths) {
        checkSamples(wavelengths);
        int n = wavelengths.length;
        return of(wavelengths, (wavelengths[n - 1] - wavelengths[0]) / (n - 1));
    }

    /**
     * Adopt an explicit sample array with a known step. Every spacing must match {@code step}
     * within the relative tolerance, and {@code step} is used exactly as Δλ.
     */
    public static WavelengthGrid of(double[] wavelengths, double step) {
        checkSamples(wavelengths);
        if (!Double.isFinite(step) || step <= 0) {
            throw new SpectrumShapeException("Wavelength step must be positive and finite, got " + step);
        }
        int n = wavelengths.length;
        for (int i = 1; i < n; i++) {
            double spacing = wavelengths[i] - wavelengths[i - 1];
            if (spacing <= 0) {
                throw new SpectrumShapeException(
                        "Wavelength samples must be strictly increasing at index " + i);
            }
            if (Math.abs(spacing - step) > SPACING_TOLERANCE * step) {
                throw new SpectrumShapeException(String.format(
                        "Non-constant wavelength spacing at index %d: %.6f vs step %.6f", i, spacing, step));
            }
        }
        return new WavelengthGrid(wavelengths.clone(), step);
    }

    private static void checkSamples(double[] wavelengths) {
        if (wavelengths == null) {
            throw new SpectrumShapeException("Wavelength samples must not be null");
        }
        int n = wavelengths.length;
        if (n < MIN_LENGTH) {
            throw new SpectrumShapeException(
                    "Grid needs at least " + MIN_LENGTH + " samples, got " + n);
        }
        for (int i = 0; i < n; i++) {
            if (!Double.isFinite(wavelengths[i])) {
                throw new SpectrumShapeException("Wavelength sample " + i + " is not finite");
            }
        }
        if (wavelengths[n - 1] <= wavelengths[0]) {
            throw new SpectrumShapeException("Wavelength samples must be strictly increasing");
        }
    }

    public int size() {
        return samples.length;
    }

    /** The fixed sample spacing Δλ in Angstroms. */
    public double step() {
        return step;
    }

    public double at(int index) {
        return samples[index];
    }

    public double first() {
        return samples[0];
    }

    public double last() {
        return samples[samples.length - 1];
    }

    public double[] toArray() {
        return samples.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WavelengthGrid other)) return false;
        return Double.compare(step, other.step) == 0 && Arrays.equals(samples, other.samples);
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(step) + Arrays.hashCode(samples);
    }

    @Override
    public String toString() {
        return String.format("WavelengthGrid[%.2f..%.2f step=%.4f n=%d]", first(), last(), step, size());
    }
}
