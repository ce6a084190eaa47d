package com.autobal.engine;

/**
 * Savitzky-Golay smoother, window 5, polynomial order 3.
 *
 * <p>Interior samples are replaced by the convolution with (-3, 12, 17, 12, -3) / 35.
 * The first two and last two samples are copied through unchanged; there is no edge correction.
 */
public class SavitzkyGolaySmoother {

    public static final int WINDOW = 5;

    private static final double[] COEFFICIENTS = {-3.0, 12.0, 17.0, 12.0, -3.0};
    private static final double NORMALIZATION = 35.0;

    /**
     * Smooth a flux sequence. Returns a new array; the input is never modified.
     * Sequences shorter than the window come back as an unchanged copy.
     */
    public double[] smooth(double[] values) {
        double[] result = values.clone();
        int half = WINDOW / 2;
        for (int i = half; i < values.length - half; i++) {
            double sum = 0;
            for (int k = 0; k < WINDOW; k++) {
                sum += COEFFICIENTS[k] * values[i - half + k];
            }
            result[i] = sum / NORMALIZATION;
        }
        return result;
    }
}
