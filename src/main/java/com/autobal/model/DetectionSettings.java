package com.autobal.model;

/**
 * Fixed constants of the trough detector.
 *
 * @param absorptionThreshold Transmission below which a sample counts as absorbed
 * @param minWidthAngstroms   Runs no wider than this are rejected
 * @param referenceLine       Rest wavelength of the velocity zero-point, Å
 * @param lightSpeed          Speed of light, km/s
 */
public record DetectionSettings(double absorptionThreshold,
                                double minWidthAngstroms,
                                double referenceLine,
                                double lightSpeed) {

    public static final double DEFAULT_ABSORPTION_THRESHOLD = 0.9;
    public static final double DEFAULT_MIN_WIDTH_ANGSTROMS = 2.0;
    /** C IV 1549 Å doublet blend. */
    public static final double C_IV_REFERENCE_LINE = 1549.0;
    public static final double LIGHT_SPEED_KM_S = 299792.458;

    public static final DetectionSettings DEFAULTS = new DetectionSettings(
            DEFAULT_ABSORPTION_THRESHOLD, DEFAULT_MIN_WIDTH_ANGSTROMS, C_IV_REFERENCE_LINE, LIGHT_SPEED_KM_S);

    public DetectionSettings {
        if (!(absorptionThreshold > 0 && absorptionThreshold <= 1)) {
            throw new IllegalArgumentException("Absorption threshold must be in (0, 1]");
        }
        if (!Double.isFinite(minWidthAngstroms) || minWidthAngstroms < 0) {
            throw new IllegalArgumentException("Minimum width must be finite and non-negative");
        }
        if (!Double.isFinite(referenceLine) || referenceLine <= 0) {
            throw new IllegalArgumentException("Reference line must be positive");
        }
        if (!Double.isFinite(lightSpeed) || lightSpeed <= 0) {
            throw new IllegalArgumentException("Light speed must be positive");
        }
    }

    /**
     * Doppler velocity of a wavelength relative to the reference line. Positive means blueshift.
     */
    public double velocityOf(double wavelength) {
        return lightSpeed * (referenceLine - wavelength) / referenceLine;
    }
}
