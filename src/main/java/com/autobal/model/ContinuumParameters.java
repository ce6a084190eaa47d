package com.autobal.model;

/**
 * Power-law continuum parameters supplied with an epoch. They are passed through to the
 * output record; the engine never fits them.
 *
 * @param amplitude     Continuum flux at the 1450 Å anchor
 * @param spectralIndex Power-law slope (alpha)
 */
public record ContinuumParameters(double amplitude, double spectralIndex) {

    /** Bolometric luminosity zero-point, log10(erg/s). */
    public static final double LUMINOSITY_ZERO_POINT = 46.0;

    public static final ContinuumParameters UNSPECIFIED = new ContinuumParameters(0.0, 0.0);

    public ContinuumParameters {
        if (!Double.isFinite(amplitude) || amplitude < 0) {
            throw new IllegalArgumentException("Continuum amplitude must be finite and non-negative");
        }
        if (!Double.isFinite(spectralIndex)) {
            throw new IllegalArgumentException("Spectral index must be finite");
        }
    }

    /**
     * log10 luminosity derived from the amplitude, or 0 when no amplitude was supplied.
     */
    public double luminosity() {
        return amplitude > 0 ? LUMINOSITY_ZERO_POINT + Math.log10(amplitude) : 0.0;
    }
}
