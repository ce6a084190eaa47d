package com.autobal.model;

/**
 * Immutable per-epoch summary of the absorption analysis, already rounded for presentation.
 *
 * @param epoch         Epoch label
 * @param sourceId      Object identifier
 * @param mjd           Modified Julian Date
 * @param ew            Total equivalent width, Å (2 dp)
 * @param depth         Depth of the deepest component (3 dp)
 * @param width         Sum of component velocity extents, km/s (integer)
 * @param velocity      Centroid velocity of the deepest component, km/s (integer)
 * @param continuumFlux Continuum amplitude passed through from the input (2 dp)
 * @param spectralIndex Continuum spectral index passed through from the input (3 dp)
 * @param luminosity    log10 luminosity derived from the continuum amplitude (2 dp)
 * @param troughCount   Number of accepted absorption components
 */
public record EpochMetrics(String epoch,
                           String sourceId,
                           double mjd,
                           double ew,
                           double depth,
                           double width,
                           double velocity,
                           double continuumFlux,
                           double spectralIndex,
                           double luminosity,
                           int troughCount) {

    public EpochMetrics {
        if (troughCount < 0) throw new IllegalArgumentException("Trough count must be non-negative");
    }
}
