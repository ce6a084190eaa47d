package com.autobal.model;

import java.util.Objects;

/**
 * One epoch's flux and continuum on a shared wavelength grid, plus its identifiers.
 *
 * <p>Shape and continuum validity are checked by the engine, not here, so that a batch can
 * report such failures per epoch. The arrays are copied in and out.
 *
 * @param grid                Rest-frame wavelength grid
 * @param flux                Observed flux, one value per grid sample
 * @param continuum           Unabsorbed continuum model, one value per grid sample
 * @param epochLabel          Epoch name (e.g. the spectrum file name)
 * @param sourceId            Object identifier used to group epochs
 * @param mjd                 Modified Julian Date of the observation
 * @param continuumParameters Pass-through continuum amplitude and spectral index
 */
public record EpochSpectrum(WavelengthGrid grid,
                            double[] flux,
                            double[] continuum,
                            String epochLabel,
                            String sourceId,
                            double mjd,
                            ContinuumParameters continuumParameters) {

    public EpochSpectrum {
        Objects.requireNonNull(grid, "grid");
        Objects.requireNonNull(flux, "flux");
        Objects.requireNonNull(continuum, "continuum");
        if (epochLabel == null || epochLabel.isBlank()) throw new IllegalArgumentException("Epoch label must not be blank");
        if (sourceId == null || sourceId.isBlank()) throw new IllegalArgumentException("Source id must not be blank");
        if (!Double.isFinite(mjd)) throw new IllegalArgumentException("MJD must be finite");
        flux = flux.clone();
        continuum = continuum.clone();
        if (continuumParameters == null) continuumParameters = ContinuumParameters.UNSPECIFIED;
    }

    public EpochSpectrum(WavelengthGrid grid, double[] flux, double[] continuum,
                         String epochLabel, String sourceId, double mjd) {
        this(grid, flux, continuum, epochLabel, sourceId, mjd, ContinuumParameters.UNSPECIFIED);
    }

    @Override
    public double[] flux() {
        return flux.clone();
    }

    @Override
    public double[] continuum() {
        return continuum.clone();
    }

    @Override
    public String toString() {
        return "EpochSpectrum[" + sourceId + "@" + epochLabel + " mjd=" + mjd + " " + grid + "]";
    }
}
