package com.autobal.controller;

import com.autobal.model.ContinuumParameters;
import com.autobal.model.EpochSpectrum;
import com.autobal.model.SpectrumShapeException;
import com.autobal.model.WavelengthGrid;

/**
 * JSON body describing one epoch to analyse.
 *
 * <p>The grid is given either as explicit {@code wavelengths} or as {@code wavelengthStart}
 * plus {@code wavelengthStep}, in which case it has one sample per flux value. With explicit
 * {@code wavelengths}, Δλ is {@code wavelengthStep} when that is also given, otherwise it is
 * derived from the endpoints as {@code (last - first) / (n - 1)} and may differ from the nominal
 * step in the last bits.
 *
 * <pre>
 * {
 *   "epoch": "spec-4055-55359-0596",
 *   "sourceId": "SDSS J4055-0596",
 *   "mjd": 55359,
 *   "wavelengthStart": 1400.0,
 *   "wavelengthStep": 0.5,
 *   "flux": [...],
 *   "continuum": [...],
 *   "continuumAmplitude": 10.5,
 *   "spectralIndex": -1.5
 * }
 * </pre>
 */
public record EpochRequest(
        String epoch,
        String sourceId,
        Double mjd,
        double[] wavelengths,
        Double wavelengthStart,
        Double wavelengthStep,
        double[] flux,
        double[] continuum,
        Double continuumAmplitude,
        Double spectralIndex
) {

    /**
     * Convert to the engine's input.
     *
     * @throws SpectrumShapeException   if the grid or curves are missing or malformed
     * @throws IllegalArgumentException if identifiers are missing
     */
    public EpochSpectrum toSpectrum() {
        if (mjd == null) {
            throw new IllegalArgumentException("mjd is required");
        }
        if (flux == null || continuum == null) {
            throw new SpectrumShapeException("flux and continuum are required");
        }
        ContinuumParameters parameters = new ContinuumParameters(
                continuumAmplitude == null ? 0.0 : continuumAmplitude,
                spectralIndex == null ? 0.0 : spectralIndex);
        return new EpochSpectrum(grid(), flux, continuum, epoch, sourceId, mjd, parameters);
    }

    private WavelengthGrid grid() {
        if (wavelengths != null) {
            return wavelengthStep != null
                    ? WavelengthGrid.of(wavelengths, wavelengthStep)
                    : WavelengthGrid.of(wavelengths);
        }
        if (wavelengthStart != null && wavelengthStep != null) {
            return WavelengthGrid.uniform(wavelengthStart, wavelengthStep, flux.length);
        }
        throw new SpectrumShapeException("Either wavelengths or wavelengthStart and wavelengthStep are required");
    }
}
