package com.autobal;

import com.autobal.model.EpochSpectrum;
import com.autobal.model.WavelengthGrid;

import java.util.Arrays;

/**
 * Shared builders for synthetic flux/continuum pairs with known absorption.
 */
public final class SpectrumFixtures {

    /** 1500..1600 Å at 0.5 Å, 201 samples. */
    public static final WavelengthGrid GRID = WavelengthGrid.uniform(1500.0, 0.5, 201);
    public static final double CONTINUUM_LEVEL = 10.0;

    private SpectrumFixtures() {}

    public static double[] flatContinuum(WavelengthGrid grid) {
        double[] continuum = new double[grid.size()];
        Arrays.fill(continuum, CONTINUUM_LEVEL);
        return continuum;
    }

    public static double[] unabsorbed(WavelengthGrid grid) {
        return flatContinuum(grid);
    }

    /**
     * Transmission 1 - depth * exp(-0.5 ((λ - center) / sigma)^2) at every grid sample.
     */
    public static double[] gaussianTransmission(WavelengthGrid grid, double depth, double center, double sigma) {
        double[] t = new double[grid.size()];
        for (int i = 0; i < t.length; i++) {
            double z = (grid.at(i) - center) / sigma;
            t[i] = 1 - depth * Math.exp(-0.5 * z * z);
        }
        return t;
    }

    /**
     * Element-wise product of several transmission curves.
     */
    public static double[] combine(double[]... transmissions) {
        double[] result = new double[transmissions[0].length];
        Arrays.fill(result, 1.0);
        for (double[] t : transmissions) {
            for (int i = 0; i < result.length; i++) {
                result[i] *= t[i];
            }
        }
        return result;
    }

    /**
     * Flux for a flat continuum multiplied by the given transmission.
     */
    public static double[] fluxFor(double[] transmission) {
        double[] flux = new double[transmission.length];
        for (int i = 0; i < flux.length; i++) {
            flux[i] = CONTINUUM_LEVEL * transmission[i];
        }
        return flux;
    }

    /**
     * Left-rectangle integral of (1 - t) over the samples where t is below the threshold.
     */
    public static double absorbedArea(double[] transmission, double step, double threshold) {
        double area = 0;
        for (double t : transmission) {
            if (t < threshold) {
                area += (1 - t) * step;
            }
        }
        return area;
    }

    public static EpochSpectrum epoch(String sourceId, String epoch, double mjd, double[] transmission) {
        return new EpochSpectrum(GRID, fluxFor(transmission), flatContinuum(GRID), epoch, sourceId, mjd);
    }
}
