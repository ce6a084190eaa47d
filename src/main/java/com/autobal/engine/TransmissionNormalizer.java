package com.autobal.engine;

import com.autobal.model.InvalidContinuumException;
import com.autobal.model.SpectrumShapeException;

/**
 * Divides smoothed flux by the continuum model to give a transmission curve (1.0 = unabsorbed).
 */
public class TransmissionNormalizer {

    public double[] normalize(double[] flux, double[] continuum) {
        if (flux.length != continuum.length) {
            throw new SpectrumShapeException(
                    "Flux and continuum lengths differ: " + flux.length + " vs " + continuum.length);
        }
        validateContinuum(continuum);
        double[] transmission = new double[flux.length];
        for (int i = 0; i < flux.length; i++) {
            transmission[i] = flux[i] / continuum[i];
        }
        return transmission;
    }

    /**
     * @throws InvalidContinuumException at the first non-positive or non-finite sample
     */
    public void validateContinuum(double[] continuum) {
        for (int i = 0; i < continuum.length; i++) {
            double c = continuum[i];
            if (!Double.isFinite(c) || c <= 0) {
                throw new InvalidContinuumException(i, c);
            }
        }
    }
}
