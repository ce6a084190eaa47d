package com.autobal.model;

/**
 * An accepted absorption component with its physical measurements.
 *
 * @param start              First grid index (inclusive)
 * @param end                Last grid index (exclusive)
 * @param equivalentWidth    Absorbed-fraction integral over the run, Å
 * @param depth              1 minus the lowest transmission in the run
 * @param centroidWavelength Wavelength of the lowest-transmission sample, Å
 * @param centroidVelocity   Doppler velocity of the centroid, km/s (positive = blueshift)
 * @param velocityExtent     Velocity span between the run's first and last samples, km/s
 */
public record TroughComponent(int start,
                              int end,
                              double equivalentWidth,
                              double depth,
                              double centroidWavelength,
                              double centroidVelocity,
                              double velocityExtent) {
}
