package com.autobal.engine;

import com.autobal.model.ContinuumParameters;
import com.autobal.model.EpochMetrics;
import com.autobal.model.TroughComponent;

/**
 * Mutable accumulator folding one epoch's accepted components into an {@link EpochMetrics}.
 *
 * <p>Not thread-safe; one instance per epoch. Components must be added in scan order so that
 * the first of several equally deep components supplies the reported velocity.
 * Rounding happens once, in {@link #complete}.
 */
public class EpochAggregator {

    static final int EW_DECIMALS = 2;
    static final int DEPTH_DECIMALS = 3;
    static final int VELOCITY_DECIMALS = 0;
    static final int CONTINUUM_DECIMALS = 2;
    static final int SPECTRAL_INDEX_DECIMALS = 3;
    static final int LUMINOSITY_DECIMALS = 2;

    private double totalEquivalentWidth;
    private double totalVelocityWidth;
    private double maxDepth;
    private double deepestVelocity;
    private int componentCount;

    /**
     * Incorporate one accepted component.
     */
    public void add(TroughComponent component) {
        componentCount++;
        totalEquivalentWidth += component.equivalentWidth();
        totalVelocityWidth += component.velocityExtent();
        if (component.depth() > maxDepth) {
            maxDepth = component.depth();
            deepestVelocity = component.centroidVelocity();
        }
    }

    public int getComponentCount() {
        return componentCount;
    }

    /**
     * Produce the rounded, immutable record for this epoch.
     */
    public EpochMetrics complete(String epoch, String sourceId, double mjd, ContinuumParameters continuum) {
        return new EpochMetrics(
                epoch,
                sourceId,
                mjd,
                round(totalEquivalentWidth, EW_DECIMALS),
                round(maxDepth, DEPTH_DECIMALS),
                round(totalVelocityWidth, VELOCITY_DECIMALS),
                round(deepestVelocity, VELOCITY_DECIMALS),
                round(continuum.amplitude(), CONTINUUM_DECIMALS),
                round(continuum.spectralIndex(), SPECTRAL_INDEX_DECIMALS),
                round(continuum.luminosity(), LUMINOSITY_DECIMALS),
                componentCount);
    }

    static double round(double value, int decimals) {
        double scale = Math.pow(10, decimals);
        return Math.round(value * scale) / scale;
    }
}
