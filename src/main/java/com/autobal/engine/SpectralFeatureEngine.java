package com.autobal.engine;

import com.autobal.model.ContinuumParameters;
import com.autobal.model.DetectionSettings;
import com.autobal.model.EpochMetrics;
import com.autobal.model.EpochSpectrum;
import com.autobal.model.SpectrumShapeException;
import com.autobal.model.TroughComponent;
import com.autobal.model.WavelengthGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-epoch absorption analysis: smooth, normalize, segment, measure, aggregate.
 *
 * <p>Stateless apart from its immutable settings, so one instance can serve any number of
 * epochs concurrently. Inputs are never modified.
 */
public class SpectralFeatureEngine {

    private static final Logger log = LoggerFactory.getLogger(SpectralFeatureEngine.class);

    private final DetectionSettings settings;
    private final SavitzkyGolaySmoother smoother = new SavitzkyGolaySmoother();
    private final TransmissionNormalizer normalizer = new TransmissionNormalizer();
    private final TroughSegmenter segmenter;
    private final ComponentMeasurer measurer;

    public SpectralFeatureEngine() {
        this(DetectionSettings.DEFAULTS);
    }

    public SpectralFeatureEngine(DetectionSettings settings) {
        this.settings = settings;
        this.segmenter = new TroughSegmenter(settings.absorptionThreshold());
        this.measurer = new ComponentMeasurer(settings);
    }

    /**
     * Analyse one epoch.
     *
     * @throws SpectrumShapeException                          if the curves do not match the grid
     * @throws com.autobal.model.InvalidContinuumException     if the continuum is not strictly positive and finite
     */
    public EpochMetrics analyzeEpoch(WavelengthGrid grid, double[] flux, double[] continuum,
                                     String epochLabel, String sourceId, double mjd) {
        return analyze(grid, flux, continuum, epochLabel, sourceId, mjd, ContinuumParameters.UNSPECIFIED);
    }

    public EpochMetrics analyzeEpoch(EpochSpectrum spectrum) {
        return analyze(spectrum.grid(), spectrum.flux(), spectrum.continuum(),
                spectrum.epochLabel(), spectrum.sourceId(), spectrum.mjd(), spectrum.continuumParameters());
    }

    /**
     * The accepted components of an epoch, in scan order, unrounded.
     */
    public List<TroughComponent> detectComponents(WavelengthGrid grid, double[] flux, double[] continuum) {
        List<TroughComponent> components = new ArrayList<>();
        double[] transmission = transmission(grid, flux, continuum);
        segmenter.segment(transmission, run ->
                measurer.measure(run, transmission, grid).ifPresent(components::add));
        return components;
    }

    private EpochMetrics analyze(WavelengthGrid grid, double[] flux, double[] continuum,
                                 String epochLabel, String sourceId, double mjd,
                                 ContinuumParameters continuumParameters) {
        EpochAggregator aggregator = new EpochAggregator();
        for (TroughComponent component : detectComponents(grid, flux, continuum)) {
            aggregator.add(component);
        }
        EpochMetrics metrics = aggregator.complete(epochLabel, sourceId, mjd, continuumParameters);
        log.debug("[{}@{}] {} component(s), ew={} depth={} v={}",
                sourceId, epochLabel, metrics.troughCount(), metrics.ew(), metrics.depth(), metrics.velocity());
        return metrics;
    }

    private double[] transmission(WavelengthGrid grid, double[] flux, double[] continuum) {
        if (grid == null || flux == null || continuum == null) {
            throw new SpectrumShapeException("Grid and curves must not be null");
        }
        if (flux.length != grid.size() || continuum.length != grid.size()) {
            throw new SpectrumShapeException(String.format(
                    "Curve lengths must match the grid: grid=%d flux=%d continuum=%d",
                    grid.size(), flux.length, continuum.length));
        }
        return normalizer.normalize(smoother.smooth(flux), continuum);
    }

    public DetectionSettings getSettings() {
        return settings;
    }
}
