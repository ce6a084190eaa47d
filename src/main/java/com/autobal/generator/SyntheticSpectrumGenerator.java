package com.autobal.generator;

import com.autobal.model.ContinuumParameters;
import com.autobal.model.DetectionSettings;
import com.autobal.model.EpochSpectrum;
import com.autobal.model.WavelengthGrid;
import com.autobal.service.AnalysisService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Simulated BAL quasar epoch producer.
 *
 * <p>Builds power-law plus C IV emission spectra with one to three Gaussian absorption troughs
 * for each configured source, one new epoch per source per tick, and feeds them to the
 * {@link AnalysisService}. Enabled only when {@code autobal.generator.enabled=true}.
 *
 * <p>Each epoch draws from a {@link Random} seeded by its source and epoch index, so the same
 * epoch is always generated identically.
 */
@Component
@ConditionalOnProperty(name = "autobal.generator.enabled", havingValue = "true", matchIfMissing = true)
public class SyntheticSpectrumGenerator {

    private static final Logger log = LoggerFactory.getLogger(SyntheticSpectrumGenerator.class);

    public static final double WAVELENGTH_MIN = 1400.0;
    public static final double WAVELENGTH_MAX = 1700.0;
    public static final double WAVELENGTH_STEP = 0.5;

    private static final double CONTINUUM_ANCHOR = 1450.0;
    private static final double EMISSION_AMPLITUDE = 6.0;
    private static final double EMISSION_SIGMA = 12.0;
    private static final double FLUX_FLOOR = 0.1;
    private static final double NOISE_SCALE = 0.15;
    private static final double FWHM_TO_SIGMA = 2.355;
    private static final double FIRST_MJD = 55000.0;
    private static final double MJD_SPACING = 120.0;

    private final AnalysisService analysisService;
    private final WavelengthGrid grid = WavelengthGrid.range(WAVELENGTH_MIN, WAVELENGTH_MAX, WAVELENGTH_STEP);
    private final int maxEpochsPerSource;

    /** Next epoch index per source */
    private final Map<String, Integer> nextEpoch = new ConcurrentHashMap<>();
    private final AtomicLong epochCount = new AtomicLong(0);

    public SyntheticSpectrumGenerator(
            AnalysisService analysisService,
            @Value("${autobal.generator.sources:SDSS J4055-0596,SDSS J6100-0100}") List<String> sources,
            @Value("${autobal.generator.max-epochs:8}") int maxEpochsPerSource) {
        this.analysisService = analysisService;
        this.maxEpochsPerSource = maxEpochsPerSource;
        for (String source : sources) {
            nextEpoch.put(source, 0);
        }
        log.info("SyntheticSpectrumGenerator initialized with sources: {} ({} epochs each)", sources, maxEpochsPerSource);
    }

    /**
     * Generate and analyse one new epoch per source that has not reached its epoch limit.
     * Rate is controlled by {@code autobal.generator.interval-ms}.
     */
    @Scheduled(fixedRateString = "${autobal.generator.interval-ms:5000}")
    public void generate() {
        nextEpoch.replaceAll((sourceId, epochIndex) -> {
            if (epochIndex >= maxEpochsPerSource) {
                return epochIndex;
            }
            double mjd = FIRST_MJD + epochIndex * MJD_SPACING;
            try {
                analysisService.analyze(synthesize(sourceId, epochIndex, mjd));
            } catch (IllegalArgumentException e) {
                log.warn("[{}] Synthetic epoch {} was rejected: {}", sourceId, epochIndex, e.getMessage());
            }
            long count = epochCount.incrementAndGet();
            if (count % 10 == 0) {
                log.info("Generated {} synthetic epochs", count);
            }
            return epochIndex + 1;
        });
    }

    /**
     * Build the spectrum of one epoch. Deterministic in its arguments.
     */
    public EpochSpectrum synthesize(String sourceId, int epochIndex, double mjd) {
        Random random = new Random(Objects.hash(sourceId, epochIndex));
        int seed = Math.abs(Objects.hash(sourceId, epochIndex) % 100_000);

        double spectralIndex = -1.5 + Math.sin(epochIndex) * 0.2;
        double amplitude = 10 * (1 + Math.cos(epochIndex * 0.5) * 0.1);

        int troughCount = 1 + seed % 3;
        double[][] troughs = new double[troughCount][];
        for (int t = 0; t < troughCount; t++) {
            double velocity = 5000 + t * 5000 + seed % 5000 + Math.sin(epochIndex + t) * 1000;
            double center = DetectionSettings.C_IV_REFERENCE_LINE * (1 - velocity / DetectionSettings.LIGHT_SPEED_KM_S);
            double widthKmS = 1000 + seed % 1500;
            double sigma = (widthKmS / DetectionSettings.LIGHT_SPEED_KM_S) * center / FWHM_TO_SIGMA;
            double depth = 0.3 + random.nextDouble() * 0.5;
            troughs[t] = new double[]{center, sigma, depth};
        }

        int n = grid.size();
        double[] flux = new double[n];
        double[] continuum = new double[n];
        for (int i = 0; i < n; i++) {
            double w = grid.at(i);
            double powerLaw = amplitude * Math.pow(w / CONTINUUM_ANCHOR, spectralIndex);
            double emission = EMISSION_AMPLITUDE * gaussian(w, DetectionSettings.C_IV_REFERENCE_LINE, EMISSION_SIGMA);

            double transmission = 1.0;
            for (double[] trough : troughs) {
                transmission *= 1 - trough[2] * gaussian(w, trough[0], trough[1]);
            }

            double noise = (Math.sin(w * mjd) * 0.5 + (random.nextDouble() - 0.5)) * NOISE_SCALE;
            flux[i] = Math.max(FLUX_FLOOR, (powerLaw + emission) * transmission + noise);
            continuum[i] = powerLaw + emission;
        }

        String label = String.format("%s_epoch%d_MJD%d", sourceId.replace(' ', '-'), epochIndex, (long) mjd);
        return new EpochSpectrum(grid, flux, continuum, label, sourceId, mjd,
                new ContinuumParameters(amplitude, spectralIndex));
    }

    private static double gaussian(double x, double center, double sigma) {
        double z = (x - center) / sigma;
        return Math.exp(-0.5 * z * z);
    }

    /**
     * Total epochs generated since startup, exposed for status.
     */
    public long getEpochCount() {
        return epochCount.get();
    }

    public WavelengthGrid getGrid() {
        return grid;
    }
}
