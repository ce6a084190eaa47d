package com.autobal.service;

import com.autobal.engine.SpectralFeatureEngine;
import com.autobal.model.EpochMetrics;
import com.autobal.model.EpochSpectrum;
import com.autobal.model.InvalidSpectrumException;
import com.autobal.store.EpochMetricsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Central orchestration service that:
 * <ul>
 *   <li>Runs the {@link SpectralFeatureEngine} on single epochs or batches</li>
 *   <li>Fans batches out to the epoch executor, one task per epoch</li>
 *   <li>Stores every successful result in {@link EpochMetricsStore}</li>
 * </ul>
 *
 * <p>A failed epoch never affects the others in its batch; the caller sees it as a failed
 * {@link EpochOutcome}. Nothing is retried since every failure is a function of the input.
 */
@Service
public class AnalysisService {

    private static final Logger log = LoggerFactory.getLogger(AnalysisService.class);

    public static final String BAD_REQUEST = "BAD_REQUEST";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private final SpectralFeatureEngine engine;
    private final EpochMetricsStore store;
    private final Executor epochExecutor;

    private final AtomicLong analyzedCount = new AtomicLong();
    private final AtomicLong failedCount = new AtomicLong();

    public AnalysisService(SpectralFeatureEngine engine,
                           EpochMetricsStore store,
                           @Qualifier("epochExecutor") Executor epochExecutor) {
        this.engine = engine;
        this.store = store;
        this.epochExecutor = epochExecutor;
    }

    /**
     * Analyse and store one epoch.
     *
     * @throws InvalidSpectrumException if the epoch's shape or continuum is invalid
     */
    public EpochMetrics analyze(EpochSpectrum spectrum) {
        EpochMetrics metrics;
        try {
            metrics = engine.analyzeEpoch(spectrum);
        } catch (InvalidSpectrumException e) {
            failedCount.incrementAndGet();
            log.warn("[{}@{}] Rejected epoch: {} {}",
                    spectrum.sourceId(), spectrum.epochLabel(), e.errorCode(), e.getMessage());
            throw e;
        }
        store.save(metrics);
        analyzedCount.incrementAndGet();
        log.info("[{}@{}] Epoch analysed: mjd={} troughs={} ew={} depth={} v={} width={}",
                metrics.sourceId(), metrics.epoch(), metrics.mjd(), metrics.troughCount(),
                metrics.ew(), metrics.depth(), metrics.velocity(), metrics.width());
        return metrics;
    }

    /**
     * Analyse a batch of epochs in parallel. Outcomes come back in input order.
     */
    public BatchResult analyzeBatch(List<EpochSpectrum> spectra) {
        return analyzeEach(spectra, Function.identity(), EpochSpectrum::epochLabel, EpochSpectrum::sourceId);
    }

    /**
     * Analyse a batch of raw inputs in parallel. Conversion to an {@link EpochSpectrum} happens
     * inside each epoch's task, so a malformed input fails only its own epoch.
     *
     * @param inputs     Raw epoch inputs
     * @param toSpectrum Conversion of one input to a spectrum; may throw
     * @param epochOf    Epoch label of an input, for failure reporting
     * @param sourceOf   Source id of an input, for failure reporting
     */
    public <T> BatchResult analyzeEach(List<T> inputs,
                                       Function<T, EpochSpectrum> toSpectrum,
                                       Function<T, String> epochOf,
                                       Function<T, String> sourceOf) {
        log.info("Analysing batch of {} epochs", inputs.size());

        List<CompletableFuture<EpochOutcome>> futures = new ArrayList<>(inputs.size());
        for (T input : inputs) {
            futures.add(CompletableFuture.supplyAsync(
                    () -> analyzeOne(input, toSpectrum, epochOf, sourceOf), epochExecutor));
        }

        List<EpochOutcome> outcomes = futures.stream().map(CompletableFuture::join).toList();
        BatchResult result = BatchResult.of(outcomes);
        log.info("Batch complete: {} succeeded, {} failed", result.succeeded(), result.failed());
        return result;
    }

    private <T> EpochOutcome analyzeOne(T input,
                                        Function<T, EpochSpectrum> toSpectrum,
                                        Function<T, String> epochOf,
                                        Function<T, String> sourceOf) {
        if (input == null) {
            failedCount.incrementAndGet();
            log.warn("Rejected null batch entry");
            return EpochOutcome.failure(null, null, BAD_REQUEST, "Batch entry must not be null");
        }

        String epoch = null;
        String sourceId = null;
        EpochSpectrum spectrum;
        try {
            epoch = epochOf.apply(input);
            sourceId = sourceOf.apply(input);
            spectrum = toSpectrum.apply(input);
        } catch (RuntimeException e) {
            failedCount.incrementAndGet();
            String code = e instanceof InvalidSpectrumException invalid ? invalid.errorCode() : BAD_REQUEST;
            log.warn("[{}@{}] Rejected malformed epoch: {} {}", sourceId, epoch, code, e.getMessage());
            return EpochOutcome.failure(epoch, sourceId, code, e.getMessage());
        }

        try {
            return EpochOutcome.success(analyze(spectrum));
        } catch (InvalidSpectrumException e) {
            // already counted and logged by analyze()
            return EpochOutcome.failure(epoch, sourceId, e.errorCode(), e.getMessage());
        } catch (RuntimeException e) {
            failedCount.incrementAndGet();
            log.error("[{}@{}] Epoch analysis failed", sourceId, epoch, e);
            return EpochOutcome.failure(epoch, sourceId, INTERNAL_ERROR, e.getMessage());
        }
    }

    public long getAnalyzedCount() {
        return analyzedCount.get();
    }

    public long getFailedCount() {
        return failedCount.get();
    }
}
