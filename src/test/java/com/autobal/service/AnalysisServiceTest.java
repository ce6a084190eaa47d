package com.autobal.service;

import com.autobal.SpectrumFixtures;
import com.autobal.engine.SpectralFeatureEngine;
import com.autobal.model.EpochMetrics;
import com.autobal.model.EpochSpectrum;
import com.autobal.model.InvalidContinuumException;
import com.autobal.model.SpectrumShapeException;
import com.autobal.store.EpochMetricsStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static com.autobal.SpectrumFixtures.GRID;
import static com.autobal.SpectrumFixtures.gaussianTransmission;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AnalysisService")
class AnalysisServiceTest {

    private EpochMetricsStore store;
    private AnalysisService service;

    private static EpochSpectrum dipEpoch(String source, String epoch, double mjd) {
        return SpectrumFixtures.epoch(source, epoch, mjd, gaussianTransmission(GRID, 0.5, 1530.0, 2.0));
    }

    private static EpochSpectrum badContinuumEpoch(String source, String epoch) {
        double[] continuum = SpectrumFixtures.flatContinuum(GRID);
        continuum[7] = -1.0;
        return new EpochSpectrum(GRID, SpectrumFixtures.unabsorbed(GRID), continuum, epoch, source, 55000);
    }

    @BeforeEach
    void setUp() {
        store = new EpochMetricsStore();
        service = new AnalysisService(new SpectralFeatureEngine(), store, Runnable::run);
    }

    @Test
    @DisplayName("analyze stores and returns the epoch's metrics")
    void analyzeStores() {
        EpochMetrics metrics = service.analyze(dipEpoch("J1", "e1", 55100));

        assertThat(metrics.troughCount()).isEqualTo(1);
        assertThat(store.find("J1", "e1")).contains(metrics);
        assertThat(service.getAnalyzedCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("rejected epochs propagate their error and are not stored")
    void analyzeRejects() {
        assertThatThrownBy(() -> service.analyze(badContinuumEpoch("J1", "bad")))
                .isInstanceOf(InvalidContinuumException.class);
        assertThat(store.totalEpochs()).isZero();
        assertThat(service.getFailedCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("a failed epoch does not stop the rest of the batch")
    void batchIsolatesFailures() {
        BatchResult result = service.analyzeBatch(List.of(
                dipEpoch("J1", "e1", 55100),
                badContinuumEpoch("J1", "e2"),
                dipEpoch("J1", "e3", 55300)));

        assertThat(result.succeeded()).isEqualTo(2);
        assertThat(result.failed()).isEqualTo(1);
        assertThat(result.outcomes()).extracting(EpochOutcome::epoch).containsExactly("e1", "e2", "e3");
        assertThat(result.outcomes().get(1).errorCode()).isEqualTo(InvalidContinuumException.CODE);
        assertThat(result.outcomes().get(1).metrics()).isNull();
        assertThat(store.query("J1")).extracting(EpochMetrics::epoch).containsExactly("e1", "e3");
    }

    @Test
    @DisplayName("conversion failures are reported per epoch with their own code")
    void conversionFailures() {
        List<String> inputs = List.of("ok", "short", "blank");
        BatchResult result = service.analyzeEach(inputs, input -> switch (input) {
            case "ok" -> dipEpoch("J1", "ok", 55100);
            case "short" -> new EpochSpectrum(GRID, Arrays.copyOf(SpectrumFixtures.unabsorbed(GRID), 10),
                    SpectrumFixtures.flatContinuum(GRID), "short", "J1", 55100);
            default -> new EpochSpectrum(GRID, SpectrumFixtures.unabsorbed(GRID),
                    SpectrumFixtures.flatContinuum(GRID), " ", "J1", 55100);
        }, input -> input, input -> "J1");

        assertThat(result.outcomes()).extracting(EpochOutcome::errorCode)
                .containsExactly(null, SpectrumShapeException.CODE, AnalysisService.BAD_REQUEST);
        assertThat(service.getFailedCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("a null entry fails on its own and the rest of the batch still runs")
    void nullEntryInBatch() {
        BatchResult result = service.analyzeBatch(Arrays.asList(
                dipEpoch("J1", "e1", 55100),
                null,
                dipEpoch("J1", "e3", 55300)));

        assertThat(result.succeeded()).isEqualTo(2);
        assertThat(result.failed()).isEqualTo(1);
        assertThat(result.outcomes()).extracting(EpochOutcome::epoch).containsExactly("e1", null, "e3");
        assertThat(result.outcomes().get(1).errorCode()).isEqualTo(AnalysisService.BAD_REQUEST);
        assertThat(store.query("J1")).extracting(EpochMetrics::epoch).containsExactly("e1", "e3");
        assertThat(service.getFailedCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("an identifier extractor that throws fails only its own entry")
    void throwingIdentifierExtractor() {
        BatchResult result = service.analyzeEach(List.of("ok", "broken"),
                input -> dipEpoch("J1", input, 55100),
                input -> {
                    if (input.equals("broken")) {
                        throw new IllegalArgumentException("epoch label missing");
                    }
                    return input;
                },
                input -> "J1");

        assertThat(result.succeeded()).isEqualTo(1);
        assertThat(result.outcomes().get(1).errorCode()).isEqualTo(AnalysisService.BAD_REQUEST);
        assertThat(result.outcomes().get(1).message()).contains("epoch label missing");
    }
}
