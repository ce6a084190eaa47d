package com.autobal.generator;

import com.autobal.engine.SpectralFeatureEngine;
import com.autobal.model.EpochMetrics;
import com.autobal.model.EpochSpectrum;
import com.autobal.service.AnalysisService;
import com.autobal.store.EpochMetricsStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SyntheticSpectrumGenerator")
class SyntheticSpectrumGeneratorTest {

    private EpochMetricsStore store;
    private SyntheticSpectrumGenerator generator;

    @BeforeEach
    void setUp() {
        store = new EpochMetricsStore();
        AnalysisService service = new AnalysisService(new SpectralFeatureEngine(), store, Runnable::run);
        generator = new SyntheticSpectrumGenerator(service, List.of("J1", "J2"), 3);
    }

    @Test
    @DisplayName("spectra cover 1400-1700 Å at 0.5 Å with a positive continuum")
    void spectrumShape() {
        EpochSpectrum spectrum = generator.synthesize("J1", 0, 55000);

        assertThat(spectrum.grid().size()).isEqualTo(601);
        assertThat(spectrum.flux()).hasSize(601);
        assertThat(Arrays.stream(spectrum.continuum()).min().orElseThrow()).isPositive();
        assertThat(Arrays.stream(spectrum.flux()).min().orElseThrow()).isGreaterThanOrEqualTo(0.1);
        assertThat(spectrum.sourceId()).isEqualTo("J1");
        assertThat(spectrum.continuumParameters().amplitude()).isPositive();
    }

    @Test
    @DisplayName("the same source and epoch always produce the same spectrum")
    void deterministic() {
        EpochSpectrum first = generator.synthesize("J1", 2, 55240);
        EpochSpectrum second = generator.synthesize("J1", 2, 55240);

        assertThat(second.flux()).containsExactly(first.flux());
        assertThat(second.continuum()).containsExactly(first.continuum());
    }

    @Test
    @DisplayName("generated epochs contain detectable troughs")
    void troughsAreDetected() {
        EpochMetrics metrics = new SpectralFeatureEngine().analyzeEpoch(generator.synthesize("J1", 0, 55000));
        assertThat(metrics.troughCount()).isGreaterThanOrEqualTo(1);
        assertThat(metrics.velocity()).isPositive();
    }

    @Test
    @DisplayName("each tick adds one epoch per source until the limit is reached")
    void stopsAtEpochLimit() {
        for (int i = 0; i < 5; i++) {
            generator.generate();
        }

        assertThat(generator.getEpochCount()).isEqualTo(6);
        assertThat(store.query("J1")).hasSize(3);
        assertThat(store.query("J2")).hasSize(3);
        assertThat(store.query("J1")).extracting(EpochMetrics::mjd).containsExactly(55000.0, 55120.0, 55240.0);
    }
}
