package com.autobal.engine;

import com.autobal.model.InvalidContinuumException;
import com.autobal.model.SpectrumShapeException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TransmissionNormalizer")
class TransmissionNormalizerTest {

    private final TransmissionNormalizer normalizer = new TransmissionNormalizer();

    @Test
    @DisplayName("divides flux by continuum element-wise")
    void divides() {
        double[] result = normalizer.normalize(new double[]{5, 8, 2}, new double[]{10, 8, 4});
        assertThat(result).containsExactly(0.5, 1.0, 0.5);
    }

    @ParameterizedTest(name = "continuum value {0} is rejected")
    @ValueSource(doubles = {0.0, -1.0, Double.NaN, Double.POSITIVE_INFINITY})
    @DisplayName("non-positive or non-finite continuum is an invalid-continuum error")
    void rejectsInvalidContinuum(double bad) {
        assertThatThrownBy(() -> normalizer.normalize(new double[]{1, 1, 1}, new double[]{1, bad, 1}))
                .isInstanceOf(InvalidContinuumException.class)
                .isNotInstanceOf(SpectrumShapeException.class)
                .satisfies(e -> assertThat(((InvalidContinuumException) e).getIndex()).isEqualTo(1));
    }

    @Test
    @DisplayName("length mismatch is a shape error")
    void rejectsLengthMismatch() {
        assertThatThrownBy(() -> normalizer.normalize(new double[]{1, 1, 1}, new double[]{1, 1}))
                .isInstanceOf(SpectrumShapeException.class);
    }
}
