package com.autobal.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("SavitzkyGolaySmoother")
class SavitzkyGolaySmootherTest {

    private final SavitzkyGolaySmoother smoother = new SavitzkyGolaySmoother();

    @ParameterizedTest(name = "length {0} is returned unchanged")
    @ValueSource(ints = {0, 1, 2, 3, 4})
    @DisplayName("sequences shorter than the window are returned unchanged")
    void shortInputIsIdentity(int length) {
        double[] input = new double[length];
        for (int i = 0; i < length; i++) {
            input[i] = Math.sin(i) * 7 + 3;
        }
        assertThat(smoother.smooth(input)).containsExactly(input);
    }

    @Test
    @DisplayName("interior samples use the (-3, 12, 17, 12, -3) / 35 kernel")
    void kernelWeights() {
        double[] result = smoother.smooth(new double[]{0, 0, 0, 35, 0, 0, 0});
        assertThat(result).containsExactly(0, 0, 12, 17, 12, 0, 0);
    }

    @Test
    @DisplayName("first two and last two samples pass through without edge correction")
    void edgesPassThrough() {
        double[] input = {0, 35, 0, 0, 0, 35, 0};
        double[] result = smoother.smooth(input);
        assertThat(result[0]).isEqualTo(0);
        assertThat(result[1]).isEqualTo(35);
        assertThat(result[5]).isEqualTo(35);
        assertThat(result[6]).isEqualTo(0);
        // interior samples still see the spikes
        assertThat(result[2]).isEqualTo(12);
        assertThat(result[3]).isEqualTo(-6);
        assertThat(result[4]).isEqualTo(12);
    }

    @Test
    @DisplayName("cubic polynomials are preserved at interior samples")
    void preservesCubics() {
        double[] input = new double[12];
        for (int i = 0; i < input.length; i++) {
            input[i] = 0.5 * i * i * i - 2 * i * i + i - 4;
        }
        double[] result = smoother.smooth(input);
        for (int i = 0; i < input.length; i++) {
            assertThat(result[i]).isCloseTo(input[i], within(1e-9));
        }
    }

    @Test
    @DisplayName("input array is not modified")
    void doesNotMutateInput() {
        double[] input = {5, 1, 9, 2, 8, 3, 7};
        double[] copy = Arrays.copyOf(input, input.length);
        smoother.smooth(input);
        assertThat(input).containsExactly(copy);
    }
}
