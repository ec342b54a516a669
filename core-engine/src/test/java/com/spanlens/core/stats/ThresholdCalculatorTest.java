package com.spanlens.core.stats;

import com.spanlens.core.model.CascadeStrength;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ThresholdCalculator} and {@link QuantileCutPoints}.
 */
class ThresholdCalculatorTest {

    @Test
    @DisplayName("Should pick the lower nearest-rank order statistic")
    void shouldPickLowerNearestRank() {
        List<Double> thresholds = ThresholdCalculator.quantileThresholds(
                List.of(5.0, 1.0, 3.0, 2.0, 4.0), List.of(0.0, 0.25, 0.5, 0.75, 1.0));

        assertThat(thresholds).containsExactly(1.0, 2.0, 3.0, 4.0, 5.0);
    }

    @Test
    @DisplayName("Should return 0.0 per quantile for an empty sample")
    void shouldReturnZerosForEmptySample() {
        assertThat(ThresholdCalculator.quantileThresholds(List.of(), ThresholdCalculator.STANDARD_QUANTILES))
                .containsExactly(0.0, 0.0, 0.0);
    }

    @Test
    @DisplayName("Should not depend on input order")
    void shouldBeOrderInvariant() {
        List<Double> samples = new ArrayList<>();
        Random random = new Random(7);
        for (int i = 0; i < 200; i++) {
            samples.add(random.nextDouble() * 100);
        }
        List<Double> shuffled = new ArrayList<>(samples);
        Collections.shuffle(shuffled, new Random(11));

        assertThat(ThresholdCalculator.quantileThresholds(shuffled, ThresholdCalculator.STANDARD_QUANTILES))
                .isEqualTo(ThresholdCalculator.quantileThresholds(samples, ThresholdCalculator.STANDARD_QUANTILES));
    }

    @Test
    @DisplayName("Should be monotone in the quantile")
    void shouldBeMonotone() {
        List<Double> samples = Arrays.asList(9.0, 3.5, 7.25, 1.0, 4.0, 4.0, 12.0, 0.5);
        List<Double> quantiles = List.of(0.0, 0.1, 0.2, 0.3, 0.4, 0.5, 0.6, 0.7, 0.8, 0.9, 1.0);

        List<Double> thresholds = ThresholdCalculator.quantileThresholds(samples, quantiles);

        for (int i = 1; i < thresholds.size(); i++) {
            assertThat(thresholds.get(i)).isGreaterThanOrEqualTo(thresholds.get(i - 1));
        }
    }

    @Test
    @DisplayName("Should ignore non-finite samples and clamp quantiles")
    void shouldIgnoreNonFiniteAndClamp() {
        List<Double> samples = Arrays.asList(2.0, Double.NaN, null, 8.0, Double.POSITIVE_INFINITY);

        assertThat(ThresholdCalculator.quantileThresholds(samples, List.of(-1.0, 2.0)))
                .containsExactly(2.0, 8.0);
    }

    @Test
    @DisplayName("Should classify strengths against the lower and upper cut points")
    void shouldClassifyAgainstCutPoints() {
        QuantileCutPoints cuts = new QuantileCutPoints(0.3, 0.5, 0.7);

        assertThat(cuts.classify(0.1)).isEqualTo(CascadeStrength.WEAK);
        assertThat(cuts.classify(0.3)).isEqualTo(CascadeStrength.MODERATE);
        assertThat(cuts.classify(0.69)).isEqualTo(CascadeStrength.MODERATE);
        assertThat(cuts.classify(0.7)).isEqualTo(CascadeStrength.STRONG);
    }

    @Test
    @DisplayName("Should require exactly three ascending quantiles for cut points")
    void shouldValidateCutPointQuantiles() {
        assertThatThrownBy(() -> ThresholdCalculator.cutPoints(List.of(1.0), List.of(0.5)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new QuantileCutPoints(0.8, 0.5, 0.9))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ascending");
    }
}
