package com.fraud.analytics.classifier;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class EvaluationMetricsTest {

    @Test
    void nonLegitimateClassesCountAsPositive() {
        // actual:    L L S F F L
        // predicted: L F S F L L
        EvaluationMetrics m = EvaluationMetrics.from(List.of(0, 2, 1, 2, 0, 0), List.of(0, 0, 1, 2, 2, 0), 3);

        assertThat(m.getSampleCount()).isEqualTo(6);
        assertThat(m.getAccuracy()).isCloseTo(4 / 6.0, within(1e-12));
        assertThat(m.getTruePositives()).isEqualTo(2);
        assertThat(m.getFalsePositives()).isEqualTo(1);
        assertThat(m.getFalseNegatives()).isEqualTo(1);
        assertThat(m.getTrueNegatives()).isEqualTo(2);
        assertThat(m.getPrecision()).isCloseTo(2 / 3.0, within(1e-12));
        assertThat(m.getRecall()).isCloseTo(2 / 3.0, within(1e-12));
        assertThat(m.getF1Score()).isCloseTo(2 / 3.0, within(1e-12));
        assertThat(m.getSpecificity()).isCloseTo(2 / 3.0, within(1e-12));
        assertThat(m.getConfusionMatrix()[0][2]).isEqualTo(1);
        assertThat(m.getConfusionMatrix()[2][0]).isEqualTo(1);
    }

    @Test
    void emptySetHasZeroMetrics() {
        EvaluationMetrics m = EvaluationMetrics.from(List.of(), List.of(), 2);

        assertThat(m.getAccuracy()).isZero();
        assertThat(m.getPrecision()).isZero();
        assertThat(m.getF1Score()).isZero();
    }

    @Test
    void mismatchedSizesAreRejected() {
        assertThatThrownBy(() -> EvaluationMetrics.from(List.of(0), List.of(0, 1), 2))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
