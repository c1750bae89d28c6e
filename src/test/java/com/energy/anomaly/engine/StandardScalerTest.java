package com.energy.anomaly.engine;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class StandardScalerTest {

    @Test
    void fit_usesPopulationStdAndLeavesConstantColumnsUnscaled() {
        StandardScaler scaler = StandardScaler.fit(new double[][]{{1, 10}, {3, 10}});

        assertThat(scaler.getMeans()).containsExactly(2.0, 10.0);
        assertThat(scaler.getScales()).containsExactly(1.0, 1.0);
    }

    @Test
    void transform_reusesFittedStatistics() {
        StandardScaler scaler = StandardScaler.fit(new double[][]{{0}, {2}, {4}});

        double[][] scaled = scaler.transform(new double[][]{{10}});

        // mean 2, population std sqrt(8/3)
        assertThat(scaled[0][0]).isCloseTo(8.0 / Math.sqrt(8.0 / 3.0), within(1e-12));
    }

    @Test
    void transform_wrongArity_throwsSchemaMismatch() {
        StandardScaler scaler = StandardScaler.fit(new double[][]{{1, 2, 3}, {4, 5, 6}});

        assertThatThrownBy(() -> scaler.transform(new double[][]{{1, 2}}))
                .isInstanceOf(SchemaMismatchException.class)
                .hasMessageContaining("Expected 3 features but got 2");
    }

    @Test
    void fit_emptyMatrix_fails() {
        assertThatThrownBy(() -> StandardScaler.fit(new double[0][]))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
