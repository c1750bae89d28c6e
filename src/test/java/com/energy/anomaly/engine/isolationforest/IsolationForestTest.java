package com.energy.anomaly.engine.isolationforest;

import com.energy.anomaly.engine.SchemaMismatchException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class IsolationForestTest {

    private double[][] training;

    @BeforeEach
    void setUp() {
        Random random = new Random(11);
        training = new double[200][];
        for (int i = 0; i < training.length; i++) {
            training[i] = new double[]{random.nextGaussian(), random.nextGaussian()};
        }
    }

    @Test
    void anomalyScore_isolatedPointScoresHigherThanTypicalPoint() {
        IsolationForest forest = IsolationForest.train(training, 100, 256, 0.05, 42L);

        double outlier = forest.anomalyScore(new double[]{8.0, 8.0});
        double typical = forest.anomalyScore(new double[]{0.0, 0.0});

        assertThat(outlier).isGreaterThan(typical);
        assertThat(outlier).isBetween(0.0, 1.0);
        assertThat(forest.predict(new double[][]{{8.0, 8.0}})[0]).isTrue();
    }

    @Test
    void predict_flagsRoughlyContaminationShareOfTrainingData() {
        IsolationForest forest = IsolationForest.train(training, 100, 256, 0.05, 42L);

        int flagged = 0;
        for (boolean anomalous : forest.predict(training)) {
            if (anomalous) flagged++;
        }

        assertThat(flagged).isBetween(1, 10);
    }

    @Test
    void train_sameSeed_sameScores() {
        IsolationForest first = IsolationForest.train(training, 50, 64, 0.05, 3L);
        IsolationForest second = IsolationForest.train(training, 50, 64, 0.05, 3L);

        assertThat(first.anomalyScores(training)).containsExactly(second.anomalyScores(training));
        assertThat(first.getThreshold()).isEqualTo(second.getThreshold());
    }

    @Test
    void train_sampleSizeCappedAtDataSize() {
        IsolationForest forest = IsolationForest.train(training, 10, 1024, 0.05, 42L);

        assertThat(forest.getSampleSize()).isEqualTo(200);
        assertThat(forest.getTrees()).hasSize(10);
        assertThat(forest.getFeatureCount()).isEqualTo(2);
    }

    @Test
    void train_invalidContamination_fails() {
        assertThatThrownBy(() -> IsolationForest.train(training, 10, 256, 0.0, 42L))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> IsolationForest.train(training, 10, 256, 0.6, 42L))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void anomalyScore_wrongArity_throwsSchemaMismatch() {
        IsolationForest forest = IsolationForest.train(training, 10, 256, 0.05, 42L);

        assertThatThrownBy(() -> forest.anomalyScore(new double[]{1.0}))
                .isInstanceOf(SchemaMismatchException.class);
    }

    @Test
    void averagePathLength_matchesHarmonicApproximation() {
        assertThat(IsolationNode.averagePathLength(1)).isEqualTo(0.0);
        assertThat(IsolationNode.averagePathLength(2)).isEqualTo(1.0);
        assertThat(IsolationNode.averagePathLength(256)).isCloseTo(10.2448, within(1e-3));
    }
}
