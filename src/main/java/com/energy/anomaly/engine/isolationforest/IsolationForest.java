package com.energy.anomaly.engine.isolationforest;

import com.energy.anomaly.engine.Quantiles;
import com.energy.anomaly.engine.SchemaMismatchException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Ensemble of isolation trees. Points that are isolated after few random splits get a high
 * anomaly score. The decision threshold is calibrated on the training data so that roughly
 * {@code contamination} of it is flagged.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class IsolationForest {

    private final List<IsolationTree> trees;
    private final int sampleSize;
    private final int featureCount;
    private final double contamination;
    private final double threshold;

    @JsonCreator
    public IsolationForest(@JsonProperty("trees") List<IsolationTree> trees,
                           @JsonProperty("sampleSize") int sampleSize,
                           @JsonProperty("featureCount") int featureCount,
                           @JsonProperty("contamination") double contamination,
                           @JsonProperty("threshold") double threshold) {
        this.trees = List.copyOf(trees);
        this.sampleSize = sampleSize;
        this.featureCount = featureCount;
        this.contamination = contamination;
        this.threshold = threshold;
    }

    /**
     * Train the isolation forest and calibrate its decision threshold.
     *
     * @param data          training samples, each row is a feature vector
     * @param numTrees      number of trees in the forest (typically 100)
     * @param sampleSize    sub-sampling size per tree (typically 256)
     * @param contamination expected share of anomalies in {@code data}, in (0, 0.5]
     * @param seed          random seed for reproducibility
     */
    public static IsolationForest train(double[][] data, int numTrees, int sampleSize,
                                        double contamination, long seed) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot train an isolation forest on an empty matrix");
        }
        if (contamination <= 0 || contamination > 0.5) {
            throw new IllegalArgumentException("Contamination must be in (0, 0.5], got " + contamination);
        }

        int effectiveSampleSize = Math.min(sampleSize, data.length);
        int maxDepth = (int) Math.ceil(Math.log(Math.max(effectiveSampleSize, 2)) / Math.log(2));
        List<IsolationTree> trees = new ArrayList<>(numTrees);

        Random random = new Random(seed);
        for (int i = 0; i < numTrees; i++) {
            double[][] sample = subsample(data, effectiveSampleSize, random);
            trees.add(IsolationTree.build(sample, maxDepth, random));
        }

        IsolationForest uncalibrated = new IsolationForest(trees, effectiveSampleSize, data[0].length,
                contamination, Double.NaN);
        double[] trainingScores = uncalibrated.anomalyScores(data);
        double threshold = Quantiles.percentile(trainingScores, 100.0 * (1.0 - contamination));

        return new IsolationForest(trees, effectiveSampleSize, data[0].length, contamination, threshold);
    }

    /**
     * Compute anomaly score for a single point.
     *
     * @return score between 0.0 (normal) and 1.0 (anomalous).
     *         s(x, n) = 2^(-E(h(x)) / c(n))
     */
    public double anomalyScore(double[] point) {
        if (point.length != featureCount) {
            throw new SchemaMismatchException(featureCount, point.length);
        }
        if (trees.isEmpty()) return 0.0;

        double avgPathLength = 0.0;
        for (IsolationTree tree : trees) {
            avgPathLength += tree.pathLength(point);
        }
        avgPathLength /= trees.size();

        double c = IsolationNode.averagePathLength(sampleSize);
        if (c <= 0) return 0.0;

        return Math.pow(2.0, -avgPathLength / c);
    }

    public double[] anomalyScores(double[][] data) {
        double[] scores = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            scores[i] = anomalyScore(data[i]);
        }
        return scores;
    }

    /**
     * @return true for points scoring strictly above the calibrated threshold
     */
    public boolean[] predict(double[][] data) {
        boolean[] anomalous = new boolean[data.length];
        for (int i = 0; i < data.length; i++) {
            anomalous[i] = anomalyScore(data[i]) > threshold;
        }
        return anomalous;
    }

    private static double[][] subsample(double[][] data, int size, Random random) {
        if (data.length <= size) {
            return Arrays.copyOf(data, data.length);
        }
        double[][] sample = new double[size][];
        // Partial Fisher-Yates shuffle on indices
        int[] indices = new int[data.length];
        for (int i = 0; i < data.length; i++) indices[i] = i;
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(data.length - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
            sample[i] = data[indices[i]];
        }
        return sample;
    }

    public List<IsolationTree> getTrees() { return trees; }
    public int getSampleSize() { return sampleSize; }
    public int getFeatureCount() { return featureCount; }
    public double getContamination() { return contamination; }
    public double getThreshold() { return threshold; }
}
