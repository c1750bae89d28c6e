package com.energy.anomaly.engine.isolationforest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Random;

/**
 * One randomly grown isolation tree over a sub-sample of standardized feature rows.
 */
public class IsolationTree {

    private final IsolationNode root;

    @JsonCreator
    public IsolationTree(@JsonProperty("root") IsolationNode root) {
        this.root = root;
    }

    public static IsolationTree build(double[][] data, int maxDepth, Random random) {
        return new IsolationTree(buildNode(data, 0, maxDepth, random));
    }

    private static IsolationNode buildNode(double[][] data, int depth, int maxDepth, Random random) {
        int n = data.length;

        if (depth >= maxDepth || n <= 1) {
            return IsolationNode.externalNode(n);
        }

        int numFeatures = data[0].length;
        int featureIdx = random.nextInt(numFeatures);

        // Range of the chosen feature within this partition
        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        for (double[] row : data) {
            if (row[featureIdx] < min) min = row[featureIdx];
            if (row[featureIdx] > max) max = row[featureIdx];
        }

        // All rows share one value for this feature, so the node is a leaf
        if (min >= max) {
            return IsolationNode.externalNode(n);
        }

        double splitValue = min + random.nextDouble() * (max - min);

        // Partition rows around the split value
        int leftCount = 0;
        for (double[] row : data) {
            if (row[featureIdx] < splitValue) leftCount++;
        }

        double[][] leftData = new double[leftCount][];
        double[][] rightData = new double[n - leftCount][];
        int li = 0, ri = 0;
        for (double[] row : data) {
            if (row[featureIdx] < splitValue) {
                leftData[li++] = row;
            } else {
                rightData[ri++] = row;
            }
        }

        IsolationNode left = buildNode(leftData, depth + 1, maxDepth, random);
        IsolationNode right = buildNode(rightData, depth + 1, maxDepth, random);

        return IsolationNode.internalNode(featureIdx, splitValue, left, right);
    }

    /**
     * Depth at which {@code point} is isolated, plus the expected remaining depth of the leaf it
     * lands in.
     */
    public double pathLength(double[] point) {
        return root.pathLength(point, 0);
    }

    public IsolationNode getRoot() { return root; }
}
