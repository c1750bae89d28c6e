package com.energy.anomaly.engine.isolationforest;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonAutoDetect(getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class IsolationNode {

    private static final double EULER_MASCHERONI = 0.5772156649;

    @JsonProperty("f")
    private int splitFeature;

    @JsonProperty("v")
    private double splitValue;

    @JsonProperty("l")
    private IsolationNode left;

    @JsonProperty("r")
    private IsolationNode right;

    @JsonProperty("s")
    private int size; // rows of the sub-sample that reached this leaf

    @JsonProperty("e")
    private boolean external; // leaf node

    // Jackson
    private IsolationNode() {}

    public static IsolationNode internalNode(int splitFeature, double splitValue,
                                             IsolationNode left, IsolationNode right) {
        IsolationNode node = new IsolationNode();
        node.splitFeature = splitFeature;
        node.splitValue = splitValue;
        node.left = left;
        node.right = right;
        node.external = false;
        return node;
    }

    public static IsolationNode externalNode(int size) {
        IsolationNode node = new IsolationNode();
        node.size = size;
        node.external = true;
        return node;
    }

    public double pathLength(double[] point, int currentDepth) {
        if (external) {
            // Unbuilt subtree below a depth-capped leaf is credited with its expected height
            return currentDepth + averagePathLength(size);
        }
        return point[splitFeature] < splitValue
                ? left.pathLength(point, currentDepth + 1)
                : right.pathLength(point, currentDepth + 1);
    }

    /**
     * Average path length of an unsuccessful search in a binary search tree of {@code n} nodes.
     * c(n) = 2H(n-1) - 2(n-1)/n, with H(i) approximated by ln(i) + Euler's constant.
     */
    public static double averagePathLength(int n) {
        if (n <= 1) return 0;
        if (n == 2) return 1;
        double harmonicNumber = Math.log(n - 1.0) + EULER_MASCHERONI;
        return 2.0 * harmonicNumber - (2.0 * (n - 1.0) / n);
    }

    // Read-only accessors; serialization goes through the annotated fields
    public int getSplitFeature() { return splitFeature; }
    public double getSplitValue() { return splitValue; }
    public IsolationNode getLeft() { return left; }
    public IsolationNode getRight() { return right; }
    public int getSize() { return size; }
    public boolean isExternal() { return external; }
}
