package com.energy.anomaly.engine.kmeans;

import com.energy.anomaly.engine.SchemaMismatchException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.math3.ml.clustering.CentroidCluster;
import org.apache.commons.math3.ml.clustering.DoublePoint;
import org.apache.commons.math3.ml.clustering.KMeansPlusPlusClusterer;
import org.apache.commons.math3.ml.clustering.MultiKMeansPlusPlusClusterer;
import org.apache.commons.math3.ml.distance.EuclideanDistance;
import org.apache.commons.math3.random.Well19937c;
import org.apache.commons.math3.util.MathArrays;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores each point by its Euclidean distance to the nearest of two K-Means centroids.
 *
 * Taking the minimum distance keeps the score independent of which cluster is the larger one,
 * so it works whether anomalies form their own small cluster or sit on the edge of the normal one.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CentroidDistanceScorer {

    public static final int CLUSTER_COUNT = 2;

    private final double[][] centroids;

    @JsonCreator
    public CentroidDistanceScorer(@JsonProperty("centroids") double[][] centroids) {
        this.centroids = new double[centroids.length][];
        for (int i = 0; i < centroids.length; i++) {
            this.centroids[i] = centroids[i].clone();
        }
    }

    /**
     * Fit K-Means++ with several restarts and keep the run with the lowest inertia.
     *
     * @param data            standardized training matrix
     * @param initializations number of independent K-Means++ runs
     * @param maxIterations   Lloyd iteration cap per run
     * @param seed            random seed for reproducibility
     */
    public static CentroidDistanceScorer fit(double[][] data, int initializations, int maxIterations, long seed) {
        if (data.length < CLUSTER_COUNT) {
            throw new IllegalArgumentException("K-Means needs at least " + CLUSTER_COUNT
                    + " points, got " + data.length);
        }

        List<DoublePoint> points = new ArrayList<>(data.length);
        for (double[] row : data) {
            points.add(new DoublePoint(row));
        }

        KMeansPlusPlusClusterer<DoublePoint> clusterer = new KMeansPlusPlusClusterer<>(
                CLUSTER_COUNT, maxIterations, new EuclideanDistance(), new Well19937c(seed));
        MultiKMeansPlusPlusClusterer<DoublePoint> multiClusterer = new MultiKMeansPlusPlusClusterer<>(
                clusterer, initializations, new InertiaEvaluator<>());

        List<CentroidCluster<DoublePoint>> clusters = multiClusterer.cluster(points);

        double[][] centroids = new double[clusters.size()][];
        for (int i = 0; i < clusters.size(); i++) {
            centroids[i] = clusters.get(i).getCenter().getPoint();
        }
        return new CentroidDistanceScorer(centroids);
    }

    public double[] score(double[][] data) {
        double[] scores = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            scores[i] = score(data[i]);
        }
        return scores;
    }

    public double score(double[] point) {
        int dimension = centroids[0].length;
        if (point.length != dimension) {
            throw new SchemaMismatchException(dimension, point.length);
        }
        double nearest = Double.MAX_VALUE;
        for (double[] centroid : centroids) {
            nearest = Math.min(nearest, MathArrays.distance(point, centroid));
        }
        return nearest;
    }

    public double[][] getCentroids() {
        double[][] copy = new double[centroids.length][];
        for (int i = 0; i < centroids.length; i++) {
            copy[i] = centroids[i].clone();
        }
        return copy;
    }
}
