package com.energy.anomaly.engine.kmeans;

import org.apache.commons.math3.ml.clustering.Cluster;
import org.apache.commons.math3.ml.clustering.Clusterable;
import org.apache.commons.math3.ml.clustering.evaluation.ClusterEvaluator;

import java.util.List;

/**
 * Within-cluster sum of squared distances to each cluster's centroid. Lower is better, which
 * matches the default ordering of {@link ClusterEvaluator#isBetterScore(double, double)}.
 */
public class InertiaEvaluator<T extends Clusterable> extends ClusterEvaluator<T> {

    @Override
    public double score(List<? extends Cluster<T>> clusters) {
        double inertia = 0.0;
        for (Cluster<T> cluster : clusters) {
            Clusterable center = centroidOf(cluster);
            for (T point : cluster.getPoints()) {
                double d = distance(point, center);
                inertia += d * d;
            }
        }
        return inertia;
    }
}
