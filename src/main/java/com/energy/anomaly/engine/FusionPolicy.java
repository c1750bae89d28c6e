package com.energy.anomaly.engine;

/**
 * Combines the two detectors: a reading is anomalous when its K-Means score is strictly above
 * the threshold OR the Isolation Forest flags it.
 */
public final class FusionPolicy {

    private FusionPolicy() {}

    public static double threshold(double[] kmeansScores, double percentile) {
        return Quantiles.percentile(kmeansScores, percentile);
    }

    public static boolean[] fuse(double[] kmeansScores, boolean[] isolationAnomalies, double threshold) {
        if (kmeansScores.length != isolationAnomalies.length) {
            throw new IllegalArgumentException("Score arrays differ in length: "
                    + kmeansScores.length + " vs " + isolationAnomalies.length);
        }
        boolean[] fused = new boolean[kmeansScores.length];
        for (int i = 0; i < fused.length; i++) {
            fused[i] = kmeansScores[i] > threshold || isolationAnomalies[i];
        }
        return fused;
    }
}
