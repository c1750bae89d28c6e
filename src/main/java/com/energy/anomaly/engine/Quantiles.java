package com.energy.anomaly.engine;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;

public final class Quantiles {

    private Quantiles() {}

    /**
     * Percentile with linear interpolation between closest ranks (estimation type R-7), the
     * convention of most data-frame libraries: for {@code n} values the rank is {@code p/100 * (n-1)}.
     *
     * @return the percentile, or NaN for an empty array
     */
    public static double percentile(double[] values, double p) {
        if (values.length == 0) {
            return Double.NaN;
        }
        return new Percentile()
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(values, p);
    }
}
