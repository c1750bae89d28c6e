package com.energy.anomaly.engine;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.math3.stat.StatUtils;

import java.util.Arrays;

/**
 * Column-wise standardization to zero mean and unit variance. Statistics are fitted once on the
 * training matrix and reused unchanged at prediction time.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class StandardScaler {

    private final double[] means;
    private final double[] scales;

    @JsonCreator
    public StandardScaler(@JsonProperty("means") double[] means,
                          @JsonProperty("scales") double[] scales) {
        if (means.length != scales.length) {
            throw new IllegalArgumentException("means and scales differ in length");
        }
        this.means = means.clone();
        this.scales = scales.clone();
    }

    public static StandardScaler fit(double[][] data) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot fit a scaler on an empty matrix");
        }
        int columns = data[0].length;
        double[] means = new double[columns];
        double[] scales = new double[columns];

        double[] column = new double[data.length];
        for (int j = 0; j < columns; j++) {
            for (int i = 0; i < data.length; i++) {
                column[i] = data[i][j];
            }
            means[j] = StatUtils.mean(column);
            double std = Math.sqrt(StatUtils.populationVariance(column));
            // Constant columns are centered but not scaled
            scales[j] = std > 0 ? std : 1.0;
        }
        return new StandardScaler(means, scales);
    }

    public double[][] transform(double[][] data) {
        double[][] scaled = new double[data.length][];
        for (int i = 0; i < data.length; i++) {
            if (data[i].length != means.length) {
                throw new SchemaMismatchException(means.length, data[i].length);
            }
            double[] row = new double[means.length];
            for (int j = 0; j < means.length; j++) {
                row[j] = (data[i][j] - means[j]) / scales[j];
            }
            scaled[i] = row;
        }
        return scaled;
    }

    public int featureCount() {
        return means.length;
    }

    public double[] getMeans() { return means.clone(); }
    public double[] getScales() { return scales.clone(); }

    @Override
    public String toString() {
        return "StandardScaler{means=" + Arrays.toString(means) + ", scales=" + Arrays.toString(scales) + "}";
    }
}
