package com.energy.anomaly.engine;

import com.energy.anomaly.model.FeatureVector;
import com.energy.anomaly.model.Reading;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Derives a {@link FeatureVector} per reading.
 *
 * Rolling statistics run over the trailing {@code rollingWindow} readings in input order; the
 * caller is trusted to pass readings sorted by timestamp. Every reading needs a timestamp and a
 * consumption value; a missing one fails the whole batch rather than being imputed. The window
 * narrows at the start of the sequence, so the first reading has a mean but no standard deviation. Undefined values are
 * backward-filled from the next defined value, and positions with no later value take
 * {@code backfillFallback}.
 */
public class FeatureBuilder {

    private final int rollingWindow;
    private final double backfillFallback;

    public FeatureBuilder(int rollingWindow, double backfillFallback) {
        if (rollingWindow < 1) {
            throw new IllegalArgumentException("Rolling window must be at least 1, got " + rollingWindow);
        }
        this.rollingWindow = rollingWindow;
        this.backfillFallback = backfillFallback;
    }

    public List<FeatureVector> build(List<Reading> readings) {
        int n = readings.size();
        if (n == 0) {
            return List.of();
        }

        double[] consumption = new double[n];
        double[] rollingMean = new double[n];
        double[] rollingStd = new double[n];

        DescriptiveStatistics window = new DescriptiveStatistics(rollingWindow);
        for (int i = 0; i < n; i++) {
            Reading reading = readings.get(i);
            if (reading.getTimestamp() == null) {
                throw new IllegalArgumentException("Reading at position " + i + " has no timestamp");
            }
            Double value = reading.getConsumptionKw();
            if (value == null || value.isNaN()) {
                throw new IllegalArgumentException("Reading at position " + i + " has no consumption");
            }
            consumption[i] = value;
            window.addValue(value);
            rollingMean[i] = window.getMean();
            // Sample std is undefined for a single value
            rollingStd[i] = window.getN() > 1 ? window.getStandardDeviation() : Double.NaN;
        }

        backfill(rollingMean);
        backfill(rollingStd);

        List<FeatureVector> features = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            LocalDateTime timestamp = readings.get(i).getTimestamp();
            int dayOfWeek = timestamp.getDayOfWeek().getValue() - 1;
            features.add(new FeatureVector(
                    consumption[i],
                    timestamp.getHour(),
                    dayOfWeek,
                    dayOfWeek >= 5 ? 1 : 0,
                    rollingMean[i],
                    rollingStd[i]));
        }
        return features;
    }

    /**
     * Feature matrix in {@link FeatureVector#FEATURE_NAMES} column order.
     */
    public static double[][] toMatrix(List<FeatureVector> features) {
        double[][] matrix = new double[features.size()][];
        for (int i = 0; i < matrix.length; i++) {
            matrix[i] = features.get(i).toArray();
        }
        return matrix;
    }

    private void backfill(double[] column) {
        double next = Double.NaN;
        for (int i = column.length - 1; i >= 0; i--) {
            if (Double.isNaN(column[i])) {
                column[i] = next;
            } else {
                next = column[i];
            }
        }
        for (int i = column.length - 1; i >= 0 && Double.isNaN(column[i]); i--) {
            column[i] = backfillFallback;
        }
    }
}
