package com.energy.anomaly.model;

import lombok.Value;

import java.util.List;

/**
 * Fixed-order feature vector derived from one reading.
 *
 * Features:
 *   [0] Consumption (kW)
 *   [1] Hour of day (0-23)
 *   [2] Day of week (0 = Monday .. 6 = Sunday)
 *   [3] Weekend flag (1 on Saturday/Sunday)
 *   [4] Rolling mean over the trailing 6 readings
 *   [5] Rolling sample standard deviation over the trailing 6 readings
 *
 * The order is part of the trained model: scaler columns and centroid axes follow it.
 */
@Value
public class FeatureVector {

    public static final List<String> FEATURE_NAMES = List.of(
            "consumption_kw",
            "hour",
            "day_of_week",
            "is_weekend",
            "consumption_rolling_mean_6h",
            "consumption_rolling_std_6h"
    );

    public static final int FEATURE_COUNT = FEATURE_NAMES.size();

    double consumptionKw;
    int hourOfDay;
    int dayOfWeek;
    int weekend;
    double rollingMean;
    double rollingStd;

    public double[] toArray() {
        return new double[]{consumptionKw, hourOfDay, dayOfWeek, weekend, rollingMean, rollingStd};
    }
}
