package com.energy.anomaly.engine;

import com.energy.anomaly.engine.isolationforest.IsolationForest;
import com.energy.anomaly.engine.kmeans.CentroidDistanceScorer;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Everything fitted by one training run. Snapshots are never modified: retraining produces a new
 * one, so any number of threads can score against the same snapshot.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ModelSnapshot {

    String modelId;
    long trainedAt;
    int trainingSamples;
    List<String> featureNames;
    StandardScaler scaler;
    CentroidDistanceScorer kmeans;
    IsolationForest isolationForest;
    // K-Means threshold of the training batch, used by ThresholdMode.TRAINING
    double trainingKmeansThreshold;
}
