package com.energy.anomaly.engine;

/**
 * How the K-Means score threshold is chosen when a batch is scored.
 */
public enum ThresholdMode {
    /** Percentile of the batch being scored. Adapts to the batch, but verdicts are not comparable across calls. */
    BATCH,
    /** Percentile fitted on the training batch and kept in the model. */
    TRAINING
}
