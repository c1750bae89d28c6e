package com.energy.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Evaluation of both models and their fusion against ground-truth labels")
public class EvaluationReport {

    @Schema(description = "K-Means verdict: score above the threshold")
    private ClassificationReport kmeans;

    @Schema(description = "Isolation Forest verdict")
    private ClassificationReport isolationForest;

    @Schema(description = "Fused verdict")
    private ClassificationReport combined;

    @Schema(description = "K-Means score threshold used for the K-Means verdict", example = "2.91")
    private double kmeansThreshold;

    @Schema(description = "Number of evaluated readings", example = "168")
    private int evaluatedReadings;
}
