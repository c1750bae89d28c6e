package com.energy.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDateTime;

@Value
@Builder
@Jacksonized
@Schema(description = "A reading together with the verdicts of both models and the fused verdict")
public class ScoredReading {

    @Schema(description = "Measurement time (local wall-clock)", example = "2026-10-12T18:00:00")
    @JsonProperty("timestamp")
    LocalDateTime timestamp;

    @Schema(description = "Consumption in kilowatts", example = "17.2")
    @JsonProperty("consumption_kw")
    double consumptionKw;

    @Schema(description = "Ground-truth anomaly label, when known", example = "true", nullable = true)
    @JsonProperty("is_anomaly")
    Boolean groundTruth;

    @Schema(description = "Euclidean distance to the nearest K-Means centroid in standardized feature space", example = "4.81")
    @JsonProperty("kmeans_anomaly_score")
    double kmeansAnomalyScore;

    @Schema(description = "Isolation Forest verdict", example = "true")
    @JsonProperty("isolation_forest_anomaly")
    boolean isolationAnomaly;

    @Schema(description = "Fused verdict: K-Means score above threshold OR Isolation Forest anomaly", example = "true")
    @JsonProperty("final_anomaly")
    boolean finalAnomaly;

    public boolean hasGroundTruth() {
        return groundTruth != null;
    }

    public Reading toReading() {
        return Reading.builder()
                .timestamp(timestamp)
                .consumptionKw(consumptionKw)
                .groundTruth(groundTruth)
                .build();
    }
}
