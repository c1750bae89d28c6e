package com.energy.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Scored batch of readings")
public class DetectionResult {

    @Schema(description = "Identifier of the model that produced the scores", example = "3f7c1a2e-9b1d-4c55-a0f4-2e6f1f0d9c11")
    private String modelId;

    @Schema(description = "One scored reading per input reading, in input order")
    private List<ScoredReading> readings;

    @Schema(description = "Number of readings with a fused anomaly verdict", example = "11")
    private int anomalyCount;

    @Schema(description = "K-Means score threshold applied by the fusion", example = "2.91")
    private double kmeansThreshold;
}
