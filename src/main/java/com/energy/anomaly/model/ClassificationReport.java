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
@Schema(description = "Per-class metrics of one detector's verdicts against the ground-truth labels")
public class ClassificationReport {

    @Schema(description = "Metrics for readings labeled normal")
    private ClassMetrics normal;

    @Schema(description = "Metrics for readings labeled anomalous")
    private ClassMetrics anomaly;

    @Schema(description = "Share of readings whose verdict matches the label", example = "0.97")
    private double accuracy;

    @Schema(description = "Unweighted mean of the two classes")
    private ClassMetrics macroAvg;

    @Schema(description = "Support-weighted mean of the two classes")
    private ClassMetrics weightedAvg;
}
