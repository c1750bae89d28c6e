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
@Schema(description = "Precision, recall and F1 for one class (or an average over classes)")
public class ClassMetrics {

    @Schema(description = "TP / (TP + FP), 0 when nothing was predicted for the class", example = "0.8")
    private double precision;

    @Schema(description = "TP / (TP + FN), 0 when the class has no support", example = "1.0")
    private double recall;

    @Schema(description = "Harmonic mean of precision and recall", example = "0.889")
    private double f1Score;

    @Schema(description = "Number of readings whose ground truth is this class", example = "8")
    private int support;
}
