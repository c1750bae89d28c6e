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
@Schema(description = "Summary of the stored scored dataset")
public class DatasetStats {

    @Schema(description = "Number of stored readings", example = "168")
    private int totalRecords;

    @Schema(description = "Readings with a fused anomaly verdict", example = "11")
    private int totalAnomalies;

    @Schema(description = "Anomalies as a percentage of all readings, 2 decimals", example = "6.55")
    private double anomalyPercentage;

    @Schema(description = "Mean consumption in kW, 2 decimals", example = "2.41")
    private double avgConsumption;

    @Schema(description = "Maximum consumption in kW, 2 decimals", example = "17.93")
    private double maxConsumption;

    @Schema(description = "Minimum consumption in kW, 2 decimals", example = "0.0")
    private double minConsumption;
}
