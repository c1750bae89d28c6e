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
@Schema(description = "Outcome of a simulate-train-store run")
public class GenerateResponse {

    @Schema(description = "Outcome status", example = "success")
    private String status;

    @Schema(description = "Human-readable summary", example = "Generated 168 readings")
    private String message;

    @Schema(description = "Number of stored readings", example = "168")
    private int recordsGenerated;

    @Schema(description = "Readings with a fused anomaly verdict", example = "11")
    private int anomaliesDetected;
}
