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
@Schema(description = "A single hourly electrical consumption measurement")
public class Reading {

    @Schema(description = "Measurement time (local wall-clock)", example = "2026-10-12T18:00:00")
    @JsonProperty("timestamp")
    LocalDateTime timestamp;

    @Schema(description = "Consumption in kilowatts. Required.", example = "3.74")
    @JsonProperty("consumption_kw")
    Double consumptionKw;

    @Schema(description = "Ground-truth anomaly label. Present for simulated data, absent for live readings.",
            example = "false", nullable = true)
    @JsonProperty("is_anomaly")
    Boolean groundTruth;

    public boolean hasGroundTruth() {
        return groundTruth != null;
    }

    public static Reading of(LocalDateTime timestamp, double consumptionKw) {
        return new Reading(timestamp, consumptionKw, null);
    }
}
