package com.energy.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request to simulate, score and store a labeled consumption series")
public class GenerateRequest {

    @Schema(description = "Number of hourly readings to simulate. Defaults to one week.", example = "168")
    private Integer hours;
}
