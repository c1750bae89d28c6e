package com.energy.anomaly.engine;

import com.energy.anomaly.model.DetectionResult;
import lombok.Value;

@Value
public class TrainingOutcome {
    ModelSnapshot snapshot;
    DetectionResult result;
}
