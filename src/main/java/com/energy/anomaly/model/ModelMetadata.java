package com.energy.anomaly.model;

import com.energy.anomaly.engine.ThresholdMode;
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
@Schema(description = "Metadata of the currently trained model")
public class ModelMetadata {

    @Schema(description = "Model identifier", example = "3f7c1a2e-9b1d-4c55-a0f4-2e6f1f0d9c11")
    private String modelId;

    @Schema(description = "Training time in epoch milliseconds", example = "1760889600000")
    private long trainedAt;

    @Schema(description = "Number of readings the model was trained on", example = "168")
    private int trainingSamples;

    @Schema(description = "Number of features per reading", example = "6")
    private int featureCount;

    @Schema(description = "Feature names in model order")
    private List<String> featureNames;

    @Schema(description = "Number of K-Means clusters", example = "2")
    private int clusterCount;

    @Schema(description = "Number of isolation trees", example = "100")
    private int treeCount;

    @Schema(description = "Isolation Forest contamination used for calibration", example = "0.05")
    private double contamination;

    @Schema(description = "Isolation score above which a reading is flagged", example = "0.58")
    private double isolationThreshold;

    @Schema(description = "K-Means score threshold of the training batch", example = "2.91")
    private double trainingKmeansThreshold;

    @Schema(description = "How the K-Means threshold is chosen when scoring", example = "BATCH")
    private ThresholdMode thresholdMode;
}
