package com.energy.anomaly.controller;

import com.energy.anomaly.model.ModelMetadata;
import com.energy.anomaly.service.AnomalyDetectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/models")
@Tag(name = "Models", description = "Metadata of the trained models")
public class ModelController {

    private final AnomalyDetectionService detectionService;

    public ModelController(AnomalyDetectionService detectionService) {
        this.detectionService = detectionService;
    }

    @Operation(summary = "Get current model metadata",
            description = "Returns training time, sample count, feature schema, cluster and tree counts and both thresholds " +
                    "of the current model. 404 when no model is trained.")
    @GetMapping("/current")
    public ResponseEntity<ModelMetadata> getCurrentModel() {
        ModelMetadata metadata = detectionService.getModelMetadata();
        if (metadata == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(metadata);
    }
}
