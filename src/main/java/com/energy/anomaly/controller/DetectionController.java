package com.energy.anomaly.controller;

import com.energy.anomaly.engine.DetectionException;
import com.energy.anomaly.model.DetectionResult;
import com.energy.anomaly.model.EvaluationReport;
import com.energy.anomaly.model.Reading;
import com.energy.anomaly.model.ScoredReading;
import com.energy.anomaly.service.AnomalyDetectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/detection")
@Tag(name = "Detection", description = "Train the models on readings, score readings and evaluate scored readings")
public class DetectionController {

    private final AnomalyDetectionService detectionService;

    public DetectionController(AnomalyDetectionService detectionService) {
        this.detectionService = detectionService;
    }

    @Operation(summary = "Train on readings and score them",
            description = "Fits the scaler, K-Means and Isolation Forest on the given readings (sorted by timestamp), " +
                    "replaces the current model and returns the readings scored by the new model.")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = DetectionResult.class)))
    @PostMapping("/train")
    public ResponseEntity<?> train(@RequestBody List<Reading> readings) {
        try {
            return ResponseEntity.ok(detectionService.trainAndScore(readings));
        } catch (IllegalArgumentException e) {
            return ErrorResponses.of(HttpStatus.BAD_REQUEST, e);
        }
    }

    @Operation(summary = "Score readings against the current model",
            description = "Returns one scored reading per input reading. Fails with 409 when no model is trained.")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = DetectionResult.class)))
    @PostMapping("/score")
    public ResponseEntity<?> score(@RequestBody List<Reading> readings) {
        try {
            return ResponseEntity.ok(detectionService.score(readings));
        } catch (DetectionException e) {
            return ErrorResponses.of(e);
        } catch (IllegalArgumentException e) {
            return ErrorResponses.of(HttpStatus.BAD_REQUEST, e);
        }
    }

    @Operation(summary = "Evaluate scored readings",
            description = "Compares the verdicts of scored readings with their 'is_anomaly' labels. " +
                    "Fails with 400 when a label is missing and 409 when no model is trained.")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = EvaluationReport.class)))
    @PostMapping("/evaluate")
    public ResponseEntity<?> evaluate(@RequestBody List<ScoredReading> readings) {
        try {
            return ResponseEntity.ok(detectionService.evaluate(readings));
        } catch (DetectionException e) {
            return ErrorResponses.of(e);
        }
    }
}
