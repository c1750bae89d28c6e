package com.energy.anomaly.controller;

import com.energy.anomaly.engine.DetectionException;
import com.energy.anomaly.model.DatasetStats;
import com.energy.anomaly.model.DetectionResult;
import com.energy.anomaly.model.EvaluationReport;
import com.energy.anomaly.model.GenerateRequest;
import com.energy.anomaly.model.GenerateResponse;
import com.energy.anomaly.model.ScoredReading;
import com.energy.anomaly.service.ConsumptionDataService;
import com.energy.anomaly.service.NoDataException;
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
@RequestMapping("/api/v1/consumption")
@Tag(name = "Consumption", description = "Simulated consumption dataset: generation, stored results, statistics and evaluation")
public class ConsumptionController {

    private final ConsumptionDataService dataService;

    public ConsumptionController(ConsumptionDataService dataService) {
        this.dataService = dataService;
    }

    @Operation(summary = "Generate, train and store a labeled dataset",
            description = "Simulates hourly readings with a daily load profile and injected spikes, drops and zero readings, " +
                    "trains both models on them and replaces the stored dataset with the scored result.")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = GenerateResponse.class)))
    @PostMapping("/generate")
    public ResponseEntity<?> generate(@RequestBody(required = false) GenerateRequest request) {
        Integer hours = request != null ? request.getHours() : null;
        try {
            return ResponseEntity.ok(dataService.generate(hours));
        } catch (IllegalArgumentException e) {
            return ErrorResponses.of(HttpStatus.BAD_REQUEST, e);
        }
    }

    @Operation(summary = "Get the stored scored dataset",
            description = "Returns every stored reading with its K-Means score and the Isolation Forest and fused verdicts.")
    @GetMapping("/data")
    public ResponseEntity<List<ScoredReading>> getData() {
        return ResponseEntity.ok(dataService.getData());
    }

    @Operation(summary = "Get dataset statistics",
            description = "Record count, anomaly count and share, and mean/max/min consumption of the stored dataset.")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = DatasetStats.class)))
    @GetMapping("/stats")
    public ResponseEntity<?> getStats() {
        try {
            DatasetStats stats = dataService.getStats();
            return ResponseEntity.ok(stats);
        } catch (NoDataException e) {
            return ErrorResponses.of(HttpStatus.NOT_FOUND, e);
        }
    }

    @Operation(summary = "Evaluate both models on the stored dataset",
            description = "Precision, recall, F1 and support per class for the K-Means, Isolation Forest and combined verdicts " +
                    "against the simulated ground-truth labels.")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = EvaluationReport.class)))
    @GetMapping("/evaluate")
    public ResponseEntity<?> evaluate() {
        try {
            return ResponseEntity.ok(dataService.evaluateStored());
        } catch (NoDataException e) {
            return ErrorResponses.of(HttpStatus.NOT_FOUND, e);
        } catch (DetectionException e) {
            return ErrorResponses.of(e);
        }
    }

    @Operation(summary = "Rescore the stored dataset",
            description = "Scores the stored readings against the current model and stores the new verdicts.")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = DetectionResult.class)))
    @PostMapping("/rescore")
    public ResponseEntity<?> rescore() {
        try {
            return ResponseEntity.ok(dataService.rescoreStored());
        } catch (NoDataException e) {
            return ErrorResponses.of(HttpStatus.NOT_FOUND, e);
        } catch (DetectionException e) {
            return ErrorResponses.of(e);
        }
    }
}
