package com.energy.anomaly.controller;

import com.energy.anomaly.engine.MissingLabelException;
import com.energy.anomaly.engine.NotTrainedException;
import com.energy.anomaly.engine.SchemaMismatchException;
import com.energy.anomaly.model.DetectionResult;
import com.energy.anomaly.model.EvaluationReport;
import com.energy.anomaly.model.Reading;
import com.energy.anomaly.service.AnomalyDetectionService;
import com.energy.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(DetectionController.class)
class DetectionControllerTest {

    private static final String TWO_READINGS = "["
            + "{\"timestamp\": \"2026-10-05T00:00:00\", \"consumption_kw\": 0.8},"
            + "{\"timestamp\": \"2026-10-05T01:00:00\", \"consumption_kw\": 12.5, \"is_anomaly\": true}"
            + "]";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AnomalyDetectionService detectionService;

    @Test
    @SuppressWarnings("unchecked")
    void train_parsesReadingsAndReturnsScoredBatch() throws Exception {
        when(detectionService.trainAndScore(anyList())).thenReturn(DetectionResult.builder()
                .modelId("m-1")
                .readings(List.of(TestDataFactory.scoredReading(0, 0.2, false, false, null)))
                .anomalyCount(0).kmeansThreshold(1.7).build());

        mockMvc.perform(post("/api/v1/detection/train")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(TWO_READINGS))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.modelId").value("m-1"))
                .andExpect(jsonPath("$.kmeansThreshold").value(1.7))
                .andExpect(jsonPath("$.readings[0].kmeans_anomaly_score").value(0.2));

        ArgumentCaptor<List<Reading>> captor = ArgumentCaptor.forClass(List.class);
        verify(detectionService).trainAndScore(captor.capture());
        List<Reading> parsed = captor.getValue();
        assertThat(parsed).hasSize(2);
        assertThat(parsed.get(0).getTimestamp()).isEqualTo(LocalDateTime.of(2026, 10, 5, 0, 0));
        assertThat(parsed.get(0).getGroundTruth()).isNull();
        assertThat(parsed.get(1).getConsumptionKw()).isEqualTo(12.5);
        assertThat(parsed.get(1).getGroundTruth()).isTrue();
    }

    @Test
    void train_tooFewReadings_badRequest() throws Exception {
        when(detectionService.trainAndScore(anyList()))
                .thenThrow(new IllegalArgumentException("Training needs at least 2 readings, got 1"));

        mockMvc.perform(post("/api/v1/detection/train")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[{\"timestamp\": \"2026-10-05T00:00:00\", \"consumption_kw\": 0.8}]"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Training needs at least 2 readings, got 1"));
    }

    @Test
    void score_untrained_conflict() throws Exception {
        when(detectionService.score(anyList())).thenThrow(new NotTrainedException());

        mockMvc.perform(post("/api/v1/detection/score")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(TWO_READINGS))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void score_schemaMismatch_badRequest() throws Exception {
        when(detectionService.score(anyList())).thenThrow(new SchemaMismatchException(6, 4));

        mockMvc.perform(post("/api/v1/detection/score")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(TWO_READINGS))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Expected 6 features but got 4"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void score_readingWithoutConsumption_badRequest() throws Exception {
        when(detectionService.score(anyList()))
                .thenThrow(new IllegalArgumentException("Reading at position 0 has no consumption"));

        mockMvc.perform(post("/api/v1/detection/score")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[{\"timestamp\": \"2026-10-05T18:00:00\"}]"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Reading at position 0 has no consumption"));

        // The absent field reaches the service as null, not as 0.0
        ArgumentCaptor<List<Reading>> captor = ArgumentCaptor.forClass(List.class);
        verify(detectionService).score(captor.capture());
        assertThat(captor.getValue().get(0).getConsumptionKw()).isNull();
    }

    @Test
    void evaluate_success() throws Exception {
        when(detectionService.evaluate(anyList())).thenReturn(EvaluationReport.builder()
                .kmeansThreshold(1.2).evaluatedReadings(2).build());

        mockMvc.perform(post("/api/v1/detection/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[{\"timestamp\": \"2026-10-05T00:00:00\", \"consumption_kw\": 0.8, "
                                + "\"is_anomaly\": false, \"kmeans_anomaly_score\": 0.3, "
                                + "\"isolation_forest_anomaly\": false, \"final_anomaly\": false}]"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.evaluatedReadings").value(2));
    }

    @Test
    void evaluate_missingLabel_badRequest() throws Exception {
        when(detectionService.evaluate(anyList())).thenThrow(new MissingLabelException(0));

        mockMvc.perform(post("/api/v1/detection/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[]"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value(
                        "Ground-truth label 'is_anomaly' is missing for reading at position 0"));
    }
}
