package com.energy.anomaly.contract;

import com.energy.anomaly.config.TestAerospikeConfig;
import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Validates the published OpenAPI document: every endpoint and the schemas clients bind to.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Import(TestAerospikeConfig.class)
@ActiveProfiles("test")
class OpenApiContractTest {

    @Autowired
    private TestRestTemplate restTemplate;

    @Test
    void openApiSpec_isAccessible() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isNotEmpty();
    }

    @Test
    void openApiSpec_containsAllEndpointPaths() {
        DocumentContext json = apiDocs();
        Map<String, Object> paths = json.read("$.paths");

        // Consumption dataset endpoints
        assertThat(paths).containsKey("/api/v1/consumption/generate");
        assertThat(paths).containsKey("/api/v1/consumption/data");
        assertThat(paths).containsKey("/api/v1/consumption/stats");
        assertThat(paths).containsKey("/api/v1/consumption/evaluate");
        assertThat(paths).containsKey("/api/v1/consumption/rescore");

        // Detection endpoints
        assertThat(paths).containsKey("/api/v1/detection/train");
        assertThat(paths).containsKey("/api/v1/detection/score");
        assertThat(paths).containsKey("/api/v1/detection/evaluate");

        // Model endpoints
        assertThat(paths).containsKey("/api/v1/models/current");
    }

    @Test
    void openApiSpec_containsCriticalSchemas() {
        Map<String, Object> schemas = apiDocs().read("$.components.schemas");

        assertThat(schemas).containsKey("Reading");
        assertThat(schemas).containsKey("ScoredReading");
        assertThat(schemas).containsKey("DetectionResult");
        assertThat(schemas).containsKey("EvaluationReport");
        assertThat(schemas).containsKey("ModelMetadata");
        assertThat(schemas).containsKey("DatasetStats");
    }

    @Test
    void openApiSpec_readingSchemas_useWireFieldNames() {
        DocumentContext json = apiDocs();

        Map<String, Object> readingProps = json.read("$.components.schemas.Reading.properties");
        assertThat(readingProps).containsKey("timestamp");
        assertThat(readingProps).containsKey("consumption_kw");
        assertThat(readingProps).containsKey("is_anomaly");

        Map<String, Object> scoredProps = json.read("$.components.schemas.ScoredReading.properties");
        assertThat(scoredProps).containsKey("kmeans_anomaly_score");
        assertThat(scoredProps).containsKey("isolation_forest_anomaly");
        assertThat(scoredProps).containsKey("final_anomaly");
    }

    @Test
    void actuatorHealth_isExposed() {
        ResponseEntity<String> response = restTemplate.getForEntity("/actuator/health", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    }

    private DocumentContext apiDocs() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        return JsonPath.parse(response.getBody());
    }
}
