package com.energy.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI consumptionAnomalyOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Consumption Anomaly Detection API")
                        .version("1.0.0")
                        .description(
                                "Unsupervised anomaly detection for hourly electrical consumption readings.\n\n" +
                                "**Scoring Pipeline:**\n" +
                                "1. Derive 6 features per reading (consumption, hour, day of week, weekend flag, 6-reading rolling mean/std)\n" +
                                "2. Standardize features with statistics fitted at training time\n" +
                                "3. Score with K-Means (distance to the nearest of 2 centroids) and an Isolation Forest (contamination 5%)\n" +
                                "4. Fuse: **anomaly** if the K-Means score exceeds the 95th percentile threshold OR the Isolation Forest flags it\n\n" +
                                "**Workflow:**\n" +
                                "- `POST /consumption/generate` simulates a labeled series, trains both models and stores the scored dataset\n" +
                                "- `POST /detection/score` scores new readings against the current model\n" +
                                "- `GET /consumption/evaluate` reports precision/recall/F1 per model against the simulated labels")
                        .contact(new Contact().name("Energy Analytics Team")));
    }
}
