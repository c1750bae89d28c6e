package com.energy.anomaly.seeder;

import com.energy.anomaly.config.DetectionConfig;
import com.energy.anomaly.model.ClassificationReport;
import com.energy.anomaly.model.DatasetStats;
import com.energy.anomaly.model.EvaluationReport;
import com.energy.anomaly.model.GenerateResponse;
import com.energy.anomaly.service.ConsumptionDataService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Runs the full pipeline once at startup: simulate, train, store, evaluate.
 * Only runs when the "seed" Spring profile is active.
 *
 * Run with:  mvn spring-boot:run -Dspring-boot.run.profiles=seed
 *
 * Generates 30 days of hourly readings by default (detection.seeder.hours).
 */
@Component
@Profile("seed")
@Order(1)
public class DatasetSeeder implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DatasetSeeder.class);

    private final ConsumptionDataService dataService;
    private final DetectionConfig config;

    public DatasetSeeder(ConsumptionDataService dataService, DetectionConfig config) {
        this.dataService = dataService;
        this.config = config;
    }

    @Override
    public void run(String... args) {
        log.info("=== Starting dataset seeding ===");

        int hours = config.getSeeder().getHours();
        log.info("1. Generating {} hours of consumption data and training both models...", hours);
        GenerateResponse generated = dataService.generate(hours);

        log.info("2. Evaluating models against the simulated labels...");
        EvaluationReport evaluation = dataService.evaluateStored();

        DatasetStats stats = dataService.getStats();
        ClassificationReport combined = evaluation.getCombined();
        log.info("=== Seeding summary ===");
        log.info("Readings generated: {}", generated.getRecordsGenerated());
        log.info("Anomalies detected: {} ({}%)", stats.getTotalAnomalies(), stats.getAnomalyPercentage());
        log.info("Combined accuracy: {}", String.format("%.2f%%", combined.getAccuracy() * 100));
        log.info("Combined anomaly recall: {}", String.format("%.2f%%", combined.getAnomaly().getRecall() * 100));

        log.info("=== Dataset seeding complete ===");
    }
}
