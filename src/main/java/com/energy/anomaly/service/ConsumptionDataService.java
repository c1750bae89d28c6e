package com.energy.anomaly.service;

import com.energy.anomaly.config.DetectionConfig;
import com.energy.anomaly.config.MetricsConfig;
import com.energy.anomaly.model.DatasetStats;
import com.energy.anomaly.model.DetectionResult;
import com.energy.anomaly.model.EvaluationReport;
import com.energy.anomaly.model.GenerateResponse;
import com.energy.anomaly.model.Reading;
import com.energy.anomaly.model.ScoredReading;
import com.energy.anomaly.repository.ConsumptionDataRepository;
import com.energy.anomaly.simulator.ConsumptionSimulator;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.apache.commons.math3.util.Precision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Simulate-train-store workflow and queries over the stored scored dataset.
 */
@Service
public class ConsumptionDataService {

    private static final Logger log = LoggerFactory.getLogger(ConsumptionDataService.class);

    private final ConsumptionSimulator simulator;
    private final AnomalyDetectionService detectionService;
    private final ConsumptionDataRepository repository;
    private final DetectionConfig config;
    private final MetricsConfig metricsConfig;

    public ConsumptionDataService(ConsumptionSimulator simulator,
                                  AnomalyDetectionService detectionService,
                                  ConsumptionDataRepository repository,
                                  DetectionConfig config,
                                  MetricsConfig metricsConfig) {
        this.simulator = simulator;
        this.detectionService = detectionService;
        this.repository = repository;
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Simulate {@code hours} labeled readings (the configured default when null), train both
     * detectors on them and replace the stored dataset with the scored result.
     */
    public GenerateResponse generate(Integer hours) {
        int effectiveHours = hours != null ? hours : config.getSimulator().getDefaultHours();

        List<Reading> readings = simulator.generate(effectiveHours);
        metricsConfig.recordGeneration(readings.size());

        DetectionResult result = detectionService.trainAndScore(readings);
        repository.replaceAll(result.getReadings());

        long labeled = readings.stream().filter(r -> Boolean.TRUE.equals(r.getGroundTruth())).count();
        log.info("Generated dataset: {} readings, {} injected anomalies, {} detected",
                readings.size(), labeled, result.getAnomalyCount());

        return GenerateResponse.builder()
                .status("success")
                .message("Generated " + readings.size() + " readings")
                .recordsGenerated(readings.size())
                .anomaliesDetected(result.getAnomalyCount())
                .build();
    }

    public List<ScoredReading> getData() {
        return repository.findAll();
    }

    public DatasetStats getStats() {
        List<ScoredReading> readings = requireData();

        SummaryStatistics consumption = new SummaryStatistics();
        int anomalies = 0;
        for (ScoredReading reading : readings) {
            consumption.addValue(reading.getConsumptionKw());
            if (reading.isFinalAnomaly()) anomalies++;
        }

        return DatasetStats.builder()
                .totalRecords(readings.size())
                .totalAnomalies(anomalies)
                .anomalyPercentage(Precision.round(100.0 * anomalies / readings.size(), 2))
                .avgConsumption(Precision.round(consumption.getMean(), 2))
                .maxConsumption(Precision.round(consumption.getMax(), 2))
                .minConsumption(Precision.round(consumption.getMin(), 2))
                .build();
    }

    public EvaluationReport evaluateStored() {
        return detectionService.evaluate(requireData());
    }

    /**
     * Score the stored readings against the current model and store the new verdicts.
     */
    public DetectionResult rescoreStored() {
        List<Reading> readings = requireData().stream()
                .map(ScoredReading::toReading)
                .collect(Collectors.toList());

        DetectionResult result = detectionService.score(readings);
        repository.replaceAll(result.getReadings());
        return result;
    }

    private List<ScoredReading> requireData() {
        List<ScoredReading> readings = repository.findAll();
        if (readings.isEmpty()) {
            throw new NoDataException();
        }
        return readings;
    }
}
