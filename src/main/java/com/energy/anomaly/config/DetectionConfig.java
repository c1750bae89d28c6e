package com.energy.anomaly.config;

import com.energy.anomaly.engine.ThresholdMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "detection")
public class DetectionConfig {

    private FeatureSettings features = new FeatureSettings();

    private KMeansSettings kmeans = new KMeansSettings();

    private IsolationForestSettings isolationForest = new IsolationForestSettings();

    private FusionSettings fusion = new FusionSettings();

    private SimulatorSettings simulator = new SimulatorSettings();

    // Startup pipeline, only used under the "seed" profile
    private SeederSettings seeder = new SeederSettings();

    @Data
    public static class FeatureSettings {
        // Trailing window over input order, not wall-clock time
        private int rollingWindow = 6;
        // Used where backward-fill finds no later value (tail of the sequence)
        private double backfillFallback = 0.0;
    }

    @Data
    public static class KMeansSettings {
        private int initializations = 10;
        private int maxIterations = 300;
        private long seed = 42;
    }

    @Data
    public static class IsolationForestSettings {
        private int numTrees = 100;
        private int sampleSize = 256;
        // Expected share of anomalies in the training batch
        private double contamination = 0.05;
        private long seed = 42;
    }

    @Data
    public static class FusionSettings {
        private double thresholdPercentile = 95.0;
        private ThresholdMode thresholdMode = ThresholdMode.BATCH;
    }

    @Data
    public static class SimulatorSettings {
        private double baseConsumptionKw = 2.5;
        private double noiseStdDev = 0.2;
        private double anomalyFraction = 0.05;
        private int defaultHours = 168;
        private int maxHours = 8760;
        // Unset = a fresh unseeded generator per call
        private Long seed;
    }

    @Data
    public static class SeederSettings {
        private int hours = 720;
    }
}
