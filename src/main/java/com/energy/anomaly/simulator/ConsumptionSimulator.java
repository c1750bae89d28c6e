package com.energy.anomaly.simulator;

import com.energy.anomaly.config.DetectionConfig;
import com.energy.anomaly.model.Reading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Generates labeled hourly consumption series for training and evaluating the detectors.
 *
 * Normal load follows a fixed daily profile on top of a base consumption:
 *   00-06h: 0.3x (night)
 *   06-12h: 0.8x (morning)
 *   12-18h: 1.2x (afternoon)
 *   18-24h: 1.5x (evening)
 * plus Gaussian noise, clamped at zero. A fixed share of readings is then turned into a spike,
 * a drop or a zero reading and labeled anomalous.
 */
@Component
public class ConsumptionSimulator {

    private static final Logger log = LoggerFactory.getLogger(ConsumptionSimulator.class);

    enum AnomalyKind { SPIKE, DROP, ZERO }

    private final DetectionConfig.SimulatorSettings settings;
    private final Clock clock;

    @Autowired
    public ConsumptionSimulator(DetectionConfig config) {
        this(config, Clock.systemDefaultZone());
    }

    public ConsumptionSimulator(DetectionConfig config, Clock clock) {
        this.settings = config.getSimulator();
        this.clock = clock;
    }

    /**
     * Generate {@code hours} hourly readings ending now, with anomalies injected. Uses the
     * configured seed when present, otherwise a fresh unseeded generator per call.
     */
    public List<Reading> generate(int hours) {
        Random random = settings.getSeed() != null ? new Random(settings.getSeed()) : new Random();
        return generate(hours, random);
    }

    public List<Reading> generate(int hours, Random random) {
        List<Reading> series = injectAnomalies(generateNormalPattern(hours, random), random);
        log.info("Generated {} hourly readings", series.size());
        return series;
    }

    public List<Reading> generateNormalPattern(int hours, Random random) {
        if (hours <= 0) {
            throw new IllegalArgumentException("hours must be positive, got " + hours);
        }
        if (hours > settings.getMaxHours()) {
            throw new IllegalArgumentException("hours must not exceed " + settings.getMaxHours() + ", got " + hours);
        }

        LocalDateTime start = LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS).minusHours(hours);
        List<Reading> readings = new ArrayList<>(hours);
        for (int i = 0; i < hours; i++) {
            LocalDateTime timestamp = start.plusHours(i);
            double base = baseLoad(timestamp.getHour());
            double consumption = Math.max(0.0, base + random.nextGaussian() * settings.getNoiseStdDev());
            readings.add(Reading.builder()
                    .timestamp(timestamp)
                    .consumptionKw(consumption)
                    .groundTruth(false)
                    .build());
        }
        return readings;
    }

    /**
     * Returns a copy of {@code normal} where {@code round(size * anomalyFraction)} distinct
     * readings, chosen uniformly, carry an injected anomaly and are labeled anomalous.
     */
    public List<Reading> injectAnomalies(List<Reading> normal, Random random) {
        List<Reading> readings = new ArrayList<>(normal);
        int n = readings.size();
        int anomalyCount = (int) Math.min(n, Math.round(n * settings.getAnomalyFraction()));

        // Partial Fisher-Yates shuffle picks distinct indices
        int[] indices = new int[n];
        for (int i = 0; i < n; i++) indices[i] = i;
        AnomalyKind[] kinds = AnomalyKind.values();

        for (int k = 0; k < anomalyCount; k++) {
            int j = k + random.nextInt(n - k);
            int idx = indices[j];
            indices[j] = indices[k];
            indices[k] = idx;

            Reading original = readings.get(idx);
            AnomalyKind kind = kinds[random.nextInt(kinds.length)];
            double value = switch (kind) {
                case SPIKE -> original.getConsumptionKw() * uniform(random, 3.0, 8.0);
                case DROP -> original.getConsumptionKw() * uniform(random, 0.1, 0.3);
                case ZERO -> 0.0;
            };

            readings.set(idx, Reading.builder()
                    .timestamp(original.getTimestamp())
                    .consumptionKw(value)
                    .groundTruth(true)
                    .build());
            log.debug("Injected {} at {}: {} kW -> {} kW",
                    kind, original.getTimestamp(), original.getConsumptionKw(), value);
        }
        return readings;
    }

    double baseLoad(int hour) {
        double base = settings.getBaseConsumptionKw();
        if (hour < 6) return base * 0.3;
        if (hour < 12) return base * 0.8;
        if (hour < 18) return base * 1.2;
        return base * 1.5;
    }

    private static double uniform(Random random, double min, double max) {
        return min + random.nextDouble() * (max - min);
    }
}
