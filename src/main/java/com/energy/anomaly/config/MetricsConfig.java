package com.energy.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger modelTrained;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.modelTrained = registry.gauge("detection.model.trained", new AtomicInteger(0));
    }

    public void recordTraining(int samples, int anomalies) {
        Counter.builder("detection.train.count")
                .register(registry)
                .increment();
        recordBatch("train", samples, anomalies);
        modelTrained.set(1);
    }

    public void recordScoring(int samples, int anomalies) {
        Counter.builder("detection.score.count")
                .register(registry)
                .increment();
        recordBatch("score", samples, anomalies);
    }

    public void recordGeneration(int readings) {
        Counter.builder("simulator.generated.count")
                .register(registry)
                .increment(readings);
    }

    public void markModelLoaded() {
        modelTrained.set(1);
    }

    private void recordBatch(String stage, int samples, int anomalies) {
        DistributionSummary.builder("detection.batch.size")
                .tag("stage", stage)
                .register(registry)
                .record(samples);

        Counter.builder("detection.anomalies.count")
                .tag("stage", stage)
                .register(registry)
                .increment(anomalies);
    }
}
