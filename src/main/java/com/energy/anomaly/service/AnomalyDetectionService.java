package com.energy.anomaly.service;

import com.energy.anomaly.config.DetectionConfig;
import com.energy.anomaly.config.MetricsConfig;
import com.energy.anomaly.engine.AnomalyDetector;
import com.energy.anomaly.engine.DetectionException;
import com.energy.anomaly.engine.ModelSnapshot;
import com.energy.anomaly.engine.TrainingOutcome;
import com.energy.anomaly.model.DetectionResult;
import com.energy.anomaly.model.EvaluationReport;
import com.energy.anomaly.model.ModelMetadata;
import com.energy.anomaly.model.Reading;
import com.energy.anomaly.model.ScoredReading;
import com.energy.anomaly.repository.ModelSnapshotRepository;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the current trained model. Training publishes a new immutable snapshot atomically, so
 * concurrent scoring calls see either the previous or the new model, never a partial one.
 */
@Service
public class AnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    private final DetectionConfig config;
    private final AnomalyDetector detector;
    private final ModelSnapshotRepository modelRepository;
    private final MetricsConfig metricsConfig;

    private final AtomicReference<ModelSnapshot> current = new AtomicReference<>();

    public AnomalyDetectionService(DetectionConfig config,
                                   ModelSnapshotRepository modelRepository,
                                   MetricsConfig metricsConfig) {
        this.config = config;
        this.detector = new AnomalyDetector(config);
        this.modelRepository = modelRepository;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void restoreModel() {
        ModelSnapshot stored = modelRepository.loadCurrent();
        if (stored == null) {
            log.info("No stored model found. Train on a batch of readings before scoring.");
            return;
        }
        try {
            AnomalyDetector.validate(stored);
        } catch (DetectionException e) {
            log.warn("Discarding stored model {}: {}", stored.getModelId(), e.getMessage());
            return;
        }
        current.compareAndSet(null, stored);
        metricsConfig.markModelLoaded();
        log.info("Restored model {} trained on {} readings", stored.getModelId(), stored.getTrainingSamples());
    }

    /**
     * Train both detectors on {@code readings}, publish the new model and return the readings
     * scored by it.
     */
    @Observed(name = "detection.train", contextualName = "train-and-score")
    public DetectionResult trainAndScore(List<Reading> readings) {
        log.info("Training on {} readings...", readings.size());

        TrainingOutcome outcome = detector.train(readings);
        ModelSnapshot snapshot = outcome.getSnapshot();
        current.set(snapshot);
        modelRepository.saveCurrent(snapshot);

        DetectionResult result = outcome.getResult();
        metricsConfig.recordTraining(readings.size(), result.getAnomalyCount());
        log.info("Trained model {}: {} readings, {} anomalies, K-Means threshold {}, IF threshold {}",
                snapshot.getModelId(), readings.size(), result.getAnomalyCount(),
                result.getKmeansThreshold(), snapshot.getIsolationForest().getThreshold());
        return result;
    }

    @Observed(name = "detection.score", contextualName = "score-readings")
    public DetectionResult score(List<Reading> readings) {
        DetectionResult result = detector.score(current.get(), readings);

        metricsConfig.recordScoring(readings.size(), result.getAnomalyCount());
        if (result.getAnomalyCount() > 0) {
            log.warn("Anomalies detected: {} of {} readings (model {}, K-Means threshold {})",
                    result.getAnomalyCount(), readings.size(), result.getModelId(), result.getKmeansThreshold());
        } else {
            log.info("Scored {} readings with model {}: no anomalies", readings.size(), result.getModelId());
        }
        return result;
    }

    public EvaluationReport evaluate(List<ScoredReading> readings) {
        return detector.evaluate(current.get(), readings);
    }

    public boolean isTrained() {
        return current.get() != null;
    }

    /**
     * @return metadata of the current model, or null when untrained
     */
    public ModelMetadata getModelMetadata() {
        ModelSnapshot snapshot = current.get();
        if (snapshot == null) return null;

        return ModelMetadata.builder()
                .modelId(snapshot.getModelId())
                .trainedAt(snapshot.getTrainedAt())
                .trainingSamples(snapshot.getTrainingSamples())
                .featureCount(snapshot.getScaler().featureCount())
                .featureNames(snapshot.getFeatureNames())
                .clusterCount(snapshot.getKmeans().getCentroids().length)
                .treeCount(snapshot.getIsolationForest().getTrees().size())
                .contamination(snapshot.getIsolationForest().getContamination())
                .isolationThreshold(snapshot.getIsolationForest().getThreshold())
                .trainingKmeansThreshold(snapshot.getTrainingKmeansThreshold())
                .thresholdMode(config.getFusion().getThresholdMode())
                .build();
    }
}
