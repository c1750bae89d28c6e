package com.energy.anomaly.engine;

import com.energy.anomaly.config.DetectionConfig;
import com.energy.anomaly.engine.isolationforest.IsolationForest;
import com.energy.anomaly.engine.kmeans.CentroidDistanceScorer;
import com.energy.anomaly.model.DetectionResult;
import com.energy.anomaly.model.EvaluationReport;
import com.energy.anomaly.model.FeatureVector;
import com.energy.anomaly.model.Reading;
import com.energy.anomaly.model.ScoredReading;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Trains both detectors on a batch of readings and scores batches against a trained
 * {@link ModelSnapshot}. Holds no model state of its own.
 */
public class AnomalyDetector {

    private final DetectionConfig config;
    private final FeatureBuilder featureBuilder;
    private final ClassificationEvaluator evaluator;

    public AnomalyDetector(DetectionConfig config) {
        this.config = config;
        this.featureBuilder = new FeatureBuilder(
                config.getFeatures().getRollingWindow(),
                config.getFeatures().getBackfillFallback());
        this.evaluator = new ClassificationEvaluator();
    }

    public TrainingOutcome train(List<Reading> readings) {
        if (readings.size() < CentroidDistanceScorer.CLUSTER_COUNT) {
            throw new IllegalArgumentException("Training needs at least "
                    + CentroidDistanceScorer.CLUSTER_COUNT + " readings, got " + readings.size());
        }

        double[][] features = FeatureBuilder.toMatrix(featureBuilder.build(readings));
        StandardScaler scaler = StandardScaler.fit(features);
        double[][] scaled = scaler.transform(features);

        DetectionConfig.KMeansSettings kmeansSettings = config.getKmeans();
        CentroidDistanceScorer kmeans = CentroidDistanceScorer.fit(scaled,
                kmeansSettings.getInitializations(),
                kmeansSettings.getMaxIterations(),
                kmeansSettings.getSeed());

        DetectionConfig.IsolationForestSettings forestSettings = config.getIsolationForest();
        IsolationForest forest = IsolationForest.train(scaled,
                forestSettings.getNumTrees(),
                forestSettings.getSampleSize(),
                forestSettings.getContamination(),
                forestSettings.getSeed());

        double[] scores = kmeans.score(scaled);
        double threshold = FusionPolicy.threshold(scores, config.getFusion().getThresholdPercentile());

        ModelSnapshot snapshot = ModelSnapshot.builder()
                .modelId(UUID.randomUUID().toString())
                .trainedAt(System.currentTimeMillis())
                .trainingSamples(readings.size())
                .featureNames(FeatureVector.FEATURE_NAMES)
                .scaler(scaler)
                .kmeans(kmeans)
                .isolationForest(forest)
                .trainingKmeansThreshold(threshold)
                .build();

        DetectionResult result = assemble(snapshot, readings, scores, forest.predict(scaled), threshold);
        return new TrainingOutcome(snapshot, result);
    }

    public DetectionResult score(ModelSnapshot snapshot, List<Reading> readings) {
        validate(snapshot);

        double[][] features = FeatureBuilder.toMatrix(featureBuilder.build(readings));
        double[][] scaled = snapshot.getScaler().transform(features);

        double[] scores = snapshot.getKmeans().score(scaled);
        boolean[] isolation = snapshot.getIsolationForest().predict(scaled);
        double threshold = kmeansThreshold(snapshot, scores);

        return assemble(snapshot, readings, scores, isolation, threshold);
    }

    public EvaluationReport evaluate(ModelSnapshot snapshot, List<ScoredReading> readings) {
        validate(snapshot);
        double[] scores = new double[readings.size()];
        for (int i = 0; i < scores.length; i++) {
            scores[i] = readings.get(i).getKmeansAnomalyScore();
        }
        return evaluator.evaluate(readings, kmeansThreshold(snapshot, scores));
    }

    /**
     * K-Means threshold for a scored batch under the configured {@link ThresholdMode}.
     */
    public double kmeansThreshold(ModelSnapshot snapshot, double[] batchScores) {
        if (config.getFusion().getThresholdMode() == ThresholdMode.TRAINING) {
            return snapshot.getTrainingKmeansThreshold();
        }
        return FusionPolicy.threshold(batchScores, config.getFusion().getThresholdPercentile());
    }

    /**
     * Fails unless the snapshot exists and was trained on the current feature schema.
     */
    public static void validate(ModelSnapshot snapshot) {
        if (snapshot == null) {
            throw new NotTrainedException();
        }
        if (!FeatureVector.FEATURE_NAMES.equals(snapshot.getFeatureNames())) {
            throw new SchemaMismatchException(snapshot.getFeatureNames(), FeatureVector.FEATURE_NAMES);
        }
    }

    private DetectionResult assemble(ModelSnapshot snapshot, List<Reading> readings, double[] scores,
                                     boolean[] isolation, double threshold) {
        boolean[] fused = FusionPolicy.fuse(scores, isolation, threshold);

        List<ScoredReading> scored = new ArrayList<>(readings.size());
        int anomalyCount = 0;
        for (int i = 0; i < readings.size(); i++) {
            Reading reading = readings.get(i);
            if (fused[i]) anomalyCount++;
            scored.add(ScoredReading.builder()
                    .timestamp(reading.getTimestamp())
                    .consumptionKw(reading.getConsumptionKw())
                    .groundTruth(reading.getGroundTruth())
                    .kmeansAnomalyScore(scores[i])
                    .isolationAnomaly(isolation[i])
                    .finalAnomaly(fused[i])
                    .build());
        }

        return DetectionResult.builder()
                .modelId(snapshot.getModelId())
                .readings(scored)
                .anomalyCount(anomalyCount)
                .kmeansThreshold(threshold)
                .build();
    }
}
