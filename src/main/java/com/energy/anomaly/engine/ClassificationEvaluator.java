package com.energy.anomaly.engine;

import com.energy.anomaly.model.ClassMetrics;
import com.energy.anomaly.model.ClassificationReport;
import com.energy.anomaly.model.EvaluationReport;
import com.energy.anomaly.model.ScoredReading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Compares the K-Means, Isolation Forest and fused verdicts of a scored batch against its
 * ground-truth labels.
 */
public class ClassificationEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ClassificationEvaluator.class);

    public EvaluationReport evaluate(List<ScoredReading> readings, double kmeansThreshold) {
        int n = readings.size();
        boolean[] truth = new boolean[n];
        boolean[] kmeans = new boolean[n];
        boolean[] isolation = new boolean[n];
        boolean[] combined = new boolean[n];

        for (int i = 0; i < n; i++) {
            ScoredReading reading = readings.get(i);
            if (!reading.hasGroundTruth()) {
                throw new MissingLabelException(i);
            }
            truth[i] = reading.getGroundTruth();
            kmeans[i] = reading.getKmeansAnomalyScore() > kmeansThreshold;
            isolation[i] = reading.isIsolationAnomaly();
            combined[i] = reading.isFinalAnomaly();
        }

        EvaluationReport report = EvaluationReport.builder()
                .kmeans(report(truth, kmeans))
                .isolationForest(report(truth, isolation))
                .combined(report(truth, combined))
                .kmeansThreshold(kmeansThreshold)
                .evaluatedReadings(n)
                .build();

        if (log.isInfoEnabled()) {
            log.info("=== Model evaluation over {} readings (K-Means threshold {}) ===\n{}\n{}\n{}",
                    n, String.format("%.4f", kmeansThreshold),
                    format("K-Means", report.getKmeans()),
                    format("Isolation Forest", report.getIsolationForest()),
                    format("Combined", report.getCombined()));
        }
        return report;
    }

    public static ClassificationReport report(boolean[] truth, boolean[] predicted) {
        int tp = 0, fp = 0, tn = 0, fn = 0;
        for (int i = 0; i < truth.length; i++) {
            if (truth[i] && predicted[i]) tp++;
            else if (!truth[i] && predicted[i]) fp++;
            else if (!truth[i]) tn++;
            else fn++;
        }

        // Normal class: "positive" means predicted normal
        ClassMetrics normal = metrics(tn, fn, fp, tn + fp);
        ClassMetrics anomaly = metrics(tp, fp, fn, tp + fn);
        int total = truth.length;

        return ClassificationReport.builder()
                .normal(normal)
                .anomaly(anomaly)
                .accuracy(total == 0 ? 0.0 : (double) (tp + tn) / total)
                .macroAvg(average(normal, anomaly, 0.5, 0.5, total))
                .weightedAvg(total == 0
                        ? average(normal, anomaly, 0.0, 0.0, 0)
                        : average(normal, anomaly, (double) normal.getSupport() / total,
                                (double) anomaly.getSupport() / total, total))
                .build();
    }

    private static ClassMetrics metrics(int truePositives, int falsePositives, int falseNegatives, int support) {
        double precision = ratio(truePositives, truePositives + falsePositives);
        double recall = ratio(truePositives, truePositives + falseNegatives);
        double f1 = precision + recall == 0 ? 0.0 : 2 * precision * recall / (precision + recall);
        return ClassMetrics.builder()
                .precision(precision)
                .recall(recall)
                .f1Score(f1)
                .support(support)
                .build();
    }

    private static ClassMetrics average(ClassMetrics a, ClassMetrics b, double weightA, double weightB, int support) {
        return ClassMetrics.builder()
                .precision(weightA * a.getPrecision() + weightB * b.getPrecision())
                .recall(weightA * a.getRecall() + weightB * b.getRecall())
                .f1Score(weightA * a.getF1Score() + weightB * b.getF1Score())
                .support(support)
                .build();
    }

    private static double ratio(int numerator, int denominator) {
        return denominator == 0 ? 0.0 : (double) numerator / denominator;
    }

    private static String format(String title, ClassificationReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append("--- ").append(title).append(" ---\n");
        sb.append(String.format("%14s %10s %10s %10s %10s%n", "", "precision", "recall", "f1-score", "support"));
        appendRow(sb, "normal", report.getNormal());
        appendRow(sb, "anomaly", report.getAnomaly());
        sb.append(String.format("%14s %10s %10s %10.2f %10d%n", "accuracy", "", "",
                report.getAccuracy(), report.getWeightedAvg().getSupport()));
        appendRow(sb, "macro avg", report.getMacroAvg());
        appendRow(sb, "weighted avg", report.getWeightedAvg());
        return sb.toString();
    }

    private static void appendRow(StringBuilder sb, String label, ClassMetrics m) {
        sb.append(String.format("%14s %10.2f %10.2f %10.2f %10d%n",
                label, m.getPrecision(), m.getRecall(), m.getF1Score(), m.getSupport()));
    }
}
