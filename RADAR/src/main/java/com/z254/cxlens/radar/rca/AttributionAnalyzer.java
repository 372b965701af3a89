package com.z254.cxlens.radar.rca;

import com.z254.cxlens.radar.domain.model.EvidenceMethod;
import com.z254.cxlens.radar.domain.model.EvidenceTerm;
import com.z254.cxlens.radar.domain.model.Hypothesis;
import com.z254.cxlens.radar.domain.model.OrderObservation;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Share of a classifier's feature attribution that falls on the hypothesis's features.
 * <p>
 * Fits a logistic model predicting the metric's bad outcome from every order
 * feature, then uses exact linear Shapley values ({@code w_j * z_ij} on
 * standardized inputs). The score is the implicated features' share of the
 * total mean absolute attribution.
 * <p>
 * A cohort below the sample floor scores 0 with an {@code insufficient_sample}
 * note rather than dropping out of the confidence average.
 */
public class AttributionAnalyzer implements EvidenceAnalyzer {

    private final int minSample;

    public AttributionAnalyzer(int minSample) {
        this.minSample = minSample;
    }

    @Override
    public EvidenceMethod method() {
        return EvidenceMethod.ATTRIBUTION;
    }

    @Override
    public EvidenceTerm analyze(Hypothesis hypothesis, EvidenceDataset dataset) {
        List<OrderObservation> rows = dataset.getCohortOrders();
        if (rows.size() < minSample) {
            return EvidenceTerm.scored(method(), 0.0, "insufficient_sample",
                    Map.of("sampleSize", rows.size(), "minSample", minSample));
        }

        String outcome = dataset.getMetric().outcome();
        double[] y = rows.stream().mapToDouble(o -> o.outcome(outcome) ? 1.0 : 0.0).toArray();
        double positives = new Mean().evaluate(y) * y.length;
        if (positives == 0 || positives == y.length) {
            return EvidenceTerm.inapplicable(method(), "degenerate_outcome",
                    Map.of("sampleSize", rows.size(), "positives", (long) positives));
        }

        List<String> features = new ArrayList<>();
        List<double[]> columns = new ArrayList<>();
        for (String feature : dataset.featureNames()) {
            double[] column = standardizedColumn(rows, feature);
            if (column != null) {
                features.add(feature);
                columns.add(column);
            }
        }
        List<String> implicated = hypothesis.getImplicatedFeatures().stream()
                .filter(features::contains)
                .toList();
        if (implicated.isEmpty()) {
            return EvidenceTerm.inapplicable(method(), "features_unavailable",
                    Map.of("implicated", hypothesis.getImplicatedFeatures()));
        }

        double[][] x = new double[rows.size()][features.size()];
        for (int j = 0; j < features.size(); j++) {
            double[] column = columns.get(j);
            for (int i = 0; i < rows.size(); i++) {
                x[i][j] = column[i];
            }
        }

        LogisticModel model = LogisticModel.fit(x, y);
        if (!model.isFinite()) {
            return EvidenceTerm.inapplicable(method(), "model_fit_failed");
        }

        double[] weights = model.weights();
        Map<String, Double> importance = new LinkedHashMap<>();
        for (int j = 0; j < features.size(); j++) {
            double sum = 0.0;
            for (double[] row : x) {
                sum += Math.abs(weights[j] * row[j]);
            }
            importance.put(features.get(j), sum / rows.size());
        }

        double total = importance.values().stream().mapToDouble(Double::doubleValue).sum();
        double implicatedTotal = importance.entrySet().stream()
                .filter(e -> implicated.contains(e.getKey()))
                .mapToDouble(Map.Entry::getValue)
                .sum();
        double score = total > 0 ? implicatedTotal / total : 0.0;

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("sampleSize", rows.size());
        details.put("outcome", outcome);
        details.put("implicatedImportance", implicatedTotal);
        details.put("totalImportance", total);
        details.put("featureImportance", importance);
        return EvidenceTerm.scored(method(), score, details);
    }

    /**
     * Mean-imputed, standardized column; null when the feature is absent or constant.
     */
    private static double[] standardizedColumn(List<OrderObservation> rows, String feature) {
        double[] present = EvidenceDataset.featureValues(rows, feature);
        if (present.length == 0) {
            return null;
        }
        double mean = new Mean().evaluate(present);
        double[] column = rows.stream()
                .mapToDouble(o -> o.feature(feature).orElse(mean))
                .toArray();
        double std = new StandardDeviation(false).evaluate(column);
        if (std == 0.0 || !Double.isFinite(std)) {
            return null;
        }
        for (int i = 0; i < column.length; i++) {
            column[i] = (column[i] - mean) / std;
        }
        return column;
    }
}
