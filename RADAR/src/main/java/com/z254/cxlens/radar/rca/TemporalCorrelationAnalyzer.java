package com.z254.cxlens.radar.rca;

import com.z254.cxlens.radar.domain.model.EvidenceMethod;
import com.z254.cxlens.radar.domain.model.EvidenceTerm;
import com.z254.cxlens.radar.domain.model.Hypothesis;
import com.z254.cxlens.radar.domain.model.OrderObservation;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Pearson correlation between the metric and the primary feature, bucket by bucket,
 * over the whole detection window.
 */
public class TemporalCorrelationAnalyzer implements EvidenceAnalyzer {

    private final int minPoints;
    private final double strongThreshold;

    public TemporalCorrelationAnalyzer(int minPoints, double strongThreshold) {
        this.minPoints = minPoints;
        this.strongThreshold = strongThreshold;
    }

    @Override
    public EvidenceMethod method() {
        return EvidenceMethod.CORRELATION;
    }

    @Override
    public EvidenceTerm analyze(Hypothesis hypothesis, EvidenceDataset dataset) {
        String feature = hypothesis.getPrimaryFeature();
        long bucketMillis = dataset.getBucket().toMillis();

        Map<Instant, SummaryStatistics[]> buckets = new TreeMap<>();
        for (OrderObservation order : dataset.getCohortOrders()) {
            OptionalDouble value = order.feature(feature);
            if (value.isEmpty()) {
                continue;
            }
            long millis = order.getTimestamp().toEpochMilli();
            Instant bucket = Instant.ofEpochMilli(millis - Math.floorMod(millis, bucketMillis));
            SummaryStatistics[] pair = buckets.computeIfAbsent(bucket,
                    b -> new SummaryStatistics[]{new SummaryStatistics(), new SummaryStatistics()});
            pair[0].addValue(dataset.outcomeOf(order));
            pair[1].addValue(value.getAsDouble());
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("feature", feature);
        details.put("points", buckets.size());
        if (buckets.size() < minPoints) {
            return EvidenceTerm.inapplicable(method(), "insufficient_points", details);
        }

        double[] metricSeries = buckets.values().stream().mapToDouble(p -> p[0].getMean()).toArray();
        double[] featureSeries = buckets.values().stream().mapToDouble(p -> p[1].getMean()).toArray();
        if (isConstant(metricSeries) || isConstant(featureSeries)) {
            return EvidenceTerm.inapplicable(method(), "zero_variance", details);
        }

        double r = new PearsonsCorrelation().correlation(metricSeries, featureSeries);
        if (Double.isNaN(r)) {
            return EvidenceTerm.inapplicable(method(), "zero_variance", details);
        }
        details.put("r", r);
        details.put("strong", Math.abs(r) > strongThreshold);
        return EvidenceTerm.scored(method(), Math.abs(r), details);
    }

    private static boolean isConstant(double[] values) {
        for (double v : values) {
            if (v != values[0]) {
                return false;
            }
        }
        return true;
    }
}
