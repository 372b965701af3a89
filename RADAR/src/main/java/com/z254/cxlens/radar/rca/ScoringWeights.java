package com.z254.cxlens.radar.rca;

import com.z254.cxlens.radar.config.RadarProperties;
import com.z254.cxlens.radar.domain.model.EvidenceMethod;
import com.z254.cxlens.radar.exception.InvalidConfigurationException;

import java.util.EnumMap;
import java.util.Map;

/**
 * Fixed evidence weights, renormalized over whichever methods apply.
 */
public final class ScoringWeights {

    private final Map<EvidenceMethod, Double> weights = new EnumMap<>(EvidenceMethod.class);

    public ScoringWeights(double attribution, double diffInDiff, double correlation, double statistical) {
        weights.put(EvidenceMethod.ATTRIBUTION, attribution);
        weights.put(EvidenceMethod.DIFF_IN_DIFF, diffInDiff);
        weights.put(EvidenceMethod.CORRELATION, correlation);
        weights.put(EvidenceMethod.STATISTICAL_TEST, statistical);
        double total = 0.0;
        for (Map.Entry<EvidenceMethod, Double> entry : weights.entrySet()) {
            if (entry.getValue() < 0 || !Double.isFinite(entry.getValue())) {
                throw new InvalidConfigurationException("Weight for " + entry.getKey().key()
                        + " must be a non-negative number, got " + entry.getValue());
            }
            total += entry.getValue();
        }
        if (total <= 0) {
            throw new InvalidConfigurationException("At least one evidence weight must be positive");
        }
    }

    public static ScoringWeights defaults() {
        return new ScoringWeights(0.4, 0.3, 0.2, 0.1);
    }

    public static ScoringWeights from(RadarProperties.Rca.Weights weights) {
        return new ScoringWeights(weights.getAttribution(), weights.getDiffInDiff(),
                weights.getCorrelation(), weights.getStatistical());
    }

    public double weightOf(EvidenceMethod method) {
        return weights.get(method);
    }
}
