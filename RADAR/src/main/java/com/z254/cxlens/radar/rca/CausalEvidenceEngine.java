package com.z254.cxlens.radar.rca;

import com.z254.cxlens.radar.config.RadarProperties;
import com.z254.cxlens.radar.domain.model.EvidenceMethod;
import com.z254.cxlens.radar.domain.model.EvidenceTerm;
import com.z254.cxlens.radar.domain.model.Hypothesis;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.StatUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Computes the four evidence signals and the impact of one hypothesis on one incident.
 * <p>
 * Methods the hypothesis does not declare are inapplicable. A failing analyzer is
 * recorded as inapplicable with the failure in its note, so one degenerate signal
 * never sinks the whole hypothesis test.
 */
@Slf4j
@Component
public class CausalEvidenceEngine {

    private final Map<EvidenceMethod, EvidenceAnalyzer> analyzers = new EnumMap<>(EvidenceMethod.class);
    private final double impactSaturation;

    @Autowired
    public CausalEvidenceEngine(RadarProperties properties, ChangeEventRegistry changeEvents) {
        this(List.of(
                        new AttributionAnalyzer(properties.getRca().getMinAttributionSample()),
                        new DiffInDiffAnalyzer(changeEvents),
                        new TemporalCorrelationAnalyzer(properties.getRca().getMinCorrelationPoints(),
                                properties.getRca().getStrongCorrelation()),
                        new DistributionTestAnalyzer(properties.getRca().getSignificanceLevel())),
                properties.getRca().getImpactSaturation());
    }

    public CausalEvidenceEngine(List<EvidenceAnalyzer> analyzers, double impactSaturation) {
        analyzers.forEach(a -> this.analyzers.put(a.method(), a));
        this.impactSaturation = impactSaturation;
    }

    public Map<EvidenceMethod, EvidenceTerm> evaluate(Hypothesis hypothesis, EvidenceDataset dataset) {
        Map<EvidenceMethod, EvidenceTerm> evidence = new EnumMap<>(EvidenceMethod.class);
        for (EvidenceMethod method : EvidenceMethod.values()) {
            evidence.put(method, evaluate(method, hypothesis, dataset));
        }
        return evidence;
    }

    private EvidenceTerm evaluate(EvidenceMethod method, Hypothesis hypothesis, EvidenceDataset dataset) {
        if (!hypothesis.supports(method)) {
            return EvidenceTerm.inapplicable(method, "not_declared");
        }
        EvidenceAnalyzer analyzer = analyzers.get(method);
        if (analyzer == null) {
            return EvidenceTerm.inapplicable(method, "no_analyzer");
        }
        try {
            EvidenceTerm term = analyzer.analyze(hypothesis, dataset);
            if (!term.isApplicable()) {
                log.debug("{} inapplicable for {} on {}: {}", method.key(), hypothesis.getId(),
                        dataset.getIncidentId(), term.getNote());
            }
            return term;
        } catch (RuntimeException e) {
            log.warn("{} failed for {} on {}: {}", method.key(), hypothesis.getId(),
                    dataset.getIncidentId(), e.getMessage());
            return EvidenceTerm.inapplicable(method, "analysis_failed: " + e.getMessage());
        }
    }

    /**
     * Relative change of the primary feature between baseline and current, saturating at 1.
     */
    public double impact(Hypothesis hypothesis, EvidenceDataset dataset) {
        String feature = hypothesis.getPrimaryFeature();
        if (feature == null) {
            return 0.0;
        }
        double[] baseline = EvidenceDataset.featureValues(dataset.getBaselineOrders(), feature);
        double[] current = EvidenceDataset.featureValues(dataset.getCurrentOrders(), feature);
        if (baseline.length == 0 || current.length == 0) {
            return 0.0;
        }
        return impact(StatUtils.mean(baseline), StatUtils.mean(current), impactSaturation);
    }

    static double impact(double baseline, double current, double saturation) {
        if (baseline == 0.0) {
            return current == 0.0 ? 0.0 : 1.0;
        }
        double relativeChange = Math.abs((current - baseline) / baseline);
        return Math.min(1.0, relativeChange / saturation);
    }
}
