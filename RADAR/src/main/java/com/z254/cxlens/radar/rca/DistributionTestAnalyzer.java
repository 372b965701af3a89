package com.z254.cxlens.radar.rca;

import com.z254.cxlens.radar.domain.model.EvidenceMethod;
import com.z254.cxlens.radar.domain.model.EvidenceTerm;
import com.z254.cxlens.radar.domain.model.Hypothesis;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.inference.TTest;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Welch's t-test of the primary feature, baseline period against current period.
 * Only a p-value below the significance level earns a non-zero score.
 */
public class DistributionTestAnalyzer implements EvidenceAnalyzer {

    private final double significanceLevel;

    public DistributionTestAnalyzer(double significanceLevel) {
        this.significanceLevel = significanceLevel;
    }

    @Override
    public EvidenceMethod method() {
        return EvidenceMethod.STATISTICAL_TEST;
    }

    @Override
    public EvidenceTerm analyze(Hypothesis hypothesis, EvidenceDataset dataset) {
        String feature = hypothesis.getPrimaryFeature();
        double[] baseline = EvidenceDataset.featureValues(dataset.getBaselineOrders(), feature);
        double[] current = EvidenceDataset.featureValues(dataset.getCurrentOrders(), feature);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("feature", feature);
        details.put("baselineCount", baseline.length);
        details.put("currentCount", current.length);
        if (baseline.length < 2 || current.length < 2) {
            return EvidenceTerm.inapplicable(method(), "insufficient_sample", details);
        }
        if (StatUtils.variance(baseline) == 0.0 && StatUtils.variance(current) == 0.0) {
            return EvidenceTerm.inapplicable(method(), "zero_variance", details);
        }

        TTest tTest = new TTest();
        double t = tTest.t(baseline, current);
        double pValue = tTest.tTest(baseline, current);
        if (Double.isNaN(pValue)) {
            return EvidenceTerm.inapplicable(method(), "test_undefined", details);
        }
        details.put("baselineMean", StatUtils.mean(baseline));
        details.put("currentMean", StatUtils.mean(current));
        details.put("tStatistic", t);
        details.put("pValue", pValue);
        return EvidenceTerm.scored(method(), pValue < significanceLevel ? 1.0 - pValue : 0.0, details);
    }
}
