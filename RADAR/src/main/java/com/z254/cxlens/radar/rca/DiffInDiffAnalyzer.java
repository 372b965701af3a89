package com.z254.cxlens.radar.rca;

import com.z254.cxlens.radar.domain.model.EvidenceMethod;
import com.z254.cxlens.radar.domain.model.EvidenceTerm;
import com.z254.cxlens.radar.domain.model.Hypothesis;
import com.z254.cxlens.radar.domain.model.OrderObservation;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Difference-in-differences of the per-order metric around a designated change.
 * <p>
 * With a treatment feature, cohort orders exposed to the change (feature above 0.5)
 * are compared with unexposed ones. Otherwise the affected cohort is the treatment
 * group and the rest of the population the control group.
 */
public class DiffInDiffAnalyzer implements EvidenceAnalyzer {

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution();

    private final ChangeEventRegistry changeEvents;

    public DiffInDiffAnalyzer(ChangeEventRegistry changeEvents) {
        this.changeEvents = changeEvents;
    }

    @Override
    public EvidenceMethod method() {
        return EvidenceMethod.DIFF_IN_DIFF;
    }

    @Override
    public EvidenceTerm analyze(Hypothesis hypothesis, EvidenceDataset dataset) {
        Optional<Instant> change = changeEvents.changeFor(hypothesis.getId());
        if (change.isEmpty()) {
            return EvidenceTerm.inapplicable(method(), "no_change_event");
        }
        Instant changedAt = change.get();

        List<OrderObservation> population;
        Predicate<OrderObservation> treated;
        Predicate<OrderObservation> control;
        String treatmentFeature = hypothesis.getTreatmentFeature();
        if (treatmentFeature != null) {
            population = dataset.getCohortOrders();
            treated = o -> o.feature(treatmentFeature).orElse(Double.NaN) > 0.5;
            control = o -> o.feature(treatmentFeature).orElse(Double.NaN) <= 0.5;
        } else {
            population = dataset.getPopulationOrders();
            treated = o -> o.belongsTo(dataset.getCohort());
            control = o -> !o.belongsTo(dataset.getCohort());
        }

        SummaryStatistics treatedBefore = new SummaryStatistics();
        SummaryStatistics treatedAfter = new SummaryStatistics();
        SummaryStatistics controlBefore = new SummaryStatistics();
        SummaryStatistics controlAfter = new SummaryStatistics();
        for (OrderObservation order : population) {
            boolean after = !order.getTimestamp().isBefore(changedAt);
            double value = dataset.outcomeOf(order);
            if (treated.test(order)) {
                (after ? treatedAfter : treatedBefore).addValue(value);
            } else if (control.test(order)) {
                (after ? controlAfter : controlBefore).addValue(value);
            }
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("changedAt", changedAt.toString());
        details.put("treatedBefore", treatedBefore.getN());
        details.put("treatedAfter", treatedAfter.getN());
        details.put("controlBefore", controlBefore.getN());
        details.put("controlAfter", controlAfter.getN());
        if (treatedBefore.getN() < 2 || treatedAfter.getN() < 2
                || controlBefore.getN() < 2 || controlAfter.getN() < 2) {
            return EvidenceTerm.inapplicable(method(), "insufficient_groups", details);
        }

        double treatmentDiff = treatedAfter.getMean() - treatedBefore.getMean();
        double controlDiff = controlAfter.getMean() - controlBefore.getMean();
        double estimate = treatmentDiff - controlDiff;
        double pooledSe = Math.sqrt((varianceOfMean(controlBefore) + varianceOfMean(controlAfter)
                + varianceOfMean(treatedBefore) + varianceOfMean(treatedAfter)) / 4.0);
        if (pooledSe == 0.0) {
            return EvidenceTerm.inapplicable(method(), "zero_variance", details);
        }

        double t = estimate / pooledSe;
        double pValue = 2.0 * (1.0 - STANDARD_NORMAL.cumulativeProbability(Math.abs(t)));
        details.put("estimate", estimate);
        details.put("treatmentDiff", treatmentDiff);
        details.put("controlDiff", controlDiff);
        details.put("tStatistic", t);
        details.put("pValue", pValue);
        return EvidenceTerm.scored(method(), 1.0 - pValue, details);
    }

    private static double varianceOfMean(SummaryStatistics stats) {
        return stats.getVariance() / stats.getN();
    }
}
