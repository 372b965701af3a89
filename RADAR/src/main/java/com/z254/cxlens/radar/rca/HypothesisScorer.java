package com.z254.cxlens.radar.rca;

import com.z254.cxlens.radar.config.RadarProperties;
import com.z254.cxlens.radar.domain.model.EvidenceMethod;
import com.z254.cxlens.radar.domain.model.EvidenceTerm;
import com.z254.cxlens.radar.domain.model.Hypothesis;
import com.z254.cxlens.radar.domain.model.HypothesisTestResult;
import com.z254.cxlens.radar.domain.model.Incident;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Combines evidence into confidence and impact, ranks hypotheses and renders the
 * rule-based narrative.
 */
@Component
public class HypothesisScorer {

    public static final double DOMINANT_CAUSE_SCORE = 0.7;
    public static final double PRIMARY_CAUSE_SCORE = 0.5;
    public static final double SECONDARY_CONFIDENCE = 0.5;

    /**
     * Combined score, then confidence, then hypothesis id for a total, stable order.
     */
    public static final Comparator<HypothesisTestResult> RANKING = Comparator
            .comparingDouble(HypothesisTestResult::getCombinedScore).reversed()
            .thenComparing(Comparator.comparingDouble(HypothesisTestResult::getConfidence).reversed())
            .thenComparing(HypothesisTestResult::getHypothesisId);

    private final ScoringWeights weights;

    @Autowired
    public HypothesisScorer(RadarProperties properties) {
        this(ScoringWeights.from(properties.getRca().getWeights()));
    }

    public HypothesisScorer(ScoringWeights weights) {
        this.weights = weights;
    }

    /**
     * Weighted average of the applicable scores; 0 when nothing applies.
     */
    public double confidence(Map<EvidenceMethod, EvidenceTerm> evidence) {
        double weighted = 0.0;
        double totalWeight = 0.0;
        for (EvidenceTerm term : evidence.values()) {
            if (term.isApplicable()) {
                double w = weights.weightOf(term.getMethod());
                weighted += w * term.getScore();
                totalWeight += w;
            }
        }
        return totalWeight == 0.0 ? 0.0 : weighted / totalWeight;
    }

    public HypothesisTestResult score(Hypothesis hypothesis, Map<EvidenceMethod, EvidenceTerm> evidence,
                                      double impact) {
        double confidence = confidence(evidence);
        return HypothesisTestResult.builder()
                .hypothesis(hypothesis)
                .evidence(evidence)
                .confidence(confidence)
                .impact(impact)
                .combinedScore(confidence * impact)
                .build();
    }

    /**
     * Result for a hypothesis whose test could not run at all, e.g. on timeout.
     */
    public HypothesisTestResult inapplicable(Hypothesis hypothesis, String note) {
        Map<EvidenceMethod, EvidenceTerm> evidence = new EnumMap<>(EvidenceMethod.class);
        for (EvidenceMethod method : EvidenceMethod.values()) {
            evidence.put(method, EvidenceTerm.inapplicable(method, note));
        }
        return score(hypothesis, evidence, 0.0);
    }

    public List<HypothesisTestResult> rank(Collection<HypothesisTestResult> results) {
        return results.stream().sorted(RANKING).toList();
    }

    /**
     * Threshold ladder on the top combined score: dominant cause above 0.7,
     * primary plus secondary from 0.5, several contributing factors below.
     */
    public String narrative(List<HypothesisTestResult> ranked, String metricName, Incident.Direction direction) {
        if (ranked.isEmpty()) {
            return "No hypotheses could be tested.";
        }
        String change = changeNoun(direction);
        HypothesisTestResult top = ranked.get(0);
        double topScore = top.getCombinedScore();

        if (topScore > DOMINANT_CAUSE_SCORE) {
            return String.format(Locale.ROOT,
                    "Most of the %s %s is attributable to %s (score %.2f, confidence %.0f%%).",
                    metricName, change, top.getHypothesis().getName(), topScore, top.getConfidence() * 100);
        }
        if (topScore >= PRIMARY_CAUSE_SCORE) {
            StringBuilder narrative = new StringBuilder(String.format(Locale.ROOT,
                    "%s is the primary cause of the %s %s (score %.2f, confidence %.0f%%)",
                    top.getHypothesis().getName(), metricName, change, topScore, top.getConfidence() * 100));
            if (ranked.size() > 1) {
                HypothesisTestResult secondary = ranked.get(1);
                narrative.append(String.format(Locale.ROOT, ", with %s as a secondary cause (score %.2f)",
                        secondary.getHypothesis().getName(), secondary.getCombinedScore()));
            }
            return narrative.append('.').toString();
        }

        String others = ranked.stream()
                .skip(1)
                .limit(3)
                .map(r -> r.getHypothesis().getName())
                .collect(Collectors.joining(", "));
        StringBuilder narrative = new StringBuilder(String.format(Locale.ROOT,
                "Multiple factors contributed to the %s %s; %s is the most likely (score %.2f, confidence %.0f%%)",
                metricName, change, top.getHypothesis().getName(), topScore, top.getConfidence() * 100));
        if (!others.isEmpty()) {
            narrative.append(". Other contributing factors: ").append(others);
        }
        return narrative.append('.').toString();
    }

    /**
     * One-line summary naming the top cause and, when confident enough, the runner-up.
     */
    public String summary(List<HypothesisTestResult> ranked, String metricName, Incident.Direction direction) {
        if (ranked.isEmpty()) {
            return "No root causes identified.";
        }
        StringBuilder summary = new StringBuilder("Most of the ")
                .append(metricName).append(' ')
                .append(direction == Incident.Direction.IMPROVEMENT ? "gain" : "drop")
                .append(" comes from ")
                .append(ranked.get(0).getHypothesis().getName().toLowerCase(Locale.ROOT));
        if (ranked.size() > 1 && ranked.get(1).getConfidence() > SECONDARY_CONFIDENCE) {
            summary.append(" and ").append(ranked.get(1).getHypothesis().getName().toLowerCase(Locale.ROOT));
        }
        return summary.append('.').toString();
    }

    private static String changeNoun(Incident.Direction direction) {
        return direction == Incident.Direction.IMPROVEMENT ? "improvement" : "regression";
    }
}
