package com.z254.cxlens.radar.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Scored evidence for one hypothesis against one incident. Never mutated after scoring.
 */
@Value
@Builder
public class HypothesisTestResult {

    Hypothesis hypothesis;
    Map<EvidenceMethod, EvidenceTerm> evidence;
    double confidence;
    double impact;
    double combinedScore;

    public static class HypothesisTestResultBuilder {
        public HypothesisTestResultBuilder evidence(Map<EvidenceMethod, EvidenceTerm> evidence) {
            EnumMap<EvidenceMethod, EvidenceTerm> copy = new EnumMap<>(EvidenceMethod.class);
            copy.putAll(evidence);
            this.evidence = Collections.unmodifiableMap(copy);
            return this;
        }
    }

    @JsonProperty("attribution_score")
    public Double getAttributionScore() {
        return scoreOf(EvidenceMethod.ATTRIBUTION);
    }

    @JsonProperty("diff_in_diff_score")
    public Double getDiffInDiffScore() {
        return scoreOf(EvidenceMethod.DIFF_IN_DIFF);
    }

    @JsonProperty("correlation_score")
    public Double getCorrelationScore() {
        return scoreOf(EvidenceMethod.CORRELATION);
    }

    @JsonProperty("statistical_score")
    public Double getStatisticalScore() {
        return scoreOf(EvidenceMethod.STATISTICAL_TEST);
    }

    public String getHypothesisId() {
        return hypothesis.getId();
    }

    private Double scoreOf(EvidenceMethod method) {
        EvidenceTerm term = evidence.get(method);
        return term == null ? null : term.getScore();
    }
}
