package com.z254.cxlens.radar.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

import java.util.Map;

/**
 * Outcome of one evidence method for one hypothesis.
 * <p>
 * A null score means the method was inapplicable and is excluded from the
 * confidence average; a score of 0 is a genuine "no support" result.
 */
@Value
public class EvidenceTerm {

    EvidenceMethod method;
    Double score;
    String note;
    Map<String, Object> details;

    public static EvidenceTerm scored(EvidenceMethod method, double score, Map<String, Object> details) {
        double clamped = Math.max(0.0, Math.min(1.0, score));
        return new EvidenceTerm(method, clamped, null, details);
    }

    /**
     * Applicable term carrying a note, e.g. a zero score recorded for a sample below the floor.
     */
    public static EvidenceTerm scored(EvidenceMethod method, double score, String note, Map<String, Object> details) {
        double clamped = Math.max(0.0, Math.min(1.0, score));
        return new EvidenceTerm(method, clamped, note, details);
    }

    public static EvidenceTerm inapplicable(EvidenceMethod method, String note) {
        return new EvidenceTerm(method, null, note, Map.of());
    }

    public static EvidenceTerm inapplicable(EvidenceMethod method, String note, Map<String, Object> details) {
        return new EvidenceTerm(method, null, note, details);
    }

    @JsonIgnore
    public boolean isApplicable() {
        return score != null;
    }
}
