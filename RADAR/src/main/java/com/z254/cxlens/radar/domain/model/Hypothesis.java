package com.z254.cxlens.radar.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * Candidate causal explanation for a CX regression.
 * <p>
 * Hypotheses are catalog entries: immutable and shared by every RCA pass.
 * The first implicated feature is the primary one, used for correlation,
 * the distribution test and impact.
 */
@Value
@Builder
public class Hypothesis {

    String id;
    String name;
    HypothesisCategory category;
    String description;

    @Singular
    List<String> implicatedFeatures;

    @Singular
    Set<EvidenceMethod> applicableMethods;

    /**
     * Binary order feature marking orders exposed to the change, or null when the
     * affected cohort itself is the treatment group.
     */
    String treatmentFeature;

    @JsonIgnore
    public String getPrimaryFeature() {
        return implicatedFeatures.isEmpty() ? null : implicatedFeatures.get(0);
    }

    public boolean supports(EvidenceMethod method) {
        return applicableMethods.contains(method);
    }
}
