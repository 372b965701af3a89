package com.z254.cxlens.radar.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Output of a root cause analysis pass: hypotheses ranked by combined score.
 */
@Value
@Builder
public class RcaReport {
    String incidentId;
    String metricName;
    Incident.Direction direction;
    long incidentRevision;
    Instant generatedAt;
    int hypothesesTested;
    List<HypothesisTestResult> rankedCauses;
    String narrative;
    String summary;

    public Optional<HypothesisTestResult> topCause() {
        return rankedCauses.isEmpty() ? Optional.empty() : Optional.of(rankedCauses.get(0));
    }
}
