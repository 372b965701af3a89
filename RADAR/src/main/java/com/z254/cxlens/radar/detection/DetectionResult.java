package com.z254.cxlens.radar.detection;

import com.z254.cxlens.radar.domain.model.DetectionVotes;
import com.z254.cxlens.radar.domain.model.Severity;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Consensus verdict at the latest point of a series.
 */
@Value
@Builder
public class DetectionResult {
    boolean anomaly;
    Severity severity;
    double percentile;
    DetectionVotes votes;
    List<DetectorVote> methodVotes;
    Instant evaluatedAt;
    double currentValue;
    /** Mean of all points before the evaluated one; the current value when there are none */
    double baselineValue;
}
