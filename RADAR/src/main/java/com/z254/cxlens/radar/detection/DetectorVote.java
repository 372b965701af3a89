package com.z254.cxlens.radar.detection;

import com.z254.cxlens.radar.domain.model.Vote;
import lombok.Value;

/**
 * Vote of one detection method, with the statistic it computed when it could judge.
 */
@Value
public class DetectorVote {
    String method;
    Vote vote;
    Double statistic;
    String reason;

    public static DetectorVote of(String method, double statistic, double threshold) {
        return new DetectorVote(method, statistic > threshold ? Vote.ANOMALY : Vote.NORMAL, statistic, null);
    }

    public static DetectorVote abstain(String method, String reason) {
        return new DetectorVote(method, Vote.ABSTAIN, null, reason);
    }
}
