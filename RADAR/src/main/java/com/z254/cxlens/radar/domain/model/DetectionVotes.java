package com.z254.cxlens.radar.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.stream.Stream;

/**
 * Per-method votes recorded on an incident for auditability.
 * <p>
 * Keeps the tri-state outcome of each detector so that an abstention can be told
 * apart from a genuine "no anomaly" vote.
 */
@Value
public class DetectionVotes {

    @JsonProperty("z_score")
    Vote zScore;

    @JsonProperty("ewma")
    Vote ewma;

    @JsonProperty("bayesian")
    Vote bayesian;

    public static DetectionVotes none() {
        return new DetectionVotes(Vote.ABSTAIN, Vote.ABSTAIN, Vote.ABSTAIN);
    }

    /**
     * Number of methods that voted anomaly; abstentions count as "no".
     */
    @JsonIgnore
    public int votesFor() {
        return (int) Stream.of(zScore, ewma, bayesian).filter(Vote::isAnomaly).count();
    }

    @JsonIgnore
    public int abstentions() {
        return (int) Stream.of(zScore, ewma, bayesian).filter(v -> v == Vote.ABSTAIN).count();
    }
}
