package com.z254.cxlens.radar.detection;

import com.z254.cxlens.radar.config.RadarProperties;
import com.z254.cxlens.radar.exception.InvalidConfigurationException;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable detector settings for one detection run.
 */
@Value
@Builder(toBuilder = true)
public class DetectionConfig {

    @Builder.Default
    int zScoreWindow = 30;
    @Builder.Default
    double zScoreThreshold = 2.5;
    @Builder.Default
    double ewmaAlpha = 0.3;
    @Builder.Default
    double ewmaThreshold = 2.0;
    @Builder.Default
    int ewmaMinHistory = 10;
    @Builder.Default
    int ewmaResidualWindow = 10;
    @Builder.Default
    int bayesianMinSegment = 5;
    @Builder.Default
    double bayesianThreshold = 2.0;
    @Builder.Default
    int consensusVotes = 2;
    @Builder.Default
    double highSeverityPercentile = 5.0;
    @Builder.Default
    double mediumSeverityPercentile = 10.0;

    public static DetectionConfig defaults() {
        return DetectionConfig.builder().build();
    }

    public static DetectionConfig from(RadarProperties.Detection detection) {
        return DetectionConfig.builder()
                .zScoreWindow(detection.getZScoreWindow())
                .zScoreThreshold(detection.getZScoreThreshold())
                .ewmaAlpha(detection.getEwmaAlpha())
                .ewmaThreshold(detection.getEwmaThreshold())
                .ewmaMinHistory(detection.getEwmaMinHistory())
                .ewmaResidualWindow(detection.getEwmaResidualWindow())
                .bayesianMinSegment(detection.getBayesianMinSegment())
                .bayesianThreshold(detection.getBayesianThreshold())
                .consensusVotes(detection.getConsensusVotes())
                .highSeverityPercentile(detection.getHighSeverityPercentile())
                .mediumSeverityPercentile(detection.getMediumSeverityPercentile())
                .build()
                .validate();
    }

    /**
     * @return this config
     * @throws InvalidConfigurationException if any setting is out of range
     */
    public DetectionConfig validate() {
        require(zScoreWindow >= 2, "z-score window must be at least 2, got " + zScoreWindow);
        require(zScoreThreshold > 0, "z-score threshold must be positive, got " + zScoreThreshold);
        require(ewmaAlpha > 0 && ewmaAlpha <= 1, "EWMA alpha must be in (0, 1], got " + ewmaAlpha);
        require(ewmaThreshold > 0, "EWMA threshold must be positive, got " + ewmaThreshold);
        require(ewmaMinHistory >= 2, "EWMA min history must be at least 2, got " + ewmaMinHistory);
        require(ewmaResidualWindow >= 2, "EWMA residual window must be at least 2, got " + ewmaResidualWindow);
        require(bayesianMinSegment >= 2, "Bayesian min segment must be at least 2, got " + bayesianMinSegment);
        require(bayesianThreshold > 0, "Bayesian threshold must be positive, got " + bayesianThreshold);
        require(consensusVotes >= 1 && consensusVotes <= 3,
                "Consensus votes must be between 1 and 3, got " + consensusVotes);
        require(highSeverityPercentile > 0 && highSeverityPercentile < mediumSeverityPercentile
                        && mediumSeverityPercentile <= 100,
                "Severity percentiles must satisfy 0 < high < medium <= 100, got "
                        + highSeverityPercentile + " / " + mediumSeverityPercentile);
        return this;
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new InvalidConfigurationException(message);
        }
    }
}
