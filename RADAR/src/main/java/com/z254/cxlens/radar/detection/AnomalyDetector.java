package com.z254.cxlens.radar.detection;

import com.z254.cxlens.radar.config.RadarProperties;
import com.z254.cxlens.radar.domain.model.DetectionVotes;
import com.z254.cxlens.radar.domain.model.MetricPoint;
import com.z254.cxlens.radar.domain.model.MetricSeries;
import com.z254.cxlens.radar.domain.model.Vote;
import com.z254.cxlens.radar.exception.EmptySeriesException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Multi-method anomaly detector with consensus voting.
 * <p>
 * Runs the Z-score, EWMA-residual and change-point tests at the latest point of a
 * series; abstentions count as "no" and a configurable majority (2 of 3 by default)
 * is needed to flag an anomaly.
 */
@Slf4j
@Component
public class AnomalyDetector {

    private final ZScoreDetector zScore = new ZScoreDetector();
    private final EwmaDetector ewma = new EwmaDetector();
    private final BayesianChangePointDetector bayesian = new BayesianChangePointDetector();
    private final DetectionConfig defaultConfig;

    @Autowired
    public AnomalyDetector(RadarProperties properties) {
        this(DetectionConfig.from(properties.getDetection()));
    }

    public AnomalyDetector(DetectionConfig defaultConfig) {
        this.defaultConfig = defaultConfig.validate();
    }

    public DetectionResult detect(MetricSeries series) {
        return detect(series, defaultConfig);
    }

    /**
     * @throws EmptySeriesException if the series has no points
     */
    public DetectionResult detect(MetricSeries series, DetectionConfig config) {
        if (series.isEmpty()) {
            throw new EmptySeriesException("Cannot detect on empty series for "
                    + series.getMetricName() + " / " + series.getCohort().label());
        }
        config.validate();
        double[] values = series.values();

        DetectorVote z = zScore.evaluate(values, config);
        DetectorVote e = ewma.evaluate(values, config);
        DetectorVote b = bayesian.evaluate(values, config);
        List<DetectorVote> methodVotes = List.of(z, e, b);
        methodVotes.stream()
                .filter(v -> v.getVote() == Vote.ABSTAIN)
                .forEach(v -> log.debug("{} abstained on {} / {}: {}", v.getMethod(),
                        series.getMetricName(), series.getCohort().label(), v.getReason()));

        DetectionVotes votes = new DetectionVotes(z.getVote(), e.getVote(), b.getVote());
        boolean anomaly = isConsensus(votes, config);

        MetricPoint latest = series.latest();
        double percentile = SeverityClassifier.percentileOfScore(values, latest.getValue());
        double[] prior = Arrays.copyOf(values, values.length - 1);
        double baseline = prior.length == 0 ? latest.getValue() : new Mean().evaluate(prior);

        return DetectionResult.builder()
                .anomaly(anomaly)
                .severity(SeverityClassifier.classify(percentile, config))
                .percentile(percentile)
                .votes(votes)
                .methodVotes(methodVotes)
                .evaluatedAt(latest.getTimestamp())
                .currentValue(latest.getValue())
                .baselineValue(baseline)
                .build();
    }

    public DetectionConfig getDefaultConfig() {
        return defaultConfig;
    }

    static boolean isConsensus(DetectionVotes votes, DetectionConfig config) {
        return votes.votesFor() >= config.getConsensusVotes();
    }
}
