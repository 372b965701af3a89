package com.z254.cxlens.radar.detection;

/**
 * A single statistical anomaly test evaluated at the latest point of a series.
 * <p>
 * Implementations abstain instead of throwing when the data cannot support a judgement.
 */
public interface SeriesDetector {

    String method();

    /**
     * @param values non-empty series values in time order; the last one is evaluated
     */
    DetectorVote evaluate(double[] values, DetectionConfig config);
}
