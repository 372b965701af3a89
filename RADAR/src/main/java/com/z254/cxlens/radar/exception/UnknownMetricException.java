package com.z254.cxlens.radar.exception;

/**
 * Raised when a caller asks for a metric that RADAR does not know how to compute.
 */
public class UnknownMetricException extends InvalidConfigurationException {

    private final String metricName;

    public UnknownMetricException(String metricName) {
        super("Unknown metric: " + metricName);
        this.metricName = metricName;
    }

    public String getMetricName() {
        return metricName;
    }
}
