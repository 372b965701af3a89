package com.z254.cxlens.radar.exception;

/**
 * Raised when detection is requested over a metric series with no points.
 */
public class EmptySeriesException extends RuntimeException {

    public EmptySeriesException(String message) {
        super(message);
    }
}
