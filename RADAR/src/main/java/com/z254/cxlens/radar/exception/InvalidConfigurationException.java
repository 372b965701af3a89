package com.z254.cxlens.radar.exception;

/**
 * Raised when a detection or RCA setting is out of its valid range.
 * <p>
 * This signals a setup defect rather than a data condition and is always
 * reported to the caller immediately.
 */
public class InvalidConfigurationException extends RuntimeException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
