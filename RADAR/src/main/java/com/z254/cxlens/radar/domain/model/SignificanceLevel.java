package com.z254.cxlens.radar.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Fixed p-value to symbol mapping used to label slices.
 */
public enum SignificanceLevel {
    HIGHLY_SIGNIFICANT("***", 4),
    VERY_SIGNIFICANT("**", 3),
    SIGNIFICANT("*", 2),
    NOT_SIGNIFICANT("ns", 1),
    UNKNOWN("unknown", 0);

    private final String symbol;
    private final int strength;

    SignificanceLevel(String symbol, int strength) {
        this.symbol = symbol;
        this.strength = strength;
    }

    public static SignificanceLevel fromPValue(Double pValue) {
        if (pValue == null || pValue.isNaN()) {
            return UNKNOWN;
        }
        if (pValue < 0.001) {
            return HIGHLY_SIGNIFICANT;
        }
        if (pValue < 0.01) {
            return VERY_SIGNIFICANT;
        }
        if (pValue < 0.05) {
            return SIGNIFICANT;
        }
        return NOT_SIGNIFICANT;
    }

    @JsonValue
    public String symbol() {
        return symbol;
    }

    public int strength() {
        return strength;
    }
}
