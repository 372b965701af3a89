package com.z254.cxlens.radar.domain.model;

/**
 * Coarse size classification of a detected swing.
 */
public enum Severity {
    LOW(1),
    MEDIUM(2),
    HIGH(3);

    private final int rank;

    Severity(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }
}
