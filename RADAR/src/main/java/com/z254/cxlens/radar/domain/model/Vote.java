package com.z254.cxlens.radar.domain.model;

/**
 * Outcome of a single detection method at the evaluated point.
 * <p>
 * {@link #ABSTAIN} means the method had too little data or no variance to judge;
 * it only collapses to "no" at the consensus step.
 */
public enum Vote {
    ANOMALY,
    NORMAL,
    ABSTAIN;

    public boolean isAnomaly() {
        return this == ANOMALY;
    }
}
