package com.z254.cxlens.radar.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Broad family a causal hypothesis belongs to.
 */
public enum HypothesisCategory {
    SUPPLY,
    MERCHANT,
    POLICY,
    INVENTORY,
    MODEL,
    EXTERNAL,
    OPERATIONAL;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
