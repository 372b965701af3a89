package com.z254.cxlens.radar.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Independent evidence signals computed for a hypothesis.
 */
public enum EvidenceMethod {
    ATTRIBUTION("attribution"),
    DIFF_IN_DIFF("diff_in_diff"),
    CORRELATION("correlation"),
    STATISTICAL_TEST("statistical_test");

    private final String key;

    EvidenceMethod(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }
}
