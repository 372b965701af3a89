package com.z254.cxlens.radar.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * A customer/order sub-population identified by categorical dimension values.
 * <p>
 * Dimensions that are not present are wildcards ("all"). The root cohort has no
 * fixed dimensions and matches every order. Dimension order is canonical (sorted),
 * so two cohorts with the same fixed values are equal and share the same key.
 */
@EqualsAndHashCode
public final class Cohort {

    public static final String WILDCARD = "all";

    public static final Cohort ROOT = new Cohort(Map.of());

    private final Map<String, String> dimensions;

    private Cohort(Map<String, String> dimensions) {
        this.dimensions = Collections.unmodifiableMap(new TreeMap<>(dimensions));
    }

    @JsonCreator
    public static Cohort of(Map<String, String> dimensions) {
        if (dimensions == null || dimensions.isEmpty()) {
            return ROOT;
        }
        Map<String, String> fixed = dimensions.entrySet().stream()
                .filter(e -> e.getValue() != null && !WILDCARD.equalsIgnoreCase(e.getValue()))
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue));
        return fixed.isEmpty() ? ROOT : new Cohort(fixed);
    }

    public static Cohort of(String dimension, String value) {
        return of(Map.of(dimension, value));
    }

    /**
     * Return a narrower cohort with one more dimension fixed.
     */
    public Cohort with(String dimension, String value) {
        Map<String, String> next = new TreeMap<>(dimensions);
        next.put(dimension, value);
        return new Cohort(next);
    }

    @JsonValue
    public Map<String, String> getDimensions() {
        return dimensions;
    }

    public Set<String> fixedDimensions() {
        return dimensions.keySet();
    }

    public boolean isRoot() {
        return dimensions.isEmpty();
    }

    public int depth() {
        return dimensions.size();
    }

    /**
     * Whether an order with the given dimension values belongs to this cohort.
     */
    public boolean matches(Map<String, String> orderDimensions) {
        for (Map.Entry<String, String> entry : dimensions.entrySet()) {
            if (!Objects.equals(entry.getValue(), orderDimensions.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Canonical key used for identity and lookups.
     */
    public String key() {
        if (dimensions.isEmpty()) {
            return "*";
        }
        return dimensions.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(","));
    }

    /**
     * Human readable label, "All" for the root cohort.
     */
    public String label() {
        if (dimensions.isEmpty()) {
            return "All";
        }
        return dimensions.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(" | "));
    }

    @Override
    public String toString() {
        return label();
    }
}
