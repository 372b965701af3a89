package com.z254.cxlens.radar.domain.model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CohortTest {

    @Test
    void wildcardsCollapseToRoot() {
        Map<String, String> dims = new HashMap<>();
        dims.put("region", "all");
        dims.put("store", null);

        assertThat(Cohort.of(dims)).isSameAs(Cohort.ROOT);
        assertThat(Cohort.of(Map.of())).isSameAs(Cohort.ROOT);
        assertThat(Cohort.ROOT.key()).isEqualTo("*");
        assertThat(Cohort.ROOT.label()).isEqualTo("All");
    }

    @Test
    void dimensionOrderIsCanonical() {
        Map<String, String> first = new LinkedHashMap<>();
        first.put("store", "s1");
        first.put("region", "north");
        Map<String, String> second = new LinkedHashMap<>();
        second.put("region", "north");
        second.put("store", "s1");

        assertThat(Cohort.of(first)).isEqualTo(Cohort.of(second));
        assertThat(Cohort.of(first).key()).isEqualTo("region=north,store=s1");
        assertThat(Cohort.of("region", "north").with("store", "s1")).isEqualTo(Cohort.of(second));
    }

    @Test
    void matchesOnlyFixedDimensions() {
        Cohort north = Cohort.of("region", "north");

        assertThat(north.matches(Map.of("region", "north", "store", "s2"))).isTrue();
        assertThat(north.matches(Map.of("region", "south"))).isFalse();
        assertThat(north.matches(Map.of())).isFalse();
        assertThat(Cohort.ROOT.matches(Map.of("region", "south"))).isTrue();
    }
}
