package com.z254.cxlens.radar.rca;

import com.z254.cxlens.radar.domain.model.CxMetric;
import com.z254.cxlens.radar.domain.model.EvidenceMethod;
import com.z254.cxlens.radar.domain.model.Hypothesis;
import com.z254.cxlens.radar.domain.model.HypothesisCategory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.z254.cxlens.radar.domain.model.EvidenceMethod.ATTRIBUTION;
import static com.z254.cxlens.radar.domain.model.EvidenceMethod.CORRELATION;
import static com.z254.cxlens.radar.domain.model.EvidenceMethod.DIFF_IN_DIFF;
import static com.z254.cxlens.radar.domain.model.EvidenceMethod.STATISTICAL_TEST;

/**
 * Static catalog of causal hypotheses, loaded once and never mutated.
 * <p>
 * Entries are declared as data; adding a hypothesis is a one-line {@link #register} call.
 */
@Slf4j
@Component
public class HypothesisLibrary {

    private final Map<String, Hypothesis> catalog = new LinkedHashMap<>();

    public HypothesisLibrary() {
        register("low_dasher_availability", "Low Dasher Availability", HypothesisCategory.SUPPLY,
                "Too few available dashers lengthen assignment times and make deliveries late",
                List.of("dasher_wait", "distance", "actual_eta"),
                List.of(ATTRIBUTION, CORRELATION, STATISTICAL_TEST), null);

        register("prep_time_drift", "Merchant Prep-Time Drift", HypothesisCategory.MERCHANT,
                "Merchant preparation time has increased, causing ETA misses",
                List.of("merchant_prep_time", "actual_eta", "promised_eta"),
                List.of(ATTRIBUTION, DIFF_IN_DIFF, CORRELATION, STATISTICAL_TEST), null);

        register("batching_threshold_increase", "Batching Threshold Increase", HypothesisCategory.POLICY,
                "A higher batching threshold adds dasher wait time, lateness and cancellations",
                List.of("batched", "dasher_wait", "actual_eta"),
                List.of(DIFF_IN_DIFF, ATTRIBUTION, CORRELATION, STATISTICAL_TEST), "batched");

        register("inventory_degradation", "Inventory Availability Degradation", HypothesisCategory.INVENTORY,
                "Lower in-stock probability causes substitutions, missing items and refunds",
                List.of("in_stock_prob", "substituted", "missing", "refund_amount"),
                List.of(ATTRIBUTION, CORRELATION, STATISTICAL_TEST), null);

        register("eta_model_bias", "ETA Model Bias", HypothesisCategory.MODEL,
                "The ETA model systematically under-estimates delivery time",
                List.of("eta_error", "promised_eta", "actual_eta"),
                List.of(CORRELATION, STATISTICAL_TEST, DIFF_IN_DIFF), null);

        register("weather_demand_surge", "Weather-Driven Demand Surge", HypothesisCategory.EXTERNAL,
                "Bad weather raises demand and slows deliveries beyond what supply can absorb",
                List.of("weather_severity", "demand_index", "actual_eta"),
                List.of(ATTRIBUTION, CORRELATION, STATISTICAL_TEST), null);

        register("support_backlog", "Support Backlog", HypothesisCategory.OPERATIONAL,
                "A support queue backlog delays issue resolution and pushes customers to cancel",
                List.of("support_wait", "dasher_wait"),
                List.of(ATTRIBUTION, CORRELATION, STATISTICAL_TEST), null);

        log.info("Hypothesis library loaded with {} hypotheses", catalog.size());
    }

    private void register(String id, String name, HypothesisCategory category, String description,
                          List<String> features, List<EvidenceMethod> methods, String treatmentFeature) {
        catalog.put(id, Hypothesis.builder()
                .id(id)
                .name(name)
                .category(category)
                .description(description)
                .implicatedFeatures(features)
                .applicableMethods(methods)
                .treatmentFeature(treatmentFeature)
                .build());
    }

    public Optional<Hypothesis> get(String hypothesisId) {
        return Optional.ofNullable(catalog.get(hypothesisId));
    }

    public Collection<Hypothesis> all() {
        return Collections.unmodifiableCollection(catalog.values());
    }

    public List<Hypothesis> byCategory(HypothesisCategory category) {
        return catalog.values().stream()
                .filter(h -> h.getCategory() == category)
                .toList();
    }

    /**
     * Hypotheses whose category is relevant to the metric, in catalog order.
     */
    public List<Hypothesis> relevantTo(CxMetric metric) {
        return catalog.values().stream()
                .filter(h -> metric.relevantCategories().contains(h.getCategory()))
                .toList();
    }
}
