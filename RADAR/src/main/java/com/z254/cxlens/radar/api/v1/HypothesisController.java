package com.z254.cxlens.radar.api.v1;

import com.z254.cxlens.radar.domain.model.CxMetric;
import com.z254.cxlens.radar.domain.model.Hypothesis;
import com.z254.cxlens.radar.domain.model.HypothesisCategory;
import com.z254.cxlens.radar.rca.HypothesisLibrary;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;

/**
 * REST API controller for the causal hypothesis catalog.
 */
@RestController
@RequestMapping("/api/v1/hypotheses")
@Tag(name = "Hypotheses", description = "Causal hypothesis catalog")
public class HypothesisController {

    private final HypothesisLibrary hypothesisLibrary;

    public HypothesisController(HypothesisLibrary hypothesisLibrary) {
        this.hypothesisLibrary = hypothesisLibrary;
    }

    @GetMapping
    @Operation(summary = "List hypotheses",
               description = "List catalog hypotheses, optionally those relevant to a metric or in a category")
    public Mono<ResponseEntity<List<Hypothesis>>> listHypotheses(
            @Parameter(description = "Only hypotheses relevant to this metric")
            @RequestParam(required = false) String metric,
            @Parameter(description = "Filter by category")
            @RequestParam(required = false) String category) {

        return Mono.fromCallable(() -> {
            List<Hypothesis> hypotheses = metric != null
                    ? hypothesisLibrary.relevantTo(CxMetric.fromName(metric))
                    : List.copyOf(hypothesisLibrary.all());
            if (category != null) {
                HypothesisCategory wanted = HypothesisCategory.valueOf(category.toUpperCase(Locale.ROOT));
                hypotheses = hypotheses.stream().filter(h -> h.getCategory() == wanted).toList();
            }
            return ResponseEntity.ok(hypotheses);
        });
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get hypothesis", description = "Get a catalog hypothesis by ID")
    public Mono<ResponseEntity<Hypothesis>> getHypothesis(
            @Parameter(description = "Hypothesis ID") @PathVariable String id) {

        return Mono.justOrEmpty(hypothesisLibrary.get(id))
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }
}
