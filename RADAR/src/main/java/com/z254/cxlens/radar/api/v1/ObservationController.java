package com.z254.cxlens.radar.api.v1;

import com.z254.cxlens.radar.domain.model.OrderObservation;
import com.z254.cxlens.radar.metrics.InMemoryObservationStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * REST API controller for order observation ingestion.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/observations")
@Tag(name = "Observations", description = "Order observation ingestion")
public class ObservationController {

    private final InMemoryObservationStore observationStore;

    public ObservationController(InMemoryObservationStore observationStore) {
        this.observationStore = observationStore;
    }

    @PostMapping
    @Operation(summary = "Ingest observations",
               description = "Store order-level observations; re-sent orders replace earlier copies")
    public Mono<ResponseEntity<IngestResponse>> ingest(@RequestBody List<OrderObservation> observations) {
        return Mono.fromCallable(() -> {
            int accepted = observationStore.ingest(observations);
            log.info("Ingested {} of {} observations", accepted, observations.size());
            return ResponseEntity.ok(IngestResponse.builder()
                    .received(observations.size())
                    .accepted(accepted)
                    .stored(observationStore.size())
                    .build());
        });
    }

    @lombok.Data
    @lombok.Builder
    public static class IngestResponse {
        private int received;
        private int accepted;
        private int stored;
    }
}
