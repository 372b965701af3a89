package com.z254.cxlens.radar.api.v1;

import com.z254.cxlens.radar.api.dto.IncidentDto;
import com.z254.cxlens.radar.api.mapper.IncidentMapper;
import com.z254.cxlens.radar.config.RadarProperties;
import com.z254.cxlens.radar.detection.DetectionPipeline;
import com.z254.cxlens.radar.domain.model.Cohort;
import com.z254.cxlens.radar.domain.model.TimeRange;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * REST API controller for anomaly detection runs.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/detection")
@Tag(name = "Detection", description = "Anomaly detection runs")
public class DetectionController {

    private final DetectionPipeline detectionPipeline;
    private final RadarProperties radarProperties;
    private final Clock clock;

    public DetectionController(DetectionPipeline detectionPipeline,
                               RadarProperties radarProperties,
                               Clock clock) {
        this.detectionPipeline = detectionPipeline;
        this.radarProperties = radarProperties;
        this.clock = clock;
    }

    @PostMapping("/run")
    @Operation(summary = "Run detection",
               description = "Detect an anomaly on the latest point of one metric and cohort")
    public Mono<ResponseEntity<DetectionResponse>> runDetection(@Valid @RequestBody DetectionRequest request) {
        TimeRange range = TimeRange.of(request.getStart(), request.getEnd());
        Cohort cohort = Cohort.of(request.getCohort());
        log.info("Detection requested: metric={}, cohort={}, range={}", request.getMetric(), cohort, range);

        return Mono.fromCallable(() -> detectionPipeline.runDetection(request.getMetric(), cohort, range))
                .subscribeOn(Schedulers.boundedElastic())
                .map(found -> ResponseEntity.ok(DetectionResponse.builder()
                        .anomaly(found.isPresent())
                        .incident(found.map(IncidentMapper::toDto).orElse(null))
                        .build()));
    }

    @PostMapping("/pass")
    @Operation(summary = "Run detection pass",
               description = "Run detection for every configured metric over the root cohort and the given cohorts")
    public Mono<ResponseEntity<PassResponse>> runPass(@RequestBody(required = false) PassRequest request) {
        Instant end = request != null && request.getEnd() != null ? request.getEnd() : clock.instant();
        Instant start = request != null && request.getStart() != null
                ? request.getStart()
                : end.minus(radarProperties.getSchedule().getLookback());
        List<Cohort> cohorts = request == null || request.getCohorts() == null
                ? List.of(Cohort.ROOT)
                : request.getCohorts().stream().map(Cohort::of).toList();
        TimeRange range = TimeRange.of(start, end);

        return detectionPipeline.runPass(range, cohorts)
                .map(IncidentMapper::toDto)
                .collectList()
                .map(incidents -> ResponseEntity.ok(PassResponse.builder()
                        .start(start)
                        .end(end)
                        .metrics(radarProperties.getDetection().getMetrics())
                        .cohortsChecked(cohorts.size())
                        .incidents(incidents)
                        .build()));
    }

    // ========== Request/Response DTOs ==========

    @lombok.Data
    public static class DetectionRequest {
        @NotBlank
        private String metric;
        private Map<String, String> cohort;
        @NotNull
        private Instant start;
        @NotNull
        private Instant end;
    }

    @lombok.Data
    @lombok.Builder
    public static class DetectionResponse {
        private boolean anomaly;
        private IncidentDto incident;
    }

    @lombok.Data
    public static class PassRequest {
        private Instant start;
        private Instant end;
        private List<Map<String, String>> cohorts;
    }

    @lombok.Data
    @lombok.Builder
    public static class PassResponse {
        private Instant start;
        private Instant end;
        private List<String> metrics;
        private int cohortsChecked;
        private List<IncidentDto> incidents;
    }
}
