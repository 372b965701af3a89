package com.z254.cxlens.radar.api.v1;

import com.z254.cxlens.radar.api.dto.IncidentDto;
import com.z254.cxlens.radar.api.dto.IncidentListResponse;
import com.z254.cxlens.radar.api.mapper.IncidentMapper;
import com.z254.cxlens.radar.domain.model.Incident;
import com.z254.cxlens.radar.domain.model.Severity;
import com.z254.cxlens.radar.domain.service.IncidentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;

/**
 * REST API controller for incident management.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/incidents")
@Tag(name = "Incidents", description = "Incident management and querying")
public class IncidentController {

    private final IncidentService incidentService;

    public IncidentController(IncidentService incidentService) {
        this.incidentService = incidentService;
    }

    @GetMapping
    @Operation(summary = "List incidents",
               description = "List incidents ranked by severity and magnitude, with optional filters")
    public Mono<ResponseEntity<IncidentListResponse>> listIncidents(
            @Parameter(description = "Filter by status (NEW, INVESTIGATING, RESOLVED)")
            @RequestParam(required = false) String status,
            @Parameter(description = "Filter by severity (HIGH, MEDIUM, LOW)")
            @RequestParam(required = false) String severity,
            @Parameter(description = "Filter by metric name")
            @RequestParam(required = false) String metric,
            @Parameter(description = "Maximum number of incidents")
            @RequestParam(required = false) Integer limit) {

        return Mono.fromCallable(() -> {
            List<IncidentDto> incidents = incidentService.listIncidents(
                            status != null ? Incident.Status.valueOf(status.toUpperCase(Locale.ROOT)) : null,
                            severity != null ? Severity.valueOf(severity.toUpperCase(Locale.ROOT)) : null,
                            metric,
                            limit).stream()
                    .map(IncidentMapper::toDto)
                    .toList();
            return ResponseEntity.ok(IncidentListResponse.builder()
                    .incidents(incidents)
                    .total(incidents.size())
                    .build());
        });
    }

    @GetMapping("/summary")
    @Operation(summary = "Incident summary", description = "Incident counts by status and severity")
    public Mono<ResponseEntity<IncidentService.IncidentSummary>> summary() {
        return Mono.fromCallable(() -> ResponseEntity.ok(incidentService.summary()));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get incident", description = "Get incident details by ID")
    public Mono<ResponseEntity<IncidentDto>> getIncident(
            @Parameter(description = "Incident ID") @PathVariable String id) {

        return Mono.justOrEmpty(incidentService.getIncident(id))
                .map(IncidentMapper::toDto)
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/{id}/timeline")
    @Operation(summary = "Get incident timeline", description = "Get timeline events for an incident")
    public Mono<ResponseEntity<List<Incident.TimelineEvent>>> getIncidentTimeline(
            @Parameter(description = "Incident ID") @PathVariable String id) {

        return Mono.justOrEmpty(incidentService.getIncident(id))
                .map(incident -> ResponseEntity.ok(List.copyOf(incident.getTimeline())))
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @PostMapping("/{id}/status")
    @Operation(summary = "Update status",
               description = "Move an incident forward: NEW -> INVESTIGATING -> RESOLVED")
    public Mono<ResponseEntity<IncidentDto>> updateStatus(
            @Parameter(description = "Incident ID") @PathVariable String id,
            @Valid @RequestBody StatusRequest request) {

        return Mono.fromCallable(() -> {
            Incident.Status next = Incident.Status.valueOf(request.getStatus().toUpperCase(Locale.ROOT));
            return ResponseEntity.ok(IncidentMapper.toDto(incidentService.transition(id, next)));
        });
    }

    // ========== Request DTOs ==========

    @lombok.Data
    public static class StatusRequest {
        @NotNull
        private String status;
    }
}
