package com.z254.cxlens.radar.api.v1;

import com.z254.cxlens.radar.api.dto.RcaReportDto;
import com.z254.cxlens.radar.api.mapper.RcaReportMapper;
import com.z254.cxlens.radar.domain.model.Incident;
import com.z254.cxlens.radar.domain.service.IncidentService;
import com.z254.cxlens.radar.rca.RcaReportFormatter;
import com.z254.cxlens.radar.rca.RootCauseAnalyzer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

/**
 * REST API controller for Root Cause Analysis operations.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/rca")
@Tag(name = "RCA", description = "Root Cause Analysis operations")
public class RcaController {

    private final RootCauseAnalyzer rootCauseAnalyzer;
    private final RcaReportFormatter reportFormatter;
    private final IncidentService incidentService;

    public RcaController(RootCauseAnalyzer rootCauseAnalyzer,
                         RcaReportFormatter reportFormatter,
                         IncidentService incidentService) {
        this.rootCauseAnalyzer = rootCauseAnalyzer;
        this.reportFormatter = reportFormatter;
        this.incidentService = incidentService;
    }

    @PostMapping("/{incidentId}")
    @Operation(summary = "Run RCA", description = "Run a fresh root cause analysis for an incident")
    public Mono<ResponseEntity<RcaReportDto>> runAnalysis(
            @Parameter(description = "Incident ID") @PathVariable String incidentId) {

        log.info("Manual RCA triggered for incident: {}", incidentId);
        return Mono.fromCallable(() -> incidentService.requireIncident(incidentId))
                .flatMap(rootCauseAnalyzer::analyze)
                .map(RcaReportMapper::toDto)
                .map(ResponseEntity::ok);
    }

    @GetMapping("/{incidentId}")
    @Operation(summary = "Get RCA report",
               description = "Cached report for the incident's current revision, or a fresh analysis")
    public Mono<ResponseEntity<RcaReportDto>> getReport(
            @Parameter(description = "Incident ID") @PathVariable String incidentId) {

        return Mono.fromCallable(() -> incidentService.requireIncident(incidentId))
                .flatMap(rootCauseAnalyzer::getOrAnalyze)
                .map(RcaReportMapper::toDto)
                .map(ResponseEntity::ok);
    }

    @GetMapping(value = "/{incidentId}/text", produces = MediaType.TEXT_PLAIN_VALUE)
    @Operation(summary = "Get RCA report as text", description = "Plain-text rendering of the RCA report")
    public Mono<ResponseEntity<String>> getReportText(
            @Parameter(description = "Incident ID") @PathVariable String incidentId) {

        return Mono.fromCallable(() -> incidentService.requireIncident(incidentId))
                .flatMap(rootCauseAnalyzer::getOrAnalyze)
                .map(reportFormatter::format)
                .map(ResponseEntity::ok);
    }
}
