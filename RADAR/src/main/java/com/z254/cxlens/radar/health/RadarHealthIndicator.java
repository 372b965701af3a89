package com.z254.cxlens.radar.health;

import com.z254.cxlens.radar.config.RadarProperties;
import com.z254.cxlens.radar.domain.model.Incident;
import com.z254.cxlens.radar.domain.model.Severity;
import com.z254.cxlens.radar.domain.service.IncidentService;
import com.z254.cxlens.radar.rca.RcaReportCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Health indicator for RADAR service.
 * <p>
 * Reports on:
 * <ul>
 *     <li>Open incidents, by severity</li>
 *     <li>RCA report cache occupancy</li>
 *     <li>Detection and RCA configuration in effect</li>
 * </ul>
 */
@Slf4j
@Component
public class RadarHealthIndicator implements ReactiveHealthIndicator {

    private final IncidentService incidentService;
    private final RcaReportCache reportCache;
    private final RadarProperties radarProperties;

    public RadarHealthIndicator(IncidentService incidentService,
                                RcaReportCache reportCache,
                                RadarProperties radarProperties) {
        this.incidentService = incidentService;
        this.reportCache = reportCache;
        this.radarProperties = radarProperties;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(this::checkHealth)
                .onErrorResume(e -> {
                    log.error("Health check failed", e);
                    return Mono.just(Health.down().withException(e).build());
                });
    }

    private Health checkHealth() {
        Map<String, Object> details = new HashMap<>();

        List<Incident> open = incidentService.rankOpenIncidents();
        Map<Severity, Long> bySeverity = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            bySeverity.put(severity, 0L);
        }
        open.forEach(incident -> bySeverity.merge(incident.getSeverity(), 1L, Long::sum));

        details.put("openIncidents", open.size());
        details.put("openIncidentsBySeverity", bySeverity);
        details.put("cachedReports", reportCache.size());

        RadarProperties.Detection detection = radarProperties.getDetection();
        details.put("detection.metrics", detection.getMetrics());
        details.put("detection.bucket", detection.getBucket().toString());
        details.put("detection.consensusVotes", detection.getConsensusVotes());
        details.put("rca.hypothesisTimeout", radarProperties.getRca().getHypothesisTimeout().toString());
        details.put("schedule.enabled", radarProperties.getSchedule().isEnabled());
        details.put("kafka.enabled", radarProperties.getKafka().isEnabled());

        return Health.up()
                .withDetails(details)
                .build();
    }
}
