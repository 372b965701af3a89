package com.z254.cxlens.radar.kafka;

import com.z254.cxlens.radar.domain.model.Incident;
import com.z254.cxlens.radar.domain.model.RcaReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Publisher used when Kafka publishing is disabled; records the events in the log only.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "radar.kafka", name = "enabled", havingValue = "false", matchIfMissing = true)
public class LoggingRadarEventPublisher implements RadarEventPublisher {

    @Override
    public void publishIncident(Incident incident, boolean created) {
        log.debug("Incident {} {} (kafka disabled): {}", incident.getId(),
                created ? "created" : "updated", incident.getDescription());
    }

    @Override
    public void publishReport(RcaReport report) {
        log.debug("RCA report for {} ready (kafka disabled): {}", report.getIncidentId(), report.getSummary());
    }
}
