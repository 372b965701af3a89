package com.z254.cxlens.radar.kafka;

import com.z254.cxlens.radar.config.RadarProperties;
import com.z254.cxlens.radar.domain.model.Incident;
import com.z254.cxlens.radar.domain.model.RcaReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Kafka producer for incident and RCA report events, serialized as JSON.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "radar.kafka", name = "enabled", havingValue = "true")
public class KafkaRadarEventPublisher implements RadarEventPublisher {

    private final KafkaTemplate<String, Object> radarKafkaTemplate;
    private final RadarProperties radarProperties;

    public KafkaRadarEventPublisher(KafkaTemplate<String, Object> radarKafkaTemplate,
                                    RadarProperties radarProperties) {
        this.radarKafkaTemplate = radarKafkaTemplate;
        this.radarProperties = radarProperties;
    }

    @Override
    public void publishIncident(Incident incident, boolean created) {
        String topic = radarProperties.getKafka().getTopics().getIncidents();
        radarKafkaTemplate.send(topic, incident.getId(), incident)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.error("Failed to publish incident: incidentId={}, error={}",
                                incident.getId(), ex.getMessage());
                    } else {
                        log.info("Published incident {}: incidentId={}, topic={}, partition={}",
                                created ? "created" : "update", incident.getId(), topic,
                                result.getRecordMetadata().partition());
                    }
                });
    }

    @Override
    public void publishReport(RcaReport report) {
        String topic = radarProperties.getKafka().getTopics().getRcaReports();
        radarKafkaTemplate.send(topic, report.getIncidentId(), report)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.error("Failed to publish RCA report: incidentId={}, error={}",
                                report.getIncidentId(), ex.getMessage());
                    } else {
                        log.info("Published RCA report: incidentId={}, topic={}, partition={}",
                                report.getIncidentId(), topic,
                                result.getRecordMetadata().partition());
                    }
                });
    }
}
