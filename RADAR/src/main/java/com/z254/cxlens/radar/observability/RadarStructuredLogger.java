package com.z254.cxlens.radar.observability;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured logging utility for the RADAR service.
 * <p>
 * Emits machine-readable domain events with MDC context (incident, metric,
 * cohort, hypothesis) and a {@code data={...}} suffix.
 */
@Slf4j
@Component
public class RadarStructuredLogger {

    // MDC keys
    public static final String MDC_INCIDENT_ID = "incidentId";
    public static final String MDC_METRIC = "metric";
    public static final String MDC_COHORT = "cohort";
    public static final String MDC_HYPOTHESIS_ID = "hypothesisId";

    /**
     * Log a detection outcome for one metric and cohort.
     */
    public void logDetectionEvent(String metric, String cohort, DetectionEventType eventType,
                                  String message, Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_METRIC, metric, MDC_COHORT, cohort))) {
            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("event", eventType.name());
            logData.put("metric", metric);
            logData.put("cohort", cohort);
            if (details != null) {
                logData.putAll(details);
            }

            switch (eventType) {
                case ANOMALY_DETECTED -> log.info("{} | data={}", message, formatLogData(logData));
                case SERIES_REJECTED -> log.warn("{} | data={}", message, formatLogData(logData));
                case NO_ANOMALY -> log.debug("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log an incident lifecycle event.
     */
    public void logIncidentEvent(String incidentId, IncidentEventType eventType,
                                 String message, Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_INCIDENT_ID, incidentId))) {
            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("event", eventType.name());
            logData.put("incidentId", incidentId);
            if (details != null) {
                logData.putAll(details);
            }

            switch (eventType) {
                case CREATED, STATUS_CHANGED -> log.info("{} | data={}", message, formatLogData(logData));
                case UPDATED -> log.debug("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log an RCA event.
     */
    public void logRcaEvent(String incidentId, String hypothesisId, RcaEventType eventType,
                            String message, Map<String, Object> details) {
        try (var scope = withContext(Map.of(
                MDC_INCIDENT_ID, incidentId,
                MDC_HYPOTHESIS_ID, hypothesisId != null ? hypothesisId : ""))) {

            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("event", eventType.name());
            logData.put("incidentId", incidentId);
            if (hypothesisId != null) {
                logData.put("hypothesisId", hypothesisId);
            }
            if (details != null) {
                logData.putAll(details);
            }

            switch (eventType) {
                case ANALYSIS_STARTED, ANALYSIS_COMPLETED ->
                        log.info("{} | data={}", message, formatLogData(logData));
                case HYPOTHESIS_TESTED -> log.debug("{} | data={}", message, formatLogData(logData));
                case HYPOTHESIS_TIMED_OUT, LOW_CONFIDENCE, ANALYSIS_FAILED ->
                        log.warn("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Set MDC context.
     */
    public MDCScope withContext(Map<String, String> context) {
        context.forEach(MDC::put);
        return new MDCScope(context.keySet().toArray(new String[0]));
    }

    private String formatLogData(Map<String, Object> data) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            if (!first) sb.append(", ");
            first = false;

            sb.append("\"").append(entry.getKey()).append("\": ");
            Object value = entry.getValue();
            if (value == null) {
                sb.append("null");
            } else if (value instanceof Number || value instanceof Boolean) {
                sb.append(value);
            } else {
                sb.append("\"").append(escapeJson(value.toString())).append("\"");
            }
        }
        sb.append("}");
        return sb.toString();
    }

    private String escapeJson(String value) {
        return value.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n");
    }

    // ========== Event Type Enums ==========

    public enum DetectionEventType {
        ANOMALY_DETECTED, NO_ANOMALY, SERIES_REJECTED
    }

    public enum IncidentEventType {
        CREATED, UPDATED, STATUS_CHANGED
    }

    public enum RcaEventType {
        ANALYSIS_STARTED, HYPOTHESIS_TESTED, HYPOTHESIS_TIMED_OUT,
        ANALYSIS_COMPLETED, ANALYSIS_FAILED, LOW_CONFIDENCE
    }

    /**
     * Auto-closeable MDC scope for cleanup.
     */
    public static class MDCScope implements AutoCloseable {
        private final String[] keys;

        public MDCScope(String... keys) {
            this.keys = keys;
        }

        @Override
        public void close() {
            for (String key : keys) {
                MDC.remove(key);
            }
        }
    }
}
