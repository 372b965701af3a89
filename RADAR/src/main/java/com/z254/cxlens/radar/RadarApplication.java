package com.z254.cxlens.radar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

/**
 * RADAR - CX regression detection and root cause analysis for cx-lens.
 *
 * <p>RADAR provides:
 * <ul>
 *   <li>Anomaly detection - Consensus of z-score, EWMA and change-point detectors</li>
 *   <li>Cohort slicing - Localises a regression to the sub-populations driving it</li>
 *   <li>Incident management - Idempotent, forward-only incident lifecycle</li>
 *   <li>Root Cause Analysis (RCA) - Ranks causal hypotheses by evidence and impact</li>
 * </ul>
 *
 * <p>Incidents and RCA reports are published to Kafka for the recommendation layer
 * when {@code radar.kafka.enabled} is set.
 */
@SpringBootApplication
@EnableScheduling
public class RadarApplication {

    public static void main(String[] args) {
        SpringApplication.run(RadarApplication.class, args);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
