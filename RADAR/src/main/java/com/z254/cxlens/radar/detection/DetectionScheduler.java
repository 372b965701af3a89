package com.z254.cxlens.radar.detection;

import com.z254.cxlens.radar.config.RadarProperties;
import com.z254.cxlens.radar.domain.model.TimeRange;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Periodic detection pass over the configured lookback, enabled with {@code radar.schedule.enabled}.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "radar.schedule", name = "enabled", havingValue = "true")
public class DetectionScheduler {

    private final DetectionPipeline pipeline;
    private final RadarProperties properties;
    private final Clock clock;

    public DetectionScheduler(DetectionPipeline pipeline, RadarProperties properties, Clock clock) {
        this.pipeline = pipeline;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(cron = "${radar.schedule.cron:0 0 * * * *}")
    public void scheduledPass() {
        TimeRange range = TimeRange.lookback(clock.instant(), properties.getSchedule().getLookback());
        log.info("Starting scheduled detection pass over {}", range);
        pipeline.runPass(range)
                .collectList()
                .subscribe(
                        incidents -> log.info("Scheduled pass produced {} incidents", incidents.size()),
                        error -> log.error("Scheduled detection pass failed", error));
    }
}
