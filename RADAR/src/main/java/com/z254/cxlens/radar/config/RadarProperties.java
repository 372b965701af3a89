package com.z254.cxlens.radar.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the RADAR service.
 * <p>
 * Groups settings for:
 * <ul>
 *     <li>Consensus anomaly detection and severity cutoffs</li>
 *     <li>Cohort slicing</li>
 *     <li>Root cause analysis evidence weights and floors</li>
 *     <li>Scheduled detection passes and Kafka publishing</li>
 * </ul>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "radar")
public class RadarProperties {

    @Valid
    private final Detection detection = new Detection();
    @Valid
    private final Slicing slicing = new Slicing();
    @Valid
    private final Rca rca = new Rca();
    @Valid
    private final Schedule schedule = new Schedule();
    @Valid
    private final Kafka kafka = new Kafka();

    /**
     * Anomaly detector configuration.
     */
    @Data
    public static class Detection {
        /** Rolling window used by the Z-score method */
        @Min(2)
        private int zScoreWindow = 30;

        @Positive
        private double zScoreThreshold = 2.5;

        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax("1.0")
        private double ewmaAlpha = 0.3;

        @Positive
        private double ewmaThreshold = 2.0;

        @Min(2)
        private int ewmaMinHistory = 10;

        /** Number of trailing residuals whose spread scales the EWMA residual */
        @Min(2)
        private int ewmaResidualWindow = 10;

        @Min(2)
        private int bayesianMinSegment = 5;

        @Positive
        private double bayesianThreshold = 2.0;

        @Min(1)
        @Max(3)
        private int consensusVotes = 2;

        private double highSeverityPercentile = 5.0;

        private double mediumSeverityPercentile = 10.0;

        /** Granularity of the metric series fed to the detectors */
        private Duration bucket = Duration.ofHours(1);

        /** Metrics checked by a detection pass */
        @NotEmpty
        private List<String> metrics = new ArrayList<>(List.of("cx_score", "on_time_rate", "cancellation_rate"));

        private boolean suppressImprovements = false;
    }

    /**
     * Cohort slicing configuration.
     */
    @Data
    public static class Slicing {
        @Min(1)
        private int minOrderCount = 10;

        @Min(1)
        private int topN = 5;

        @Min(1)
        private int maxSlices = 500;

        @Min(1)
        @Max(2)
        private int maxDimensions = 2;

        @NotEmpty
        private List<String> dimensions = new ArrayList<>(
                List.of("store", "category", "region", "time_of_day", "basket_size"));
    }

    /**
     * Root cause analysis configuration.
     */
    @Data
    public static class Rca {
        @Valid
        private final Weights weights = new Weights();

        @Min(2)
        private int minAttributionSample = 30;

        @Min(3)
        private int minCorrelationPoints = 5;

        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax(value = "1.0", inclusive = false)
        private double significanceLevel = 0.05;

        private double strongCorrelation = 0.7;

        /** Top confidence below this is logged as a low-confidence analysis */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double lowConfidenceThreshold = 0.3;

        /** Relative feature change at which impact saturates at 1.0 */
        @Positive
        private double impactSaturation = 0.5;

        private Duration hypothesisTimeout = Duration.ofSeconds(10);

        private Duration reportCacheTtl = Duration.ofMinutes(30);

        @Min(1)
        private int reportCacheMaxSize = 1000;

        @Min(1)
        private int maxParallelTests = 4;

        /** Designated change timestamps per hypothesis id, required for diff-in-diff */
        private Map<String, Instant> changeEvents = new HashMap<>();

        @Data
        public static class Weights {
            private double attribution = 0.4;
            private double diffInDiff = 0.3;
            private double correlation = 0.2;
            private double statistical = 0.1;
        }
    }

    @Data
    public static class Schedule {
        private boolean enabled = false;

        @NotBlank
        private String cron = "0 0 * * * *";

        private Duration lookback = Duration.ofDays(7);
    }

    @Data
    public static class Kafka {
        private boolean enabled = false;

        private final Topics topics = new Topics();

        @Data
        public static class Topics {
            private String incidents = "radar.incidents.detected";
            private String rcaReports = "radar.rca.reports";
        }
    }
}
