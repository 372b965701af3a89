package com.z254.cxlens.radar.rca;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.z254.cxlens.radar.config.RadarProperties;
import com.z254.cxlens.radar.domain.model.Incident;
import com.z254.cxlens.radar.domain.model.RcaReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Local cache of the latest RCA report per incident.
 * <p>
 * A cached report is only served while it matches the incident's revision, so a
 * re-detection that refreshes the incident invalidates it.
 */
@Slf4j
@Component
public class RcaReportCache {

    private final Cache<String, RcaReport> reports;

    @Autowired
    public RcaReportCache(RadarProperties properties) {
        this(properties.getRca().getReportCacheTtl(), properties.getRca().getReportCacheMaxSize());
    }

    public RcaReportCache(Duration ttl, long maxSize) {
        this.reports = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maxSize)
                .recordStats()
                .build();
        log.info("Initialized RCA report cache: ttl={}, maxSize={}", ttl, maxSize);
    }

    public void put(RcaReport report) {
        reports.put(report.getIncidentId(), report);
    }

    /**
     * Cached report for the incident's current revision.
     */
    public Optional<RcaReport> get(Incident incident) {
        RcaReport report = reports.getIfPresent(incident.getId());
        if (report == null) {
            return Optional.empty();
        }
        if (report.getIncidentRevision() != incident.getRevision()) {
            reports.invalidate(incident.getId());
            log.debug("Dropped stale RCA report for {} (revision {} < {})", incident.getId(),
                    report.getIncidentRevision(), incident.getRevision());
            return Optional.empty();
        }
        return Optional.of(report);
    }

    public void invalidate(String incidentId) {
        reports.invalidate(incidentId);
    }

    public long size() {
        return reports.estimatedSize();
    }

    public CacheStats stats() {
        return reports.stats();
    }
}
