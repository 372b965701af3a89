package com.z254.cxlens.radar.api.mapper;

import com.z254.cxlens.radar.api.dto.RcaReportDto;
import com.z254.cxlens.radar.domain.model.EvidenceTerm;
import com.z254.cxlens.radar.domain.model.HypothesisTestResult;
import com.z254.cxlens.radar.domain.model.RcaReport;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mapper for RCA report to DTO conversion.
 */
public final class RcaReportMapper {

    private RcaReportMapper() {}

    public static RcaReportDto toDto(RcaReport report) {
        List<RcaReportDto.Cause> causes = new ArrayList<>();
        List<HypothesisTestResult> ranked = report.getRankedCauses();
        for (int i = 0; i < ranked.size(); i++) {
            causes.add(toCause(i + 1, ranked.get(i)));
        }
        return RcaReportDto.builder()
                .incidentId(report.getIncidentId())
                .metricName(report.getMetricName())
                .direction(report.getDirection().name())
                .incidentRevision(report.getIncidentRevision())
                .generatedAt(report.getGeneratedAt())
                .hypothesesTested(report.getHypothesesTested())
                .summary(report.getSummary())
                .narrative(report.getNarrative())
                .rankedCauses(causes)
                .build();
    }

    private static RcaReportDto.Cause toCause(int rank, HypothesisTestResult result) {
        Map<String, RcaReportDto.Evidence> evidence = new LinkedHashMap<>();
        result.getEvidence().forEach((method, term) -> evidence.put(method.key(), toEvidence(term)));
        return RcaReportDto.Cause.builder()
                .rank(rank)
                .hypothesisId(result.getHypothesisId())
                .name(result.getHypothesis().getName())
                .category(result.getHypothesis().getCategory().label())
                .implicatedFeatures(result.getHypothesis().getImplicatedFeatures())
                .confidence(result.getConfidence())
                .impact(result.getImpact())
                .combinedScore(result.getCombinedScore())
                .attributionScore(result.getAttributionScore())
                .diffInDiffScore(result.getDiffInDiffScore())
                .correlationScore(result.getCorrelationScore())
                .statisticalScore(result.getStatisticalScore())
                .evidence(evidence)
                .build();
    }

    private static RcaReportDto.Evidence toEvidence(EvidenceTerm term) {
        return RcaReportDto.Evidence.builder()
                .score(term.getScore())
                .note(term.getNote())
                .details(term.getDetails())
                .build();
    }
}
